package com.williamcallahan.corpussync.sync;

import com.williamcallahan.corpussync.domain.SourceDescriptor;

/**
 * Creates adapters for one fetch strategy.
 */
public interface SourceAdapterFactory {

    /**
     * Strategy name matched against {@code app.sources[].strategy}, lowercase.
     */
    String strategy();

    SourceAdapter create(SourceDescriptor source, SyncSettings settings);
}
