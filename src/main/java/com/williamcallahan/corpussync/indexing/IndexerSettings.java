package com.williamcallahan.corpussync.indexing;

import com.williamcallahan.corpussync.config.IndexerProperties;
import java.time.Duration;

/**
 * Retry policy applied to each indexing batch.
 *
 * @param maxAttempts attempts per batch, including the first
 * @param initialBackoff wait before the first retry, doubled per attempt
 */
public record IndexerSettings(int maxAttempts, Duration initialBackoff) {

    public static IndexerSettings from(IndexerProperties properties) {
        return new IndexerSettings(properties.getMaxAttempts(), properties.getInitialBackoff());
    }
}
