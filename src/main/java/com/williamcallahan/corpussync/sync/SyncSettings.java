package com.williamcallahan.corpussync.sync;

import com.williamcallahan.corpussync.config.SyncProperties;
import java.time.Duration;

/**
 * Reconciler tuning applied to every cycle.
 *
 * @param maxAttempts attempts per upstream call, including the first
 * @param initialBackoff wait before the first retry, doubled per attempt
 * @param fetchTimeout timeout of a single upstream call
 * @param itemConcurrency items processed in parallel within one cycle
 * @param userAgent user agent sent by the HTTP adapters
 */
public record SyncSettings(
        int maxAttempts, Duration initialBackoff, Duration fetchTimeout, int itemConcurrency, String userAgent) {

    public static SyncSettings from(SyncProperties properties) {
        return new SyncSettings(
                properties.getMaxAttempts(),
                properties.getInitialBackoff(),
                properties.getFetchTimeout(),
                properties.getItemConcurrency(),
                properties.getUserAgent());
    }
}
