package com.williamcallahan.corpussync.support;

import io.micrometer.core.instrument.Metrics;
import java.util.Locale;

/**
 * Micrometer counters for the sync, indexing and search pipelines.
 *
 * <p>Counters register on the global registry, which Spring Boot's actuator bridges to the
 * application registry. Tags stay low-cardinality: configured source and collection names plus
 * fixed outcome values.</p>
 */
public final class PipelineMetrics {

    public static final String SYNC_ITEMS = "corpus.sync.items";
    public static final String SYNC_CYCLES = "corpus.sync.cycles";
    public static final String INDEX_BATCHES = "corpus.index.batches";
    public static final String INDEX_BATCH_RETRIES = "corpus.index.batch.retries";
    public static final String SEARCH_REQUESTS = "corpus.search.requests";

    public static final String OUTCOME_COMMITTED = "committed";
    public static final String OUTCOME_FAILED = "failed";
    public static final String OUTCOME_SERVED = "served";
    public static final String OUTCOME_DEGRADED = "degraded";

    private PipelineMetrics() {
    }

    /**
     * Adds a cycle's per-classification item counts for the source.
     */
    public static void recordItems(String source, String classification, long items) {
        Metrics.counter(SYNC_ITEMS, "source", source, "classification", tagValue(classification))
                .increment(items);
    }

    public static void recordCycle(String source, String status) {
        Metrics.counter(SYNC_CYCLES, "source", source, "status", tagValue(status)).increment();
    }

    public static void recordIndexBatch(String collection, String outcome) {
        Metrics.counter(INDEX_BATCHES, "collection", collection, "outcome", outcome).increment();
    }

    /**
     * Counts extra attempts a batch needed beyond the first.
     */
    public static void recordIndexRetries(String collection, int retries) {
        if (retries > 0) {
            Metrics.counter(INDEX_BATCH_RETRIES, "collection", collection).increment(retries);
        }
    }

    public static void recordSearch(String mode, String outcome) {
        Metrics.counter(SEARCH_REQUESTS, "mode", mode, "outcome", outcome).increment();
    }

    private static String tagValue(String raw) {
        return raw.toLowerCase(Locale.ROOT);
    }
}
