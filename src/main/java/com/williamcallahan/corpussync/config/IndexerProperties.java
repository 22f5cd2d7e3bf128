package com.williamcallahan.corpussync.config;

import java.time.Duration;
import java.util.Locale;

/**
 * Indexer settings bound from {@code app.indexer}.
 */
public class IndexerProperties {

    private static final int BATCH_SIZE_DEF = 64;
    private static final int MAX_ATTEMPTS_DEF = 3;
    private static final Duration INITIAL_BACKOFF_DEF = Duration.ofSeconds(1);
    private static final Duration POLL_INTERVAL_DEF = Duration.ofSeconds(60);
    /** Largest batch size accepted from configuration or callers of the indexing endpoint. */
    public static final int MAX_BATCH_SIZE = 1_000;
    private static final String BATCH_SIZE_KEY = "app.indexer.batch-size";
    private static final String MAX_ATTEMPTS_KEY = "app.indexer.max-attempts";
    private static final String POLL_INTERVAL_KEY = "app.indexer.poll-interval";
    private static final String BATCH_RANGE_FMT = "%s must be between 1 and %d.";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";

    private int batchSize = BATCH_SIZE_DEF;
    private int maxAttempts = MAX_ATTEMPTS_DEF;
    private Duration initialBackoff = INITIAL_BACKOFF_DEF;
    private boolean indexOnCycleCompletion = true;
    private boolean pollEnabled;
    private Duration pollInterval = POLL_INTERVAL_DEF;

    /**
     * Validates indexer settings.
     */
    public void validateConfiguration() {
        if (batchSize < 1 || batchSize > MAX_BATCH_SIZE) {
            throw new IllegalArgumentException(
                    String.format(Locale.ROOT, BATCH_RANGE_FMT, BATCH_SIZE_KEY, MAX_BATCH_SIZE));
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, MAX_ATTEMPTS_KEY));
        }
        if (pollInterval == null || pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, POLL_INTERVAL_KEY));
        }
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getInitialBackoff() {
        return initialBackoff;
    }

    public void setInitialBackoff(Duration initialBackoff) {
        this.initialBackoff = initialBackoff;
    }

    public boolean isIndexOnCycleCompletion() {
        return indexOnCycleCompletion;
    }

    public void setIndexOnCycleCompletion(boolean indexOnCycleCompletion) {
        this.indexOnCycleCompletion = indexOnCycleCompletion;
    }

    public boolean isPollEnabled() {
        return pollEnabled;
    }

    public void setPollEnabled(boolean pollEnabled) {
        this.pollEnabled = pollEnabled;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }
}
