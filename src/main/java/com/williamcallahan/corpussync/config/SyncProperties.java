package com.williamcallahan.corpussync.config;

import java.time.Duration;
import java.util.Locale;

/**
 * Reconciler settings bound from {@code app.sync}.
 */
public class SyncProperties {

    private static final int MAX_ATTEMPTS_DEF = 3;
    private static final Duration INITIAL_BACKOFF_DEF = Duration.ofMillis(500);
    private static final Duration FETCH_TIMEOUT_DEF = Duration.ofSeconds(20);
    private static final int ITEM_CONCURRENCY_DEF = 4;
    private static final Duration SCHEDULER_TICK_DEF = Duration.ofSeconds(30);
    private static final String USER_AGENT_DEF = "corpus-sync/0.1";
    private static final String MAX_ATTEMPTS_KEY = "app.sync.max-attempts";
    private static final String INITIAL_BACKOFF_KEY = "app.sync.initial-backoff";
    private static final String FETCH_TIMEOUT_KEY = "app.sync.fetch-timeout";
    private static final String ITEM_CONCURRENCY_KEY = "app.sync.item-concurrency";
    private static final String SCHEDULER_TICK_KEY = "app.sync.scheduler-tick";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";
    private static final String NON_NEG_FMT = "%s must be 0 or greater.";

    private int maxAttempts = MAX_ATTEMPTS_DEF;
    private Duration initialBackoff = INITIAL_BACKOFF_DEF;
    private Duration fetchTimeout = FETCH_TIMEOUT_DEF;
    private int itemConcurrency = ITEM_CONCURRENCY_DEF;
    private boolean schedulerEnabled;
    private Duration schedulerTick = SCHEDULER_TICK_DEF;
    private String userAgent = USER_AGENT_DEF;

    /**
     * Validates reconciler settings.
     */
    public void validateConfiguration() {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, MAX_ATTEMPTS_KEY));
        }
        if (itemConcurrency < 1) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, ITEM_CONCURRENCY_KEY));
        }
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NON_NEG_FMT, INITIAL_BACKOFF_KEY));
        }
        requirePositive(FETCH_TIMEOUT_KEY, fetchTimeout);
        requirePositive(SCHEDULER_TICK_KEY, schedulerTick);
    }

    private static void requirePositive(String key, Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, key));
        }
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

    public Duration getFetchTimeout() {
        return fetchTimeout;
    }

    public void setFetchTimeout(Duration fetchTimeout) {
        this.fetchTimeout = fetchTimeout;
    }

    public int getItemConcurrency() {
        return itemConcurrency;
    }

    public void setItemConcurrency(int itemConcurrency) {
        this.itemConcurrency = itemConcurrency;
    }

    public boolean isSchedulerEnabled() {
        return schedulerEnabled;
    }

    public void setSchedulerEnabled(boolean schedulerEnabled) {
        this.schedulerEnabled = schedulerEnabled;
    }

    public Duration getSchedulerTick() {
        return schedulerTick;
    }

    public void setSchedulerTick(Duration schedulerTick) {
        this.schedulerTick = schedulerTick;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }
}
