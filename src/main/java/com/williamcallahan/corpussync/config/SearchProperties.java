package com.williamcallahan.corpussync.config;

import java.time.Duration;
import java.util.Locale;

/**
 * Search gateway settings bound from {@code app.search}.
 */
public class SearchProperties {

    private static final int RRF_K_DEF = 60;
    private static final int CANDIDATE_LIMIT_DEF = 50;
    private static final int MAX_LIMIT_DEF = 100;
    private static final int SNIPPET_LENGTH_DEF = 240;
    private static final int QUERY_CACHE_SIZE_DEF = 1_000;
    private static final String RRF_K_KEY = "app.search.rrf-k";
    private static final String CANDIDATE_LIMIT_KEY = "app.search.candidate-limit";
    private static final String MAX_LIMIT_KEY = "app.search.max-limit";
    private static final String SNIPPET_LENGTH_KEY = "app.search.snippet-length";
    private static final String QUERY_TIMEOUT_KEY = "app.search.query-timeout";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";

    private int rrfK = RRF_K_DEF;
    private int candidateLimit = CANDIDATE_LIMIT_DEF;
    private int maxLimit = MAX_LIMIT_DEF;
    private int snippetLength = SNIPPET_LENGTH_DEF;
    private Duration queryTimeout = Duration.ofSeconds(5);
    private int queryCacheSize = QUERY_CACHE_SIZE_DEF;
    private Duration queryCacheTtl = Duration.ofMinutes(10);

    /**
     * Validates search settings.
     */
    public void validateConfiguration() {
        requirePositive(RRF_K_KEY, rrfK);
        requirePositive(CANDIDATE_LIMIT_KEY, candidateLimit);
        requirePositive(MAX_LIMIT_KEY, maxLimit);
        requirePositive(SNIPPET_LENGTH_KEY, snippetLength);
        if (queryTimeout == null || queryTimeout.isZero() || queryTimeout.isNegative()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, QUERY_TIMEOUT_KEY));
        }
    }

    private static void requirePositive(String key, int value) {
        if (value < 1) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, key));
        }
    }

    public int getRrfK() {
        return rrfK;
    }

    public void setRrfK(int rrfK) {
        this.rrfK = rrfK;
    }

    public int getCandidateLimit() {
        return candidateLimit;
    }

    public void setCandidateLimit(int candidateLimit) {
        this.candidateLimit = candidateLimit;
    }

    public int getMaxLimit() {
        return maxLimit;
    }

    public void setMaxLimit(int maxLimit) {
        this.maxLimit = maxLimit;
    }

    public int getSnippetLength() {
        return snippetLength;
    }

    public void setSnippetLength(int snippetLength) {
        this.snippetLength = snippetLength;
    }

    public Duration getQueryTimeout() {
        return queryTimeout;
    }

    public void setQueryTimeout(Duration queryTimeout) {
        this.queryTimeout = queryTimeout;
    }

    public int getQueryCacheSize() {
        return queryCacheSize;
    }

    public void setQueryCacheSize(int queryCacheSize) {
        this.queryCacheSize = queryCacheSize;
    }

    public Duration getQueryCacheTtl() {
        return queryCacheTtl;
    }

    public void setQueryCacheTtl(Duration queryCacheTtl) {
        this.queryCacheTtl = queryCacheTtl;
    }
}
