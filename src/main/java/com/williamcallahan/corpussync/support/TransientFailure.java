package com.williamcallahan.corpussync.support;

/**
 * Marks exceptions whose failure is expected to clear on its own, so retrying is worthwhile.
 */
public interface TransientFailure {}
