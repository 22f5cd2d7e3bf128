package com.williamcallahan.corpussync.sync;

import com.williamcallahan.corpussync.support.TransientFailure;

/**
 * Signals an upstream failure expected to clear on its own: network errors, timeouts,
 * rate limiting or server errors. Retried with backoff.
 */
public class TransientFetchException extends SourceFetchException implements TransientFailure {

    public TransientFetchException(String message) {
        super(message);
    }

    public TransientFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
