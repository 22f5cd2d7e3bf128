package com.williamcallahan.corpussync.indexing;

import com.williamcallahan.corpussync.support.TransientFailure;

/**
 * Signals that the embedding provider is unavailable or returned an invalid response.
 *
 * <p>Callers retry the whole batch; no synthetic vector is ever substituted.</p>
 */
public class EmbeddingServiceUnavailableException extends RuntimeException implements TransientFailure {

    public EmbeddingServiceUnavailableException(String message) {
        super(message);
    }

    public EmbeddingServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
