package com.williamcallahan.corpussync.indexing;

import com.williamcallahan.corpussync.support.TransientFailure;

/**
 * Raised when a vector or lexical index backend cannot complete a read or write.
 */
public class IndexBackendUnavailableException extends RuntimeException implements TransientFailure {

    private final String backend;

    public IndexBackendUnavailableException(String backend, String message, Throwable cause) {
        super(message, cause);
        this.backend = backend;
    }

    public IndexBackendUnavailableException(String backend, String message) {
        this(backend, message, null);
    }

    public String backend() {
        return backend;
    }
}
