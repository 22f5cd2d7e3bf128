package com.williamcallahan.corpussync.sync;

/**
 * Signals that an upstream source refused or failed a request in a way a retry will not fix,
 * such as a 404 for the listing URL.
 */
public class SourceFetchException extends RuntimeException {

    public SourceFetchException(String message) {
        super(message);
    }

    public SourceFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
