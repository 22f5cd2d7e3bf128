package com.williamcallahan.corpussync.sync;

/**
 * Signals an item whose content cannot be parsed or fingerprinted. The item is skipped for the
 * cycle without retry.
 */
public class MalformedItemException extends RuntimeException {

    public MalformedItemException(String message) {
        super(message);
    }

    public MalformedItemException(String message, Throwable cause) {
        super(message, cause);
    }
}
