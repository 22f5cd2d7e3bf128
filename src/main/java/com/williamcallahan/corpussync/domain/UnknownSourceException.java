package com.williamcallahan.corpussync.domain;

/**
 * Signals a request naming a source that is not configured.
 */
public class UnknownSourceException extends RuntimeException {

    private final String sourceName;

    public UnknownSourceException(String sourceName) {
        super("Unknown source: " + sourceName);
        this.sourceName = sourceName;
    }

    public String sourceName() {
        return sourceName;
    }
}
