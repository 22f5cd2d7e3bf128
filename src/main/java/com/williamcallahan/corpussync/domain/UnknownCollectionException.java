package com.williamcallahan.corpussync.domain;

/**
 * Signals a request naming a collection that is not configured.
 */
public class UnknownCollectionException extends RuntimeException {

    private final String collectionName;

    public UnknownCollectionException(String collectionName) {
        super("Unknown collection: " + collectionName);
        this.collectionName = collectionName;
    }

    public String collectionName() {
        return collectionName;
    }
}
