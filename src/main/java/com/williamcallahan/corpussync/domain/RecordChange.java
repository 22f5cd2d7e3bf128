package com.williamcallahan.corpussync.domain;

import java.util.Objects;

/**
 * One transition of a record into or out of the "currently valid" state within a collection.
 *
 * @param sequence per-collection, strictly increasing sequence number
 * @param collection collection the change belongs to
 * @param recordId record that changed state
 * @param identity identity of the record
 * @param kind direction of the transition
 */
public record RecordChange(long sequence, String collection, String recordId, ItemIdentity identity, Kind kind) {

    public RecordChange {
        Objects.requireNonNull(collection, "collection");
        Objects.requireNonNull(recordId, "recordId");
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(kind, "kind");
        if (sequence <= 0) {
            throw new IllegalArgumentException("sequence must be positive");
        }
    }

    public enum Kind {
        BECAME_CURRENT,
        BECAME_NON_CURRENT
    }
}
