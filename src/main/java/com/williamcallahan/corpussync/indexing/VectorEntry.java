package com.williamcallahan.corpussync.indexing;

import com.williamcallahan.corpussync.domain.ItemIdentity;
import java.util.Arrays;
import java.util.Objects;

/**
 * One vector index entry; exactly one exists per identity per collection.
 *
 * @param identity item identity the entry is keyed by
 * @param recordId id of the record version the vector was computed from
 * @param vector dense embedding
 * @param title record title, kept as payload
 * @param location record location, kept as payload
 */
public record VectorEntry(ItemIdentity identity, String recordId, float[] vector, String title, String location) {

    public VectorEntry {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(recordId, "recordId");
        Objects.requireNonNull(vector, "vector");
        title = title == null ? "" : title;
        location = location == null ? "" : location;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (other == null || getClass() != other.getClass()) return false;
        VectorEntry that = (VectorEntry) other;
        return identity.equals(that.identity)
                && recordId.equals(that.recordId)
                && Arrays.equals(vector, that.vector)
                && title.equals(that.title)
                && location.equals(that.location);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(identity, recordId, title, location);
        return 31 * result + Arrays.hashCode(vector);
    }

    @Override
    public String toString() {
        return "VectorEntry{identity=" + identity + ", recordId=" + recordId + ", dimensions=" + vector.length + '}';
    }
}
