package com.williamcallahan.corpussync.domain;

import java.util.Objects;

/**
 * Source-scoped canonical key identifying the same logical item across fetch cycles.
 *
 * @param source configured source name that owns the item
 * @param key canonical key derived from raw source data, such as a document URL or stable ID
 */
public record ItemIdentity(String source, String key) {

    public ItemIdentity {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(key, "key");
        if (source.isBlank()) {
            throw new IllegalArgumentException("source cannot be blank");
        }
        if (key.isBlank()) {
            throw new IllegalArgumentException("key cannot be blank");
        }
    }

    /**
     * Returns a single string form that is unique across sources, used for index document keys.
     */
    public String qualifiedKey() {
        return source + '\u0000' + key;
    }

    @Override
    public String toString() {
        return source + ":" + key;
    }
}
