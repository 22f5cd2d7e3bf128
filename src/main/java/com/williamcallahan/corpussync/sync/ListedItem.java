package com.williamcallahan.corpussync.sync;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One entry of an upstream listing.
 *
 * @param key canonical item key within the source
 * @param location upstream location used to fetch the item, may equal the key
 * @param updatedAt modification time reported by the listing, null when unknown
 * @param inline content carried by the listing itself, empty when the item must be fetched
 */
public record ListedItem(String key, String location, Instant updatedAt, Map<String, String> inline) {

    public ListedItem {
        Objects.requireNonNull(key, "key");
        location = location == null ? key : location;
        inline = inline == null ? Map.of() : Map.copyOf(inline);
    }

    public static ListedItem of(String key, String location) {
        return new ListedItem(key, location, null, Map.of());
    }
}
