package com.williamcallahan.corpussync.domain;

import java.util.Objects;

/**
 * Independently indexable partition of the document store.
 *
 * @param name collection name
 * @param dimensions declared embedding dimensionality
 * @param audience visibility tag checked by the search gateway
 */
public record CollectionDescriptor(String name, int dimensions, String audience) {

    /** Audience tag visible to every caller. */
    public static final String PUBLIC_AUDIENCE = "public";

    public CollectionDescriptor {
        Objects.requireNonNull(name, "name");
        audience = audience == null || audience.isBlank() ? PUBLIC_AUDIENCE : audience;
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive for collection " + name);
        }
    }

    /**
     * Returns whether a caller presenting {@code callerAudience} may see this collection.
     * Public collections are visible to everyone; any other collection only to callers
     * presenting exactly its audience tag.
     */
    public boolean isVisibleTo(String callerAudience) {
        if (PUBLIC_AUDIENCE.equals(audience)) {
            return true;
        }
        return callerAudience != null && audience.equals(callerAudience.trim());
    }
}
