package com.williamcallahan.corpussync.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Durable resumption cursor for one logical stream of a source.
 *
 * @param source owning source (or the indexer partition)
 * @param stream logical stream name within the source
 * @param cursor opaque position: timestamp, page token or sequence number; empty at the start
 * @param generation monotonically increasing commit counter, zero before the first commit
 * @param committedAt commit instant, null before the first commit
 */
public record Checkpoint(String source, String stream, String cursor, long generation, Instant committedAt) {

    public Checkpoint {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(stream, "stream");
        cursor = cursor == null ? "" : cursor;
        if (generation < 0) {
            throw new IllegalArgumentException("generation cannot be negative");
        }
    }

    public static Checkpoint initial(String source, String stream) {
        return new Checkpoint(source, stream, "", 0, null);
    }

    public boolean hasCursor() {
        return !cursor.isBlank();
    }
}
