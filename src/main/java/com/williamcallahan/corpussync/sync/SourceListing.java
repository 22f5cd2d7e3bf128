package com.williamcallahan.corpussync.sync;

import java.util.List;

/**
 * Result of listing a source from a cursor.
 *
 * @param items observed items
 * @param nextCursor cursor to commit once every item is durably applied; null keeps the old one
 * @param complete whether {@code items} covers the whole upstream corpus, which is what
 *        makes absence meaningful for repeal detection
 */
public record SourceListing(List<ListedItem> items, String nextCursor, boolean complete) {

    public SourceListing {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
