package com.williamcallahan.corpussync.indexing;

import com.williamcallahan.corpussync.domain.ItemIdentity;
import java.util.Objects;

/**
 * One lexical index entry; exactly one exists per identity per collection.
 */
public record LexicalEntry(ItemIdentity identity, String recordId, String title, String body) {

    public LexicalEntry {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(recordId, "recordId");
        title = title == null ? "" : title;
        body = body == null ? "" : body;
    }
}
