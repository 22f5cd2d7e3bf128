package com.williamcallahan.corpussync.indexing;

import com.williamcallahan.corpussync.domain.ItemIdentity;
import java.util.Collection;
import java.util.List;

/**
 * Keyword index over record title and body, one entry per identity per collection.
 */
public interface LexicalIndex {

    void upsert(String collection, List<LexicalEntry> entries);

    void delete(String collection, Collection<ItemIdentity> identities);

    /**
     * Returns up to {@code limit} hits ordered by descending relevance.
     */
    List<IndexHit> search(String collection, String query, int limit);

    long count(String collection);

    boolean isHealthy();

    default boolean isDurable() {
        return true;
    }
}
