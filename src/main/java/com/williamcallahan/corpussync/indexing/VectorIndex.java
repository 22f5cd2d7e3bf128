package com.williamcallahan.corpussync.indexing;

import com.williamcallahan.corpussync.domain.CollectionDescriptor;
import com.williamcallahan.corpussync.domain.ItemIdentity;
import java.util.Collection;
import java.util.List;

/**
 * Dense vector index with one entry per identity per collection.
 *
 * <p>Implementations throw {@link IndexBackendUnavailableException} when the backend cannot
 * complete an operation.</p>
 */
public interface VectorIndex {

    /**
     * Creates the collection if it does not exist yet. Idempotent.
     */
    void ensureCollection(CollectionDescriptor collection);

    /**
     * Inserts or replaces the entries, keyed by identity.
     */
    void upsert(String collection, List<VectorEntry> entries);

    /**
     * Removes the entries for the identities. Missing identities are ignored.
     */
    void delete(String collection, Collection<ItemIdentity> identities);

    /**
     * Returns up to {@code limit} hits ordered by descending similarity.
     */
    List<IndexHit> search(String collection, float[] query, int limit);

    long count(String collection);

    /**
     * Returns true when the backend answers.
     */
    boolean isHealthy();

    /**
     * Returns true when entries outlive the process. A volatile index starts empty on every boot.
     */
    default boolean isDurable() {
        return true;
    }

    String backendName();
}
