package com.williamcallahan.corpussync.indexing;

/**
 * Outcome of one indexing pass over a collection.
 *
 * @param collection indexed collection
 * @param startCursor change sequence the pass resumed after
 * @param endCursor last change sequence acknowledged by the pass
 * @param changesProcessed changes consumed, across all committed batches
 * @param upserted entries written to both indexes
 * @param deleted identities removed from both indexes
 * @param batches committed batches
 */
public record IndexPassReport(
        String collection,
        long startCursor,
        long endCursor,
        long changesProcessed,
        long upserted,
        long deleted,
        int batches) {}
