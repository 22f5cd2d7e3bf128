package com.williamcallahan.corpussync.sync;

/**
 * Published after a reconciliation cycle wrote at least one change to the document store.
 *
 * @param cycleId finished cycle
 * @param source reconciled source
 * @param collection collection the source writes into
 * @param writes number of new, updated and repealed items
 */
public record CycleCompletedEvent(String cycleId, String source, String collection, int writes) {}
