package com.williamcallahan.corpussync.sync;

/**
 * Lifecycle of one reconciliation cycle.
 */
public enum CycleStatus {
    RUNNING,
    /** Every item resolved and the checkpoint advanced. */
    SUCCEEDED,
    /** Some items failed; their writes are durable but the checkpoint did not advance. */
    PARTIAL,
    /** The listing could not be fetched; nothing was written. */
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
