package com.williamcallahan.corpussync.domain;

/**
 * Outcome of reconciling one observed (or no longer observed) item within a cycle.
 */
public enum ChangeClassification {
    NEW,
    UPDATED,
    UNCHANGED,
    REPEALED,
    FAILED
}
