package com.williamcallahan.corpussync.sync;

/**
 * Signals a trigger for a source whose previous cycle is still running.
 */
public class CycleAlreadyRunningException extends RuntimeException {

    private final String sourceName;
    private final String runningCycleId;

    public CycleAlreadyRunningException(String sourceName, String runningCycleId) {
        super("A cycle for source " + sourceName + " is already running: " + runningCycleId);
        this.sourceName = sourceName;
        this.runningCycleId = runningCycleId;
    }

    public String sourceName() {
        return sourceName;
    }

    public String runningCycleId() {
        return runningCycleId;
    }
}
