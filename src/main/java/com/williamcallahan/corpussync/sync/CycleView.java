package com.williamcallahan.corpussync.sync;

import java.time.Instant;

/**
 * Snapshot of a cycle as tracked by {@link ReconcilerService}.
 *
 * @param cycleId cycle identifier
 * @param source source name
 * @param status current status
 * @param startedAt acceptance time of the trigger
 * @param report final report, null while running
 */
public record CycleView(String cycleId, String source, CycleStatus status, Instant startedAt, CycleReport report) {}
