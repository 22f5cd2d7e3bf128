package com.williamcallahan.corpussync.sync;

import com.williamcallahan.corpussync.domain.ChangeClassification;
import java.time.Instant;
import java.util.Map;

/**
 * Operational summary of one source across cycles.
 *
 * @param source source name
 * @param lastCycleId most recent cycle, null before the first
 * @param lastStatus status of the most recent cycle, null before the first
 * @param lastAttemptedAt start of the most recent cycle
 * @param lastSuccessfulAt end of the most recent cycle that committed its checkpoint
 * @param consecutiveFailures cycles since the last successful one
 * @param totals item counts per classification over the process lifetime
 */
public record SourceStatus(
        String source,
        String lastCycleId,
        CycleStatus lastStatus,
        Instant lastAttemptedAt,
        Instant lastSuccessfulAt,
        int consecutiveFailures,
        Map<ChangeClassification, Long> totals) {

    public SourceStatus {
        totals = totals == null ? Map.of() : Map.copyOf(totals);
    }
}
