package com.williamcallahan.corpussync.sync;

import com.williamcallahan.corpussync.domain.ChangeClassification;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one reconciliation cycle.
 *
 * @param cycleId cycle identifier
 * @param source source name
 * @param status terminal status
 * @param startedAt cycle start
 * @param finishedAt cycle end
 * @param counts number of items per classification
 * @param failedIdentities keys of items that failed this cycle
 * @param checkpointGeneration checkpoint generation after the cycle
 * @param checkpointCommitted whether this cycle advanced the checkpoint
 * @param message failure summary, empty on success
 */
public record CycleReport(
        String cycleId,
        String source,
        CycleStatus status,
        Instant startedAt,
        Instant finishedAt,
        Map<ChangeClassification, Integer> counts,
        List<String> failedIdentities,
        long checkpointGeneration,
        boolean checkpointCommitted,
        String message) {

    public CycleReport {
        EnumMap<ChangeClassification, Integer> complete = new EnumMap<>(ChangeClassification.class);
        for (ChangeClassification classification : ChangeClassification.values()) {
            complete.put(classification, counts == null ? 0 : counts.getOrDefault(classification, 0));
        }
        counts = Collections.unmodifiableMap(complete);
        failedIdentities = failedIdentities == null ? List.of() : List.copyOf(failedIdentities);
        message = message == null ? "" : message;
    }

    public int count(ChangeClassification classification) {
        return counts.get(classification);
    }

    /**
     * Number of items that changed the store's notion of "currently valid".
     */
    public int writes() {
        return count(ChangeClassification.NEW) + count(ChangeClassification.UPDATED)
                + count(ChangeClassification.REPEALED);
    }
}
