package com.williamcallahan.corpussync.sync;

import com.williamcallahan.corpussync.domain.ChangeClassification;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Tracks per-source cycle outcomes: last attempt, last success, consecutive failures and totals.
 */
@Component
public class SourceStatusTracker {

    private final Map<String, SourceStatus> statuses = new ConcurrentHashMap<>();

    /**
     * Records that a cycle was accepted for the source.
     */
    public void recordStarted(String source, String cycleId, Instant startedAt) {
        statuses.compute(source, (name, previous) -> {
            SourceStatus base = previous != null ? previous : empty(name);
            return new SourceStatus(
                    name,
                    cycleId,
                    CycleStatus.RUNNING,
                    startedAt,
                    base.lastSuccessfulAt(),
                    base.consecutiveFailures(),
                    base.totals());
        });
    }

    /**
     * Folds a finished cycle into the source's status.
     */
    public void recordFinished(CycleReport report) {
        statuses.compute(report.source(), (name, previous) -> {
            SourceStatus base = previous != null ? previous : empty(name);
            Map<ChangeClassification, Long> totals = new EnumMap<>(ChangeClassification.class);
            totals.putAll(base.totals());
            for (Map.Entry<ChangeClassification, Integer> count : report.counts().entrySet()) {
                totals.merge(count.getKey(), count.getValue().longValue(), Long::sum);
            }
            boolean succeeded = report.status() == CycleStatus.SUCCEEDED;
            return new SourceStatus(
                    name,
                    report.cycleId(),
                    report.status(),
                    report.startedAt(),
                    succeeded ? report.finishedAt() : base.lastSuccessfulAt(),
                    succeeded ? 0 : base.consecutiveFailures() + 1,
                    totals);
        });
    }

    public Optional<SourceStatus> statusOf(String source) {
        return Optional.ofNullable(statuses.get(source));
    }

    /**
     * Returns the status of the source, or an empty status when no cycle has run yet.
     */
    public SourceStatus statusOrEmpty(String source) {
        return statusOf(source).orElseGet(() -> empty(source));
    }

    private static SourceStatus empty(String source) {
        return new SourceStatus(source, null, null, null, null, 0, Map.of());
    }
}
