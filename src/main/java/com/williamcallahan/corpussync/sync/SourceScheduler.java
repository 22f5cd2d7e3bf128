package com.williamcallahan.corpussync.sync;

import com.williamcallahan.corpussync.domain.SourceDescriptor;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Triggers a cycle for every source whose cadence has elapsed since its last attempt.
 * Sources with a zero cadence are only reconciled on demand.
 */
@Component
@ConditionalOnProperty(prefix = "app.sync", name = "scheduler-enabled", havingValue = "true")
public class SourceScheduler {

    private static final Logger log = LoggerFactory.getLogger(SourceScheduler.class);

    private final ReconcilerService reconcilerService;
    private final SourceStatusTracker statusTracker;
    private final Clock clock;

    public SourceScheduler(ReconcilerService reconcilerService, SourceStatusTracker statusTracker, Clock clock) {
        this.reconcilerService = reconcilerService;
        this.statusTracker = statusTracker;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${app.sync.scheduler-tick:PT30S}", initialDelayString = "${app.sync.scheduler-tick:PT30S}")
    public void triggerDueSources() {
        if (!reconcilerService.isAcceptingTriggers()) {
            return;
        }
        Instant now = clock.instant();
        for (SourceDescriptor source : reconcilerService.sources()) {
            if (isDue(source, now)) {
                try {
                    reconcilerService.trigger(source.name());
                } catch (CycleAlreadyRunningException alreadyRunning) {
                    log.debug("[SYNC] Skipping scheduled cycle for {}: {} still running",
                            source.name(), alreadyRunning.runningCycleId());
                } catch (RuntimeException failure) {
                    log.warn("[SYNC] Scheduled trigger for {} failed: {}", source.name(), failure.getMessage());
                }
            }
        }
    }

    boolean isDue(SourceDescriptor source, Instant now) {
        if (source.cadence().isZero() || source.cadence().isNegative()) {
            return false;
        }
        Instant lastAttempt = statusTracker.statusOrEmpty(source.name()).lastAttemptedAt();
        return lastAttempt == null || !now.isBefore(lastAttempt.plus(source.cadence()));
    }
}
