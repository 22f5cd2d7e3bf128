package com.williamcallahan.corpussync.sync;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.williamcallahan.corpussync.config.AppProperties;
import com.williamcallahan.corpussync.config.SourceCatalog;
import com.williamcallahan.corpussync.domain.SourceDescriptor;
import com.williamcallahan.corpussync.store.CheckpointStore;
import com.williamcallahan.corpussync.store.FingerprintStore;
import com.williamcallahan.corpussync.store.VersionedDocumentStore;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Accepts cycle triggers and runs each source's reconciler asynchronously.
 *
 * <p>At most one cycle runs per source; sources run independently of each other. Finished
 * cycles stay queryable for a day. On shutdown every running cycle is cancelled, which leaves
 * its checkpoint exactly as a crash would.</p>
 */
@Service
public class ReconcilerService {

    private static final Logger log = LoggerFactory.getLogger(ReconcilerService.class);
    private static final int CYCLE_HISTORY_SIZE = 1_000;
    private static final Duration CYCLE_HISTORY_TTL = Duration.ofHours(24);
    private static final long SHUTDOWN_WAIT_SECONDS = 10;
    private static final String SHUTTING_DOWN = "Reconciler is shutting down";

    private final SourceCatalog sourceCatalog;
    private final SourceAdapterRegistry adapterRegistry;
    private final CheckpointStore checkpointStore;
    private final FingerprintStore fingerprintStore;
    private final VersionedDocumentStore documentStore;
    private final ContentFingerprinter fingerprinter;
    private final SyncSettings settings;
    private final SourceStatusTracker statusTracker;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    private final ExecutorService cycleExecutor = Executors.newCachedThreadPool(
            new ThreadFactoryBuilder().setNameFormat("reconciler-%d").setDaemon(true).build());
    private final Map<String, RunningCycle> running = new ConcurrentHashMap<>();
    private final Cache<String, CycleView> cycles = Caffeine.newBuilder()
            .maximumSize(CYCLE_HISTORY_SIZE)
            .expireAfterWrite(CYCLE_HISTORY_TTL)
            .build();

    @Autowired
    public ReconcilerService(
            SourceCatalog sourceCatalog,
            SourceAdapterRegistry adapterRegistry,
            CheckpointStore checkpointStore,
            FingerprintStore fingerprintStore,
            VersionedDocumentStore documentStore,
            ContentFingerprinter fingerprinter,
            AppProperties appProperties,
            SourceStatusTracker statusTracker,
            ApplicationEventPublisher eventPublisher,
            Clock clock) {
        this(
                sourceCatalog,
                adapterRegistry,
                checkpointStore,
                fingerprintStore,
                documentStore,
                fingerprinter,
                SyncSettings.from(appProperties.getSync()),
                statusTracker,
                eventPublisher,
                clock);
    }

    ReconcilerService(
            SourceCatalog sourceCatalog,
            SourceAdapterRegistry adapterRegistry,
            CheckpointStore checkpointStore,
            FingerprintStore fingerprintStore,
            VersionedDocumentStore documentStore,
            ContentFingerprinter fingerprinter,
            SyncSettings settings,
            SourceStatusTracker statusTracker,
            ApplicationEventPublisher eventPublisher,
            Clock clock) {
        this.sourceCatalog = sourceCatalog;
        this.adapterRegistry = adapterRegistry;
        this.checkpointStore = checkpointStore;
        this.fingerprintStore = fingerprintStore;
        this.documentStore = documentStore;
        this.fingerprinter = fingerprinter;
        this.settings = settings;
        this.statusTracker = statusTracker;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * Starts a cycle for the source and returns immediately.
     *
     * @param sourceName configured source name
     * @return snapshot of the accepted cycle, status {@link CycleStatus#RUNNING}
     * @throws com.williamcallahan.corpussync.domain.UnknownSourceException if the source is not configured
     * @throws CycleAlreadyRunningException if a cycle for the source has not finished yet
     * @throws IllegalStateException if the service is shutting down
     */
    public CycleView trigger(String sourceName) {
        SourceDescriptor source = sourceCatalog.require(sourceName);
        if (!isAcceptingTriggers()) {
            throw new IllegalStateException(SHUTTING_DOWN);
        }
        String cycleId = UUID.randomUUID().toString();
        RunningCycle handle = new RunningCycle(cycleId);
        RunningCycle existing = running.putIfAbsent(source.name(), handle);
        if (existing != null) {
            throw new CycleAlreadyRunningException(source.name(), existing.cycleId);
        }

        Instant startedAt = clock.instant();
        CycleView accepted = new CycleView(cycleId, source.name(), CycleStatus.RUNNING, startedAt, null);
        try {
            SyncReconciler reconciler = new SyncReconciler(
                    source,
                    adapterRegistry.adapterFor(source),
                    checkpointStore,
                    fingerprintStore,
                    documentStore,
                    fingerprinter,
                    settings,
                    clock);
            cycles.put(cycleId, accepted);
            statusTracker.recordStarted(source.name(), cycleId, startedAt);
            handle.future = cycleExecutor.submit(() -> runTracked(reconciler, source, handle, startedAt));
        } catch (RejectedExecutionException rejected) {
            running.remove(source.name(), handle);
            cycles.invalidate(cycleId);
            throw new IllegalStateException(SHUTTING_DOWN, rejected);
        } catch (RuntimeException failed) {
            running.remove(source.name(), handle);
            cycles.invalidate(cycleId);
            throw failed;
        }
        log.info("[SYNC] Accepted cycle {} for source {}", cycleId, source.name());
        return accepted;
    }

    public Optional<CycleView> cycle(String cycleId) {
        return Optional.ofNullable(cycles.getIfPresent(cycleId));
    }

    /**
     * Returns the running cycle id per source.
     */
    public Map<String, String> runningCycles() {
        Map<String, String> snapshot = new LinkedHashMap<>();
        running.forEach((source, handle) -> snapshot.put(source, handle.cycleId));
        return snapshot;
    }

    public boolean isAcceptingTriggers() {
        return !cycleExecutor.isShutdown();
    }

    public List<SourceDescriptor> sources() {
        return sourceCatalog.all();
    }

    /**
     * Cancels every running cycle and stops the worker pool.
     */
    @PreDestroy
    public void shutdown() {
        running.values().forEach(RunningCycle::cancel);
        cycleExecutor.shutdownNow();
        try {
            if (!cycleExecutor.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("[SYNC] Reconciler workers did not stop within {}s", SHUTDOWN_WAIT_SECONDS);
            }
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private void runTracked(SyncReconciler reconciler, SourceDescriptor source, RunningCycle handle, Instant startedAt) {
        CycleReport report;
        try {
            report = reconciler.runCycle(handle.cycleId, handle::isCancelled);
        } catch (RuntimeException unexpected) {
            log.error("[SYNC] Cycle {} for source {} failed unexpectedly", handle.cycleId, source.name(), unexpected);
            report = new CycleReport(
                    handle.cycleId,
                    source.name(),
                    CycleStatus.FAILED,
                    startedAt,
                    clock.instant(),
                    Map.of(),
                    List.of(),
                    checkpointStore.latest(source.name(), SyncReconciler.LISTING_STREAM).generation(),
                    false,
                    unexpected.getClass().getSimpleName());
        }
        cycles.put(handle.cycleId, new CycleView(handle.cycleId, source.name(), report.status(), startedAt, report));
        statusTracker.recordFinished(report);
        running.remove(source.name(), handle);

        if (report.writes() > 0 && report.status() != CycleStatus.CANCELLED) {
            try {
                eventPublisher.publishEvent(
                        new CycleCompletedEvent(handle.cycleId, source.name(), source.collection(), report.writes()));
            } catch (RuntimeException listenerFailure) {
                log.warn("[SYNC] Cycle completion listener failed for {}: {}",
                        handle.cycleId, listenerFailure.getMessage());
            }
        }
    }

    private static final class RunningCycle {
        private final String cycleId;
        private volatile boolean cancelled;
        private volatile Future<?> future;

        private RunningCycle(String cycleId) {
            this.cycleId = cycleId;
        }

        boolean isCancelled() {
            return cancelled;
        }

        void cancel() {
            cancelled = true;
            Future<?> submitted = future;
            if (submitted != null) {
                submitted.cancel(true);
            }
        }
    }
}
