package com.williamcallahan.corpussync.indexing;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.williamcallahan.corpussync.config.AppProperties;
import com.williamcallahan.corpussync.config.CollectionCatalog;
import com.williamcallahan.corpussync.domain.CollectionDescriptor;
import com.williamcallahan.corpussync.store.VersionedDocumentStore;
import com.williamcallahan.corpussync.sync.CycleCompletedEvent;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Runs indexing passes asynchronously, at most one per collection.
 *
 * <p>A request for a collection that is already being indexed does not start a second pass:
 * it returns the running job and schedules one follow-up pass once it finishes, so changes
 * committed during the running pass are never left behind. Finished jobs stay queryable for a day.</p>
 */
@Service
public class IndexingCoordinator {

    private static final Logger log = LoggerFactory.getLogger(IndexingCoordinator.class);
    private static final int JOB_HISTORY_SIZE = 1_000;
    private static final Duration JOB_HISTORY_TTL = Duration.ofHours(24);
    private static final long SHUTDOWN_WAIT_SECONDS = 10;

    private final Indexer indexer;
    private final CollectionCatalog collectionCatalog;
    private final VersionedDocumentStore documentStore;
    private final int defaultBatchSize;
    private final boolean indexOnCycleCompletion;
    private final Clock clock;

    private final ExecutorService indexExecutor = Executors.newCachedThreadPool(
            new ThreadFactoryBuilder().setNameFormat("indexer-%d").setDaemon(true).build());
    private final Map<String, RunningJob> running = new ConcurrentHashMap<>();
    private final Cache<String, IndexJob> jobs = Caffeine.newBuilder()
            .maximumSize(JOB_HISTORY_SIZE)
            .expireAfterWrite(JOB_HISTORY_TTL)
            .build();
    private volatile boolean shuttingDown;

    @Autowired
    public IndexingCoordinator(
            Indexer indexer,
            CollectionCatalog collectionCatalog,
            VersionedDocumentStore documentStore,
            AppProperties appProperties,
            Clock clock) {
        this(
                indexer,
                collectionCatalog,
                documentStore,
                appProperties.getIndexer().getBatchSize(),
                appProperties.getIndexer().isIndexOnCycleCompletion(),
                clock);
    }

    IndexingCoordinator(
            Indexer indexer,
            CollectionCatalog collectionCatalog,
            VersionedDocumentStore documentStore,
            int defaultBatchSize,
            boolean indexOnCycleCompletion,
            Clock clock) {
        this.indexer = indexer;
        this.collectionCatalog = collectionCatalog;
        this.documentStore = documentStore;
        this.defaultBatchSize = defaultBatchSize;
        this.indexOnCycleCompletion = indexOnCycleCompletion;
        this.clock = clock;
    }

    /**
     * Starts an indexing pass for the collection, or joins the one already running.
     *
     * @param collectionName configured collection
     * @param batchSize changes per batch, null for the configured default
     * @param fullReindex whether to restart from the beginning of the change log
     * @return snapshot of the started or running job
     * @throws com.williamcallahan.corpussync.domain.UnknownCollectionException if the collection is not configured
     */
    public IndexJob submit(String collectionName, Integer batchSize, boolean fullReindex) {
        CollectionDescriptor collection = collectionCatalog.require(collectionName);
        int effectiveBatchSize = batchSize == null ? defaultBatchSize : batchSize;
        if (effectiveBatchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        if (shuttingDown) {
            throw new IllegalStateException("Indexing coordinator is shutting down");
        }

        RunningJob handle = new RunningJob(UUID.randomUUID().toString(), effectiveBatchSize);
        while (true) {
            RunningJob existing = running.putIfAbsent(collection.name(), handle);
            if (existing == null) {
                return start(collection, handle, fullReindex);
            }
            if (existing.requestFollowUp(effectiveBatchSize, fullReindex)) {
                log.debug("[INDEXING] {} already indexing as job {}, follow-up pass queued",
                        collection.name(), existing.jobId);
                IndexJob runningJob = jobs.getIfPresent(existing.jobId);
                return runningJob != null
                        ? runningJob
                        : IndexJob.started(existing.jobId, collection.name(), false, existing.batchSize, clock.instant());
            }
            // The running job is finishing and about to leave the map.
            Thread.onSpinWait();
        }
    }

    public Optional<IndexJob> job(String jobId) {
        return Optional.ofNullable(jobs.getIfPresent(jobId));
    }

    /**
     * Returns the running job id per collection.
     */
    public Map<String, String> runningJobs() {
        Map<String, String> snapshot = new TreeMap<>();
        running.forEach((collection, handle) -> snapshot.put(collection, handle.jobId));
        return snapshot;
    }

    public boolean isAcceptingJobs() {
        return !shuttingDown && !indexExecutor.isShutdown();
    }

    /**
     * Indexes the collection a finished reconciliation cycle wrote into.
     */
    @EventListener
    public void onCycleCompleted(CycleCompletedEvent event) {
        if (!indexOnCycleCompletion || shuttingDown) {
            return;
        }
        log.debug("[INDEXING] Cycle {} of {} wrote {} changes, indexing {}",
                event.cycleId(), event.source(), event.writes(), event.collection());
        submit(event.collection(), null, false);
    }

    /**
     * Submits a pass for every collection whose change log is ahead of the indexer cursor.
     */
    public void indexLaggingCollections() {
        for (CollectionDescriptor collection : collectionCatalog.all()) {
            if (documentStore.latestSequence(collection.name()) > indexer.cursor(collection.name())) {
                submit(collection.name(), null, false);
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        shuttingDown = true;
        running.values().forEach(RunningJob::cancel);
        indexExecutor.shutdownNow();
        try {
            if (!indexExecutor.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("[INDEXING] Indexer workers did not stop within {}s", SHUTDOWN_WAIT_SECONDS);
            }
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private IndexJob start(CollectionDescriptor collection, RunningJob handle, boolean fullReindex) {
        IndexJob started = IndexJob.started(
                handle.jobId, collection.name(), fullReindex, handle.batchSize, clock.instant());
        jobs.put(handle.jobId, started);
        try {
            indexExecutor.execute(() -> runTracked(collection, handle, fullReindex));
        } catch (RejectedExecutionException rejected) {
            running.remove(collection.name(), handle);
            jobs.invalidate(handle.jobId);
            throw new IllegalStateException("Indexing coordinator is shutting down", rejected);
        } catch (RuntimeException failed) {
            running.remove(collection.name(), handle);
            jobs.invalidate(handle.jobId);
            throw failed;
        }
        log.info("[INDEXING] Started job {} for {} (fullReindex={}, batchSize={})",
                handle.jobId, collection.name(), fullReindex, handle.batchSize);
        return started;
    }

    private void runTracked(CollectionDescriptor collection, RunningJob handle, boolean fullReindex) {
        IndexJobStatus status;
        String error = null;
        try {
            indexer.runPass(
                    collection,
                    handle.batchSize,
                    fullReindex,
                    (processed, total) -> updateJob(handle.jobId, job -> job.withProgress(processed, total)),
                    handle::isCancelled);
            status = IndexJobStatus.SUCCEEDED;
        } catch (CancellationException cancelled) {
            status = IndexJobStatus.CANCELLED;
            log.info("[INDEXING] Job {} for {} cancelled", handle.jobId, collection.name());
        } catch (RuntimeException failure) {
            status = IndexJobStatus.FAILED;
            error = failure.getClass().getSimpleName() + ": " + failure.getMessage();
            log.error("[INDEXING] Job {} for {} failed", handle.jobId, collection.name(), failure);
        }
        IndexJobStatus finalStatus = status;
        String finalError = error;
        updateJob(handle.jobId, job -> job.finished(finalStatus, clock.instant(), finalError));
        FollowUp followUp = handle.close();
        running.remove(collection.name(), handle);

        if (followUp != null && !shuttingDown && !handle.isCancelled()) {
            try {
                submit(collection.name(), followUp.batchSize(), followUp.fullReindex());
            } catch (RuntimeException rejected) {
                log.warn("[INDEXING] Follow-up pass for {} not started: {}", collection.name(), rejected.getMessage());
            }
        }
    }

    private void updateJob(String jobId, UnaryOperator<IndexJob> update) {
        jobs.asMap().computeIfPresent(jobId, (id, job) -> update.apply(job));
    }

    private record FollowUp(int batchSize, boolean fullReindex) {}

    private static final class RunningJob {
        private final String jobId;
        private final int batchSize;
        private volatile boolean cancelled;
        private FollowUp followUp;
        private boolean closed;

        private RunningJob(String jobId, int batchSize) {
            this.jobId = jobId;
            this.batchSize = batchSize;
        }

        synchronized boolean requestFollowUp(int requestedBatchSize, boolean fullReindex) {
            if (closed) {
                return false;
            }
            boolean full = fullReindex || (followUp != null && followUp.fullReindex());
            followUp = new FollowUp(requestedBatchSize, full);
            return true;
        }

        synchronized FollowUp close() {
            closed = true;
            return followUp;
        }

        boolean isCancelled() {
            return cancelled;
        }

        void cancel() {
            cancelled = true;
        }
    }
}
