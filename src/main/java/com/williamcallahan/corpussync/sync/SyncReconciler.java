package com.williamcallahan.corpussync.sync;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.williamcallahan.corpussync.domain.ChangeClassification;
import com.williamcallahan.corpussync.domain.Checkpoint;
import com.williamcallahan.corpussync.domain.ItemIdentity;
import com.williamcallahan.corpussync.domain.SourceDescriptor;
import com.williamcallahan.corpussync.domain.VersionedRecord;
import com.williamcallahan.corpussync.store.CheckpointStore;
import com.williamcallahan.corpussync.store.FingerprintStore;
import com.williamcallahan.corpussync.store.StoreWriteConflictException;
import com.williamcallahan.corpussync.store.VersionedDocumentStore;
import com.williamcallahan.corpussync.support.PipelineMetrics;
import com.williamcallahan.corpussync.support.RetrySupport;
import com.williamcallahan.corpussync.support.TransientErrorClassifier;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs reconciliation cycles for one source: list upstream, classify every observed item as
 * new, updated or unchanged against the document store, repeal what disappeared and commit
 * the checkpoint once every write is durable.
 *
 * <p>Items are processed on a bounded pool owned by the cycle; the checkpoint commit waits for
 * all of them. A cycle with a failed listing, failed items or a cancellation leaves the
 * checkpoint untouched, so the next cycle retries the same window. Re-applying a window is
 * idempotent because classification compares against the store's current record.</p>
 */
public class SyncReconciler {

    private static final Logger log = LoggerFactory.getLogger(SyncReconciler.class);
    private static final Logger SYNC_LOG = LoggerFactory.getLogger("SYNC");

    /** Checkpoint stream holding the listing cursor of a source. */
    public static final String LISTING_STREAM = "listing";

    private final SourceDescriptor source;
    private final SourceAdapter adapter;
    private final CheckpointStore checkpointStore;
    private final FingerprintStore fingerprintStore;
    private final VersionedDocumentStore documentStore;
    private final ContentFingerprinter fingerprinter;
    private final SyncSettings settings;
    private final Clock clock;

    public SyncReconciler(
            SourceDescriptor source,
            SourceAdapter adapter,
            CheckpointStore checkpointStore,
            FingerprintStore fingerprintStore,
            VersionedDocumentStore documentStore,
            ContentFingerprinter fingerprinter,
            SyncSettings settings,
            Clock clock) {
        this.source = Objects.requireNonNull(source, "source");
        this.adapter = Objects.requireNonNull(adapter, "adapter");
        this.checkpointStore = Objects.requireNonNull(checkpointStore, "checkpointStore");
        this.fingerprintStore = Objects.requireNonNull(fingerprintStore, "fingerprintStore");
        this.documentStore = Objects.requireNonNull(documentStore, "documentStore");
        this.fingerprinter = Objects.requireNonNull(fingerprinter, "fingerprinter");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public CycleReport runCycle(String cycleId) {
        return runCycle(cycleId, () -> false);
    }

    /**
     * Runs one cycle.
     *
     * @param cycleId identifier used in logs and the report
     * @param cancellationRequested polled between items; the cycle also stops when its thread is interrupted
     * @return the cycle report
     */
    public CycleReport runCycle(String cycleId, BooleanSupplier cancellationRequested) {
        Instant startedAt = clock.instant();
        Checkpoint checkpoint = checkpointStore.latest(source.name(), LISTING_STREAM);
        log.info("[SYNC] Cycle {} for source {} starting from generation {} cursor '{}'",
                cycleId, source.name(), checkpoint.generation(), checkpoint.cursor());

        SourceListing listing;
        try {
            listing = withRetry(() -> adapter.fetchListing(checkpoint.cursor()), "listing of " + source.name());
        } catch (RuntimeException listingFailure) {
            boolean cancelled = isCancelled(cancellationRequested);
            if (!cancelled) {
                log.warn("[SYNC] Cycle {} could not list source {}: {}",
                        cycleId, source.name(), describe(listingFailure));
            }
            return finish(new CycleReport(
                    cycleId,
                    source.name(),
                    cancelled ? CycleStatus.CANCELLED : CycleStatus.FAILED,
                    startedAt,
                    clock.instant(),
                    Map.of(),
                    List.of(),
                    checkpoint.generation(),
                    false,
                    cancelled ? "cancelled" : "listing failed: " + describe(listingFailure)));
        }

        Map<String, ListedItem> items = distinctByKey(listing.items());
        ItemBatch batch = reconcileItems(items.values(), cancellationRequested);

        Map<ChangeClassification, Integer> counts = new EnumMap<>(ChangeClassification.class);
        List<String> failed = new ArrayList<>();
        for (ItemOutcome outcome : batch.outcomes()) {
            if (outcome.classification() != null) {
                counts.merge(outcome.classification(), 1, Integer::sum);
                if (outcome.classification() == ChangeClassification.FAILED) {
                    failed.add(outcome.key());
                }
            }
        }

        boolean cancelled = batch.cancelled() || isCancelled(cancellationRequested);
        if (listing.complete() && !cancelled) {
            repealAbsent(items.keySet(), counts, failed, cancellationRequested);
            cancelled = isCancelled(cancellationRequested);
        }

        long generation = checkpoint.generation();
        boolean committed = false;
        String message = "";
        if (cancelled) {
            message = "cancelled";
        } else if (!failed.isEmpty()) {
            message = failed.size() + " item(s) failed; checkpoint left at generation " + generation;
        } else {
            String nextCursor = listing.nextCursor() != null ? listing.nextCursor() : checkpoint.cursor();
            try {
                generation = checkpointStore.commit(source.name(), LISTING_STREAM, nextCursor).generation();
                committed = true;
            } catch (RuntimeException commitFailure) {
                log.error("[SYNC] Cycle {} applied every item but could not commit the checkpoint of {}",
                        cycleId, source.name(), commitFailure);
                message = "checkpoint commit failed: " + describe(commitFailure);
            }
        }

        CycleStatus status;
        if (cancelled) {
            status = CycleStatus.CANCELLED;
        } else if (committed) {
            status = CycleStatus.SUCCEEDED;
        } else {
            status = CycleStatus.PARTIAL;
        }
        return finish(new CycleReport(
                cycleId, source.name(), status, startedAt, clock.instant(), counts, failed, generation, committed,
                message));
    }

    private CycleReport finish(CycleReport report) {
        SYNC_LOG.info("Cycle {} source={} status={} new={} updated={} unchanged={} repealed={} failed={} generation={}",
                report.cycleId(),
                report.source(),
                report.status(),
                report.count(ChangeClassification.NEW),
                report.count(ChangeClassification.UPDATED),
                report.count(ChangeClassification.UNCHANGED),
                report.count(ChangeClassification.REPEALED),
                report.count(ChangeClassification.FAILED),
                report.checkpointGeneration());
        for (ChangeClassification classification : ChangeClassification.values()) {
            PipelineMetrics.recordItems(report.source(), classification.name(), report.count(classification));
        }
        PipelineMetrics.recordCycle(report.source(), report.status().name());
        return report;
    }

    private Map<String, ListedItem> distinctByKey(List<ListedItem> listed) {
        Map<String, ListedItem> items = new LinkedHashMap<>();
        for (ListedItem item : listed) {
            if (item.key().isBlank()) {
                log.warn("[SYNC] Source {} listed an item without a key; ignoring it", source.name());
                continue;
            }
            if (items.putIfAbsent(item.key(), item) != null) {
                log.debug("[SYNC] Source {} listed {} more than once; keeping the first entry",
                        source.name(), item.key());
            }
        }
        return items;
    }

    private ItemBatch reconcileItems(Iterable<ListedItem> items, BooleanSupplier cancellationRequested) {
        ExecutorService pool = Executors.newFixedThreadPool(
                settings.itemConcurrency(),
                new ThreadFactoryBuilder()
                        .setNameFormat("sync-" + source.name() + "-%d")
                        .setDaemon(true)
                        .build());
        List<Future<ItemOutcome>> futures = new ArrayList<>();
        List<ItemOutcome> outcomes = new ArrayList<>();
        try {
            for (ListedItem item : items) {
                futures.add(pool.submit(() -> reconcileItem(item, cancellationRequested)));
            }
            for (Future<ItemOutcome> future : futures) {
                try {
                    outcomes.add(future.get());
                } catch (ExecutionException unexpected) {
                    log.error("[SYNC] Item worker of {} failed unexpectedly", source.name(), unexpected.getCause());
                    outcomes.add(new ItemOutcome("<unknown>", ChangeClassification.FAILED));
                }
            }
            return new ItemBatch(outcomes, false);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
            log.info("[SYNC] Cycle for {} interrupted with {} of {} item(s) resolved",
                    source.name(), outcomes.size(), futures.size());
            return new ItemBatch(outcomes, true);
        } finally {
            pool.shutdown();
        }
    }

    private ItemOutcome reconcileItem(ListedItem item, BooleanSupplier cancellationRequested) {
        if (isCancelled(cancellationRequested)) {
            return new ItemOutcome(item.key(), null);
        }
        ItemIdentity identity = new ItemIdentity(source.name(), item.key());
        try {
            return new ItemOutcome(item.key(), classifyAndApply(identity, item));
        } catch (MalformedItemException malformed) {
            log.warn("[SYNC] Skipping malformed item {}: {}", identity, malformed.getMessage());
        } catch (StoreWriteConflictException conflict) {
            log.error("[SYNC] Consistency error writing {}; item failed for this cycle: {}",
                    identity, conflict.getMessage());
        } catch (RetrySupport.RetryInterruptedException interrupted) {
            return new ItemOutcome(item.key(), null);
        } catch (RuntimeException failure) {
            log.warn("[SYNC] Item {} failed for this cycle: {}", identity, describe(failure));
        }
        return new ItemOutcome(item.key(), ChangeClassification.FAILED);
    }

    private ChangeClassification classifyAndApply(ItemIdentity identity, ListedItem item) {
        Optional<VersionedRecord> current = documentStore.currentFor(identity);
        Optional<String> remembered = fingerprintStore.lookup(identity);
        boolean conditional = source.conditionalFetch() && adapter.supportsConditionalFetch();
        Optional<Instant> ifModifiedSince = conditional && current.isPresent()
                ? Optional.of(current.get().lastChecked())
                : Optional.empty();

        ItemContent content = fetch(item, ifModifiedSince);
        Instant now = clock.instant();
        if (content.notModified()) {
            if (current.isPresent() && remembered.isPresent()) {
                documentStore.touch(current.get().id(), laterOf(now, current.get().validFrom()));
                return ChangeClassification.UNCHANGED;
            }
            log.warn("[SYNC] {} answered not-modified for {} without a stored fingerprint; fetching in full",
                    source.name(), identity);
            content = fetch(item, Optional.empty());
            if (content.notModified()) {
                throw new MalformedItemException("Upstream answered not-modified to an unconditional fetch");
            }
        }

        String fingerprint = fingerprinter.fingerprint(content);
        if (current.isEmpty()) {
            if (remembered.isPresent()) {
                log.debug("[SYNC] {} has a remembered fingerprint but no current record; inserting", identity);
            }
            documentStore.insert(newVersion(identity, item, content, fingerprint, now));
            fingerprintStore.remember(identity, fingerprint);
            return ChangeClassification.NEW;
        }

        VersionedRecord existing = current.get();
        if (existing.fingerprint().equals(fingerprint)) {
            documentStore.touch(existing.id(), laterOf(now, existing.validFrom()));
            if (!remembered.equals(Optional.of(fingerprint))) {
                log.info("[SYNC] Repairing fingerprint entry of {} from the current record", identity);
                fingerprintStore.remember(identity, fingerprint);
            }
            return ChangeClassification.UNCHANGED;
        }

        if (ifModifiedSince.isPresent()
                && content.lastModified() != null
                && !content.lastModified().isAfter(ifModifiedSince.get())) {
            log.warn("[SYNC] {} reported {} unmodified since {} but its fingerprint changed; trusting the fingerprint",
                    source.name(), identity, ifModifiedSince.get());
        }
        documentStore.supersede(
                existing.id(), newVersion(identity, item, content, fingerprint, laterOf(now, existing.validFrom())));
        fingerprintStore.remember(identity, fingerprint);
        return ChangeClassification.UPDATED;
    }

    private void repealAbsent(
            Set<String> observedKeys,
            Map<ChangeClassification, Integer> counts,
            List<String> failed,
            BooleanSupplier cancellationRequested) {
        Set<ItemIdentity> observed = new HashSet<>();
        for (String key : observedKeys) {
            observed.add(new ItemIdentity(source.name(), key));
        }
        for (ItemIdentity identity : documentStore.currentIdentities(source.name())) {
            if (observed.contains(identity)) {
                continue;
            }
            if (isCancelled(cancellationRequested)) {
                return;
            }
            Optional<VersionedRecord> current = documentStore.currentFor(identity);
            if (current.isEmpty()) {
                continue;
            }
            try {
                documentStore.retract(current.get().id(), laterOf(clock.instant(), current.get().validFrom()));
                fingerprintStore.forget(identity);
                counts.merge(ChangeClassification.REPEALED, 1, Integer::sum);
                log.debug("[SYNC] Repealed {}", identity);
            } catch (StoreWriteConflictException conflict) {
                log.error("[SYNC] Consistency error repealing {}: {}", identity, conflict.getMessage());
                counts.merge(ChangeClassification.FAILED, 1, Integer::sum);
                failed.add(identity.key());
            } catch (RuntimeException failure) {
                log.warn("[SYNC] Could not repeal {}: {}", identity, describe(failure));
                counts.merge(ChangeClassification.FAILED, 1, Integer::sum);
                failed.add(identity.key());
            }
        }
        for (ItemIdentity identity : fingerprintStore.knownIdentities(source.name())) {
            if (!observed.contains(identity) && documentStore.currentFor(identity).isEmpty()) {
                fingerprintStore.forget(identity);
            }
        }
    }

    private ItemContent fetch(ListedItem item, Optional<Instant> ifModifiedSince) {
        return withRetry(() -> adapter.fetchItemContent(item, ifModifiedSince), "fetch of " + item.location());
    }

    private <T> T withRetry(Supplier<T> call, String operationName) {
        return RetrySupport.executeWithRetry(
                call,
                "[SYNC] " + operationName,
                settings.maxAttempts(),
                settings.initialBackoff(),
                SyncReconciler::isRetryable);
    }

    private VersionedRecord newVersion(
            ItemIdentity identity, ListedItem item, ItemContent content, String fingerprint, Instant now) {
        return VersionedRecord.newVersion(
                identity, source.collection(), item.location(), content.title(), content.body(), fingerprint, now);
    }

    static boolean isRetryable(Throwable failure) {
        return !(failure instanceof MalformedItemException) && TransientErrorClassifier.isTransient(failure);
    }

    private static boolean isCancelled(BooleanSupplier cancellationRequested) {
        return Thread.currentThread().isInterrupted() || cancellationRequested.getAsBoolean();
    }

    private static Instant laterOf(Instant first, Instant second) {
        return first.isBefore(second) ? second : first;
    }

    private static String describe(Throwable failure) {
        String message = failure.getMessage();
        return failure.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }

    private record ItemOutcome(String key, ChangeClassification classification) {}

    private record ItemBatch(List<ItemOutcome> outcomes, boolean cancelled) {}
}
