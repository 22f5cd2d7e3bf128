package com.williamcallahan.corpussync.sync;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.corpussync.domain.ChangeClassification;
import com.williamcallahan.corpussync.domain.Checkpoint;
import com.williamcallahan.corpussync.domain.ItemIdentity;
import com.williamcallahan.corpussync.domain.SourceDescriptor;
import com.williamcallahan.corpussync.domain.VersionedRecord;
import com.williamcallahan.corpussync.store.CheckpointStore;
import com.williamcallahan.corpussync.store.FingerprintStore;
import com.williamcallahan.corpussync.store.VersionedDocumentStore;
import com.williamcallahan.corpussync.support.PipelineMetrics;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Exercises reconciliation cycles against real stores and a scripted upstream.
 */
class SyncReconcilerTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");
    private static final String SOURCE = "news";

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private CheckpointStore checkpoints;
    private FingerprintStore fingerprints;
    private VersionedDocumentStore documents;
    private StubSourceAdapter upstream;
    private final SimpleMeterRegistry meters = new SimpleMeterRegistry();

    @BeforeEach
    void setUp() {
        Metrics.addRegistry(meters);
        clock = new MutableClock(T0);
        checkpoints = new CheckpointStore(tempDir.resolve("checkpoints"), false, clock);
        fingerprints = new FingerprintStore(tempDir.resolve("fingerprints"), false, clock);
        documents = new VersionedDocumentStore(tempDir.resolve("records"), false, clock);
        upstream = new StubSourceAdapter();
    }

    @AfterEach
    void tearDown() {
        Metrics.removeRegistry(meters);
    }

    @Test
    void firstCycleInsertsEveryItemAndCommitsCheckpoint() {
        upstream.put("a", "Alpha", "first body").put("b", "Beta", "second body").list("a", "b").nextCursor("c-1");

        CycleReport report = reconciler(false).runCycle("cycle-1");

        assertEquals(CycleStatus.SUCCEEDED, report.status());
        assertEquals(2, report.count(ChangeClassification.NEW));
        assertTrue(report.checkpointCommitted());
        Checkpoint checkpoint = checkpoints.latest(SOURCE, SyncReconciler.LISTING_STREAM);
        assertEquals("c-1", checkpoint.cursor());
        assertEquals(1, checkpoint.generation());
        assertTrue(fingerprints.lookup(identity("a")).isPresent());
        assertEquals(2, documents.countCurrent("docs"));
    }

    @Test
    void unchangedContentOnlyRefreshesLastChecked() {
        upstream.put("a", "Alpha", "body").list("a");
        reconciler(false).runCycle("cycle-1");
        long sequenceAfterFirst = documents.latestSequence("docs");
        VersionedRecord first = documents.currentFor(identity("a")).orElseThrow();

        clock.advance(Duration.ofMinutes(5));
        upstream.put("a", "Alpha", "  body \n");
        CycleReport report = reconciler(false).runCycle("cycle-2");

        assertEquals(1, report.count(ChangeClassification.UNCHANGED));
        assertEquals(0, report.writes());
        VersionedRecord current = documents.currentFor(identity("a")).orElseThrow();
        assertEquals(first.id(), current.id());
        assertEquals(T0.plus(Duration.ofMinutes(5)), current.lastChecked());
        assertEquals(sequenceAfterFirst, documents.latestSequence("docs"));
    }

    @Test
    void changedContentSupersedesCurrentVersion() {
        upstream.put("a", "Alpha", "v1").list("a");
        reconciler(false).runCycle("cycle-1");
        VersionedRecord original = documents.currentFor(identity("a")).orElseThrow();

        clock.advance(Duration.ofMinutes(1));
        upstream.put("a", "Alpha", "v2");
        CycleReport report = reconciler(false).runCycle("cycle-2");

        assertEquals(1, report.count(ChangeClassification.UPDATED));
        List<VersionedRecord> history = documents.historyFor(identity("a"));
        assertEquals(2, history.size());
        VersionedRecord closed = history.get(0);
        VersionedRecord current = history.get(1);
        assertEquals(original.id(), closed.id());
        assertEquals(current.id(), closed.supersededBy());
        assertEquals(current.validFrom(), closed.validTo());
        assertEquals("v2", current.body());
        assertEquals(Optional.of(current.fingerprint()), fingerprints.lookup(identity("a")));
    }

    @Test
    void completeListingRepealsMissingItemAndReappearanceStartsFreshRecord() {
        upstream.put("a", "Alpha", "body a").put("b", "Beta", "body b").list("a", "b");
        reconciler(false).runCycle("cycle-1");
        VersionedRecord repealedCandidate = documents.currentFor(identity("b")).orElseThrow();

        clock.advance(Duration.ofMinutes(1));
        upstream.list("a");
        CycleReport repealCycle = reconciler(false).runCycle("cycle-2");

        assertEquals(1, repealCycle.count(ChangeClassification.REPEALED));
        assertTrue(documents.currentFor(identity("b")).isEmpty());
        assertTrue(fingerprints.lookup(identity("b")).isEmpty());
        assertTrue(documents.recordById(repealedCandidate.id()).orElseThrow().isRepealed());

        clock.advance(Duration.ofMinutes(1));
        upstream.list("a", "b");
        CycleReport reappearCycle = reconciler(false).runCycle("cycle-3");

        assertEquals(1, reappearCycle.count(ChangeClassification.NEW));
        VersionedRecord revived = documents.currentFor(identity("b")).orElseThrow();
        assertNotEquals(repealedCandidate.id(), revived.id());
        VersionedRecord stillRepealed = documents.recordById(repealedCandidate.id()).orElseThrow();
        assertTrue(stillRepealed.isRepealed());
        assertEquals(null, stillRepealed.supersededBy());
    }

    @Test
    void incompleteListingNeverRepeals() {
        upstream.put("a", "Alpha", "body a").put("b", "Beta", "body b").list("a", "b");
        reconciler(false).runCycle("cycle-1");

        upstream.list("a").incomplete();
        CycleReport report = reconciler(false).runCycle("cycle-2");

        assertEquals(0, report.count(ChangeClassification.REPEALED));
        assertTrue(documents.currentFor(identity("b")).isPresent());
    }

    @Test
    void failedItemKeepsCheckpointAndRetryWindowIsIdempotent() {
        upstream.put("a", "Alpha", "body a").put("b", "Beta", "body b").list("a", "b").nextCursor("c-1")
                .failItem("b");

        CycleReport failedCycle = reconciler(false).runCycle("cycle-1");

        assertEquals(CycleStatus.PARTIAL, failedCycle.status());
        assertFalse(failedCycle.checkpointCommitted());
        assertEquals(List.of("b"), failedCycle.failedIdentities());
        assertEquals(0, checkpoints.latest(SOURCE, SyncReconciler.LISTING_STREAM).generation());
        assertTrue(documents.currentFor(identity("a")).isPresent());

        upstream.recoverItem("b");
        CycleReport retried = reconciler(false).runCycle("cycle-2");

        assertEquals(CycleStatus.SUCCEEDED, retried.status());
        assertEquals(1, retried.count(ChangeClassification.UNCHANGED));
        assertEquals(1, retried.count(ChangeClassification.NEW));
        assertEquals(1, documents.historyFor(identity("a")).size());
        assertEquals("c-1", checkpoints.latest(SOURCE, SyncReconciler.LISTING_STREAM).cursor());
    }

    @Test
    void cycleClassificationsAreCountedPerSource() {
        upstream.put("a", "Alpha", "body a").put("b", "Beta", "body b").list("a", "b").failItem("b");

        reconciler(false).runCycle("cycle-1");
        upstream.recoverItem("b");
        reconciler(false).runCycle("cycle-2");

        assertEquals(2.0, itemCount("new"));
        assertEquals(1.0, itemCount("unchanged"));
        assertEquals(1.0, itemCount("failed"));
        assertEquals(0.0, itemCount("repealed"));
        assertEquals(1.0, meters.get(PipelineMetrics.SYNC_CYCLES).tags("source", SOURCE, "status", "partial")
                .counter().count());
        assertEquals(1.0, meters.get(PipelineMetrics.SYNC_CYCLES).tags("source", SOURCE, "status", "succeeded")
                .counter().count());
    }

    @Test
    void listingFailureWritesNothing() {
        upstream.failListing(new TransientFetchException("feed down"));

        CycleReport report = reconciler(false).runCycle("cycle-1");

        assertEquals(CycleStatus.FAILED, report.status());
        assertEquals(2, upstream.listingCalls());
        assertEquals(0, report.checkpointGeneration());
        assertEquals(0, documents.latestSequence("docs"));
    }

    @Test
    void conditionalFetchPassesLastCheckedAndTreatsNotModifiedAsUnchanged() {
        upstream.conditional(true).put("a", "Alpha", "body").list("a");
        reconciler(true).runCycle("cycle-1");

        clock.advance(Duration.ofMinutes(10));
        upstream.answerNotModified("a");
        CycleReport report = reconciler(true).runCycle("cycle-2");

        assertEquals(1, report.count(ChangeClassification.UNCHANGED));
        List<Optional<Instant>> hints = upstream.conditionalHints();
        assertEquals(Optional.empty(), hints.get(0));
        assertEquals(Optional.of(T0), hints.get(hints.size() - 1));
        assertEquals(T0.plus(Duration.ofMinutes(10)), documents.currentFor(identity("a")).orElseThrow().lastChecked());
    }

    @Test
    void conditionalFetchIsSkippedWhenSourceDisablesIt() {
        upstream.conditional(true).put("a", "Alpha", "body").list("a");
        reconciler(false).runCycle("cycle-1");
        reconciler(false).runCycle("cycle-2");

        assertTrue(upstream.conditionalHints().stream().allMatch(Optional::isEmpty));
    }

    @Test
    void cancelledCycleLeavesCheckpointUntouched() {
        upstream.put("a", "Alpha", "body").list("a").nextCursor("c-1");

        CycleReport report = reconciler(false).runCycle("cycle-1", () -> true);

        assertEquals(CycleStatus.CANCELLED, report.status());
        assertFalse(report.checkpointCommitted());
        assertEquals(0, checkpoints.latest(SOURCE, SyncReconciler.LISTING_STREAM).generation());
    }

    private SyncReconciler reconciler(boolean conditionalFetch) {
        SourceDescriptor source = new SourceDescriptor(
                SOURCE, "stub", "docs", Duration.ofHours(1), conditionalFetch, List.of(), Map.of());
        return new SyncReconciler(
                source,
                upstream,
                checkpoints,
                fingerprints,
                documents,
                new ContentFingerprinter(),
                new SyncSettings(2, Duration.ZERO, Duration.ofSeconds(5), 2, "corpus-sync-test"),
                clock);
    }

    private static ItemIdentity identity(String key) {
        return new ItemIdentity(SOURCE, key);
    }

    private double itemCount(String classification) {
        return meters.get(PipelineMetrics.SYNC_ITEMS).tags("source", SOURCE, "classification", classification)
                .counter().count();
    }
}
