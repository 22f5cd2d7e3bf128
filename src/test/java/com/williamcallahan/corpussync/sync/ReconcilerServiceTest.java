package com.williamcallahan.corpussync.sync;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

import com.williamcallahan.corpussync.config.SourceCatalog;
import com.williamcallahan.corpussync.domain.ChangeClassification;
import com.williamcallahan.corpussync.domain.SourceDescriptor;
import com.williamcallahan.corpussync.domain.UnknownSourceException;
import com.williamcallahan.corpussync.store.CheckpointStore;
import com.williamcallahan.corpussync.store.FingerprintStore;
import com.williamcallahan.corpussync.store.VersionedDocumentStore;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Verifies asynchronous cycle acceptance, single-flight per source and completion events.
 */
class ReconcilerServiceTest {

    private static final long WAIT_MILLIS = 10_000;

    @TempDir
    Path tempDir;

    private final StubSourceAdapter upstream = new StubSourceAdapter();
    private final ApplicationEventPublisher events = mock(ApplicationEventPublisher.class);
    private final SourceStatusTracker statusTracker = new SourceStatusTracker();
    private ReconcilerService service;
    private VersionedDocumentStore documents;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        documents = new VersionedDocumentStore(tempDir.resolve("records"), false, clock);
        SourceDescriptor source = new SourceDescriptor(
                "news", "stub", "docs", Duration.ofHours(1), false, List.of(), Map.of());
        SourceAdapterFactory factory = new SourceAdapterFactory() {
            @Override
            public String strategy() {
                return "stub";
            }

            @Override
            public SourceAdapter create(SourceDescriptor descriptor, SyncSettings settings) {
                return upstream;
            }
        };
        SyncSettings settings = new SyncSettings(1, Duration.ZERO, Duration.ofSeconds(5), 2, "test");
        service = new ReconcilerService(
                new SourceCatalog(List.of(source)),
                new SourceAdapterRegistry(List.of(factory), settings),
                new CheckpointStore(tempDir.resolve("checkpoints"), false, clock),
                new FingerprintStore(tempDir.resolve("fingerprints"), false, clock),
                documents,
                new ContentFingerprinter(),
                settings,
                statusTracker,
                events,
                clock);
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    @Test
    void runsAcceptedCycleAndPublishesCompletion() throws InterruptedException {
        upstream.put("a", "Alpha", "body").list("a");

        CycleView accepted = service.trigger("news");
        assertEquals(CycleStatus.RUNNING, accepted.status());

        CycleView finished = awaitFinished(accepted.cycleId());
        assertEquals(CycleStatus.SUCCEEDED, finished.status());
        assertEquals(1, finished.report().count(ChangeClassification.NEW));
        assertEquals(1, documents.countCurrent("docs"));

        ArgumentCaptor<CycleCompletedEvent> published = ArgumentCaptor.forClass(CycleCompletedEvent.class);
        verify(events, timeout(WAIT_MILLIS)).publishEvent(published.capture());
        assertEquals("docs", published.getValue().collection());
        assertEquals(1, published.getValue().writes());

        SourceStatus status = statusTracker.statusOrEmpty("news");
        assertEquals(CycleStatus.SUCCEEDED, status.lastStatus());
        assertEquals(0, status.consecutiveFailures());
    }

    @Test
    void cycleWithoutWritesPublishesNothing() throws InterruptedException {
        upstream.list();

        CycleView accepted = service.trigger("news");
        awaitFinished(accepted.cycleId());

        verify(events, never()).publishEvent(any(Object.class));
    }

    @Test
    void rejectsSecondTriggerWhileCycleRuns() throws InterruptedException {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        upstream.put("a", "Alpha", "body").list("a").beforeListing(() -> {
            entered.countDown();
            try {
                release.await(WAIT_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException interrupted) {
                Thread.currentThread().interrupt();
            }
        });

        CycleView first = service.trigger("news");
        assertTrue(entered.await(WAIT_MILLIS, TimeUnit.MILLISECONDS));

        CycleAlreadyRunningException rejected =
                assertThrows(CycleAlreadyRunningException.class, () -> service.trigger("news"));
        assertEquals(first.cycleId(), rejected.runningCycleId());
        assertEquals(Map.of("news", first.cycleId()), service.runningCycles());

        release.countDown();
        assertEquals(CycleStatus.SUCCEEDED, awaitFinished(first.cycleId()).status());
        assertTrue(service.runningCycles().isEmpty());
    }

    @Test
    void unknownSourceIsRejected() {
        assertThrows(UnknownSourceException.class, () -> service.trigger("missing"));
        assertEquals(Optional.empty(), service.cycle("missing"));
    }

    @Test
    void triggerAfterShutdownIsRefusedWithoutTrackingACycle() {
        upstream.put("a", "Alpha", "body").list("a");
        service.shutdown();

        IllegalStateException refused = assertThrows(IllegalStateException.class, () -> service.trigger("news"));

        assertEquals("Reconciler is shutting down", refused.getMessage());
        assertTrue(service.runningCycles().isEmpty());
        assertEquals(Optional.empty(), statusTracker.statusOf("news"));
        assertEquals(0, documents.countCurrent("docs"));
    }

    private CycleView awaitFinished(String cycleId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + WAIT_MILLIS;
        while (System.currentTimeMillis() < deadline) {
            Optional<CycleView> view = service.cycle(cycleId);
            if (view.isPresent() && view.get().status().isTerminal() && service.runningCycles().isEmpty()) {
                return view.get();
            }
            Thread.sleep(10);
        }
        throw new AssertionError("cycle " + cycleId + " did not finish");
    }
}
