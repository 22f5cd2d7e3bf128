package com.williamcallahan.corpussync.indexing;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;

class IndexPollerTest {

    private final IndexingCoordinator coordinator = mock(IndexingCoordinator.class);
    private final IndexPoller poller = new IndexPoller(coordinator);

    @Test
    void pollsLaggingCollectionsWhileAcceptingJobs() {
        when(coordinator.isAcceptingJobs()).thenReturn(true);

        poller.poll();

        verify(coordinator).indexLaggingCollections();
    }

    @Test
    void skipsPollAfterShutdown() {
        when(coordinator.isAcceptingJobs()).thenReturn(false);

        poller.poll();

        verify(coordinator, never()).indexLaggingCollections();
    }

    @Test
    void pollFailureDoesNotEscape() {
        when(coordinator.isAcceptingJobs()).thenReturn(true);
        doThrow(new IndexBackendUnavailableException("qdrant", "down")).when(coordinator).indexLaggingCollections();

        poller.poll();

        verify(coordinator).indexLaggingCollections();
    }
}
