package com.williamcallahan.corpussync.indexing;

import static io.qdrant.client.ValueFactory.value;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.util.concurrent.Futures;
import com.williamcallahan.corpussync.domain.CollectionDescriptor;
import com.williamcallahan.corpussync.domain.ItemIdentity;
import io.qdrant.client.QdrantClient;
import io.qdrant.client.grpc.Collections.CollectionOperationResponse;
import io.qdrant.client.grpc.Collections.Distance;
import io.qdrant.client.grpc.Collections.VectorParams;
import io.qdrant.client.grpc.Points.PointStruct;
import io.qdrant.client.grpc.Points.ScoredPoint;
import io.qdrant.client.grpc.Points.SearchPoints;
import io.qdrant.client.grpc.Points.UpdateResult;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

/**
 * Verifies Qdrant request mapping and failure translation with a mocked gRPC client.
 */
class QdrantVectorIndexTest {

    private static final ItemIdentity ITEM = new ItemIdentity("news", "https://example.com/a");

    private QdrantClient qdrantClient;
    private QdrantVectorIndex index;

    @BeforeEach
    void setUp() {
        qdrantClient = mock(QdrantClient.class);
        index = new QdrantVectorIndex(qdrantClient, "corpus_", Duration.ofSeconds(2));
    }

    @Test
    void createsMissingCollectionOnceWithCosineDistance() {
        when(qdrantClient.collectionExistsAsync("corpus_docs")).thenReturn(Futures.immediateFuture(false));
        when(qdrantClient.createCollectionAsync(eq("corpus_docs"), any(VectorParams.class)))
                .thenReturn(Futures.immediateFuture(CollectionOperationResponse.getDefaultInstance()));
        CollectionDescriptor docs = new CollectionDescriptor("docs", 384, "public");

        index.ensureCollection(docs);
        index.ensureCollection(docs);

        ArgumentCaptor<VectorParams> params = ArgumentCaptor.forClass(VectorParams.class);
        verify(qdrantClient, times(1)).createCollectionAsync(eq("corpus_docs"), params.capture());
        assertEquals(384, params.getValue().getSize());
        assertEquals(Distance.Cosine, params.getValue().getDistance());
        verify(qdrantClient, times(1)).collectionExistsAsync("corpus_docs");
    }

    @Test
    void existingCollectionIsNotRecreated() {
        when(qdrantClient.collectionExistsAsync("corpus_docs")).thenReturn(Futures.immediateFuture(true));

        index.ensureCollection(new CollectionDescriptor("docs", 8, null));

        verify(qdrantClient, never()).createCollectionAsync(any(String.class), any(VectorParams.class));
    }

    @Test
    @SuppressWarnings("unchecked")
    void upsertUsesStableIdentityPointIdsAndIdentityPayload() {
        when(qdrantClient.upsertAsync(eq("corpus_docs"), anyList()))
                .thenReturn(Futures.immediateFuture(UpdateResult.getDefaultInstance()));

        index.upsert("docs", List.of(new VectorEntry(ITEM, "rec-1", new float[] {0.1f, 0.2f}, "Title", ITEM.key())));

        ArgumentCaptor<List<PointStruct>> points = ArgumentCaptor.forClass(List.class);
        verify(qdrantClient).upsertAsync(eq("corpus_docs"), points.capture());
        PointStruct point = points.getValue().get(0);
        assertEquals(QdrantVectorIndex.pointId(ITEM), point.getId());
        assertEquals("news", point.getPayloadMap().get(QdrantVectorIndex.PAYLOAD_SOURCE).getStringValue());
        assertEquals(ITEM.key(), point.getPayloadMap().get(QdrantVectorIndex.PAYLOAD_KEY).getStringValue());
        assertEquals("rec-1", point.getPayloadMap().get(QdrantVectorIndex.PAYLOAD_RECORD_ID).getStringValue());
    }

    @Test
    void pointIdsDifferAcrossSourcesWithTheSameKey() {
        assertFalse(QdrantVectorIndex.pointId(ITEM)
                .equals(QdrantVectorIndex.pointId(new ItemIdentity("other", ITEM.key()))));
        assertEquals(QdrantVectorIndex.pointId(ITEM), QdrantVectorIndex.pointId(new ItemIdentity("news", ITEM.key())));
    }

    @Test
    void searchMapsPayloadBackToIdentityAndSkipsForeignPoints() {
        ScoredPoint hit = ScoredPoint.newBuilder()
                .setId(QdrantVectorIndex.pointId(ITEM))
                .setScore(0.87f)
                .putAllPayload(Map.of(
                        QdrantVectorIndex.PAYLOAD_SOURCE, value("news"),
                        QdrantVectorIndex.PAYLOAD_KEY, value(ITEM.key()),
                        QdrantVectorIndex.PAYLOAD_RECORD_ID, value("rec-1")))
                .build();
        ScoredPoint foreign = ScoredPoint.newBuilder().setScore(0.5f).build();
        when(qdrantClient.searchAsync(any(SearchPoints.class)))
                .thenReturn(Futures.immediateFuture(List.of(hit, foreign)));

        List<IndexHit> hits = index.search("docs", new float[] {0.3f, 0.4f}, 5);

        assertEquals(1, hits.size());
        assertEquals(ITEM, hits.get(0).identity());
        assertEquals("rec-1", hits.get(0).recordId());
        assertEquals(0.87, hits.get(0).score(), 1e-6);
        ArgumentCaptor<SearchPoints> request = ArgumentCaptor.forClass(SearchPoints.class);
        verify(qdrantClient).searchAsync(request.capture());
        assertEquals("corpus_docs", request.getValue().getCollectionName());
        assertEquals(5, request.getValue().getLimit());
        assertEquals(2, request.getValue().getVectorCount());
    }

    @Test
    void backendFailuresBecomeTransientIndexErrors() {
        when(qdrantClient.searchAsync(any(SearchPoints.class)))
                .thenReturn(Futures.immediateFailedFuture(new RuntimeException("UNAVAILABLE: io exception")));

        IndexBackendUnavailableException failure = assertThrows(
                IndexBackendUnavailableException.class, () -> index.search("docs", new float[] {1f}, 3));

        assertEquals("qdrant", failure.backend());
    }

    @Test
    void healthCheckReportsListFailures() {
        when(qdrantClient.listCollectionsAsync())
                .thenReturn(Futures.immediateFuture(List.of("corpus_docs")))
                .thenReturn(Futures.immediateFailedFuture(new RuntimeException("connection refused")));

        assertTrue(index.isHealthy());
        assertFalse(index.isHealthy());
    }
}
