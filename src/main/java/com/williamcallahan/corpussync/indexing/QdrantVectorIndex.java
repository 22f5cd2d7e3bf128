package com.williamcallahan.corpussync.indexing;

import static io.qdrant.client.PointIdFactory.id;
import static io.qdrant.client.ValueFactory.value;
import static io.qdrant.client.VectorsFactory.vectors;
import static io.qdrant.client.WithPayloadSelectorFactory.enable;

import com.google.common.util.concurrent.ListenableFuture;
import com.williamcallahan.corpussync.domain.CollectionDescriptor;
import com.williamcallahan.corpussync.domain.ItemIdentity;
import io.qdrant.client.QdrantClient;
import io.qdrant.client.grpc.Collections.Distance;
import io.qdrant.client.grpc.Collections.VectorParams;
import io.qdrant.client.grpc.JsonWithInt.Value;
import io.qdrant.client.grpc.Points.Filter;
import io.qdrant.client.grpc.Points.PointId;
import io.qdrant.client.grpc.Points.PointStruct;
import io.qdrant.client.grpc.Points.ScoredPoint;
import io.qdrant.client.grpc.Points.SearchPoints;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Vector index backed by Qdrant over gRPC.
 *
 * <p>Point ids are name-based UUIDs derived from the item identity, so an upsert for an identity
 * always replaces its previous point. Identity fields and the record id travel in the payload.</p>
 */
public class QdrantVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(QdrantVectorIndex.class);

    static final String PAYLOAD_SOURCE = "source";
    static final String PAYLOAD_KEY = "key";
    static final String PAYLOAD_RECORD_ID = "recordId";
    static final String PAYLOAD_TITLE = "title";
    static final String PAYLOAD_LOCATION = "location";
    private static final String BACKEND = "qdrant";

    private final QdrantClient qdrantClient;
    private final String collectionPrefix;
    private final long timeoutMillis;
    private final Set<String> ensuredCollections = ConcurrentHashMap.newKeySet();

    public QdrantVectorIndex(QdrantClient qdrantClient, String collectionPrefix, Duration timeout) {
        this.qdrantClient = Objects.requireNonNull(qdrantClient, "qdrantClient");
        this.collectionPrefix = collectionPrefix == null ? "" : collectionPrefix;
        this.timeoutMillis = Objects.requireNonNull(timeout, "timeout").toMillis();
    }

    @Override
    public void ensureCollection(CollectionDescriptor collection) {
        String physicalName = physicalName(collection.name());
        if (ensuredCollections.contains(physicalName)) {
            return;
        }
        Boolean exists = awaitFuture(qdrantClient.collectionExistsAsync(physicalName), "collection exists");
        if (!Boolean.TRUE.equals(exists)) {
            VectorParams params = VectorParams.newBuilder()
                    .setSize(collection.dimensions())
                    .setDistance(Distance.Cosine)
                    .build();
            awaitFuture(qdrantClient.createCollectionAsync(physicalName, params), "create collection");
            log.info("[QDRANT] Created collection {} with {} dimensions", physicalName, collection.dimensions());
        }
        ensuredCollections.add(physicalName);
    }

    @Override
    public void upsert(String collection, List<VectorEntry> entries) {
        if (entries.isEmpty()) {
            return;
        }
        List<PointStruct> points = new ArrayList<>(entries.size());
        for (VectorEntry entry : entries) {
            points.add(PointStruct.newBuilder()
                    .setId(pointId(entry.identity()))
                    .setVectors(vectors(entry.vector()))
                    .putAllPayload(Map.of(
                            PAYLOAD_SOURCE, value(entry.identity().source()),
                            PAYLOAD_KEY, value(entry.identity().key()),
                            PAYLOAD_RECORD_ID, value(entry.recordId()),
                            PAYLOAD_TITLE, value(entry.title()),
                            PAYLOAD_LOCATION, value(entry.location())))
                    .build());
        }
        awaitFuture(qdrantClient.upsertAsync(physicalName(collection), points), "upsert");
        log.debug("[QDRANT] Upserted {} points into {}", points.size(), collection);
    }

    @Override
    public void delete(String collection, Collection<ItemIdentity> identities) {
        if (identities.isEmpty()) {
            return;
        }
        List<PointId> ids = identities.stream().map(QdrantVectorIndex::pointId).toList();
        awaitFuture(qdrantClient.deleteAsync(physicalName(collection), ids), "delete");
        log.debug("[QDRANT] Deleted {} points from {}", ids.size(), collection);
    }

    @Override
    public List<IndexHit> search(String collection, float[] query, int limit) {
        List<Float> queryVector = new ArrayList<>(query.length);
        for (float component : query) {
            queryVector.add(component);
        }
        SearchPoints request = SearchPoints.newBuilder()
                .setCollectionName(physicalName(collection))
                .addAllVector(queryVector)
                .setLimit(limit)
                .setWithPayload(enable(true))
                .build();
        List<ScoredPoint> points = awaitFuture(qdrantClient.searchAsync(request), "search");
        List<IndexHit> hits = new ArrayList<>(points.size());
        for (ScoredPoint point : points) {
            Map<String, Value> payload = point.getPayloadMap();
            Value source = payload.get(PAYLOAD_SOURCE);
            Value key = payload.get(PAYLOAD_KEY);
            Value recordId = payload.get(PAYLOAD_RECORD_ID);
            if (source == null || key == null || recordId == null) {
                log.warn("[QDRANT] Skipping point without identity payload in {}", collection);
                continue;
            }
            hits.add(new IndexHit(
                    new ItemIdentity(source.getStringValue(), key.getStringValue()),
                    recordId.getStringValue(),
                    point.getScore()));
        }
        return hits;
    }

    @Override
    public long count(String collection) {
        Long count = awaitFuture(
                qdrantClient.countAsync(physicalName(collection), Filter.getDefaultInstance(), true), "count");
        return count == null ? 0 : count;
    }

    @Override
    public boolean isHealthy() {
        try {
            awaitFuture(qdrantClient.listCollectionsAsync(), "list collections");
            return true;
        } catch (IndexBackendUnavailableException unavailable) {
            log.warn("[QDRANT] Health check failed: {}", unavailable.getMessage());
            return false;
        }
    }

    @Override
    public String backendName() {
        return BACKEND;
    }

    String physicalName(String collection) {
        return collectionPrefix + collection;
    }

    static PointId pointId(ItemIdentity identity) {
        return id(UUID.nameUUIDFromBytes(identity.qualifiedKey().getBytes(StandardCharsets.UTF_8)));
    }

    private <T> T awaitFuture(ListenableFuture<T> future, String operation) {
        try {
            return future.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new IndexBackendUnavailableException(BACKEND, "Qdrant " + operation + " interrupted", interrupted);
        } catch (ExecutionException executionException) {
            Throwable cause = executionException.getCause() == null ? executionException : executionException.getCause();
            throw new IndexBackendUnavailableException(BACKEND, "Qdrant " + operation + " failed", cause);
        } catch (TimeoutException timeoutException) {
            future.cancel(true);
            throw new IndexBackendUnavailableException(
                    BACKEND, "Qdrant " + operation + " timed out after " + timeoutMillis + "ms", timeoutException);
        }
    }
}
