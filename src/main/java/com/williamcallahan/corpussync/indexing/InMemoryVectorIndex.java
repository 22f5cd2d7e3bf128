package com.williamcallahan.corpussync.indexing;

import com.williamcallahan.corpussync.domain.CollectionDescriptor;
import com.williamcallahan.corpussync.domain.ItemIdentity;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local vector index ranking by cosine similarity with an exhaustive scan.
 */
public class InMemoryVectorIndex implements VectorIndex {

    private final Map<String, Map<ItemIdentity, VectorEntry>> collections = new ConcurrentHashMap<>();

    @Override
    public void ensureCollection(CollectionDescriptor collection) {
        collections.computeIfAbsent(collection.name(), name -> new ConcurrentHashMap<>());
    }

    @Override
    public void upsert(String collection, List<VectorEntry> entries) {
        Map<ItemIdentity, VectorEntry> target = collections.computeIfAbsent(collection, name -> new ConcurrentHashMap<>());
        for (VectorEntry entry : entries) {
            target.put(entry.identity(), entry);
        }
    }

    @Override
    public void delete(String collection, Collection<ItemIdentity> identities) {
        Map<ItemIdentity, VectorEntry> target = collections.get(collection);
        if (target != null) {
            identities.forEach(target::remove);
        }
    }

    @Override
    public List<IndexHit> search(String collection, float[] query, int limit) {
        Map<ItemIdentity, VectorEntry> target = collections.get(collection);
        if (target == null || limit <= 0) {
            return List.of();
        }
        List<IndexHit> hits = new ArrayList<>(target.size());
        for (VectorEntry entry : target.values()) {
            hits.add(new IndexHit(entry.identity(), entry.recordId(), cosine(query, entry.vector())));
        }
        hits.sort(Comparator.comparingDouble(IndexHit::score)
                .reversed()
                .thenComparing(hit -> hit.identity().qualifiedKey()));
        return hits.size() > limit ? List.copyOf(hits.subList(0, limit)) : List.copyOf(hits);
    }

    @Override
    public long count(String collection) {
        Map<ItemIdentity, VectorEntry> target = collections.get(collection);
        return target == null ? 0 : target.size();
    }

    @Override
    public boolean isHealthy() {
        return true;
    }

    @Override
    public boolean isDurable() {
        return false;
    }

    @Override
    public String backendName() {
        return "in-memory";
    }

    static double cosine(float[] left, float[] right) {
        if (left.length != right.length) {
            throw new IllegalArgumentException(
                    "Vector dimension mismatch: " + left.length + " vs " + right.length);
        }
        double dot = 0;
        double leftNorm = 0;
        double rightNorm = 0;
        for (int index = 0; index < left.length; index++) {
            dot += left[index] * right[index];
            leftNorm += left[index] * left[index];
            rightNorm += right[index] * right[index];
        }
        if (leftNorm == 0 || rightNorm == 0) {
            return 0;
        }
        return dot / (Math.sqrt(leftNorm) * Math.sqrt(rightNorm));
    }
}
