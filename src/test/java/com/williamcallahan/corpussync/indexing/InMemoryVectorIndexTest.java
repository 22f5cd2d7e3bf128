package com.williamcallahan.corpussync.indexing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.corpussync.domain.CollectionDescriptor;
import com.williamcallahan.corpussync.domain.ItemIdentity;
import java.util.List;
import org.junit.jupiter.api.Test;

class InMemoryVectorIndexTest {

    private final InMemoryVectorIndex index = new InMemoryVectorIndex();

    @Test
    void ranksByCosineSimilarityAndRespectsLimit() {
        index.ensureCollection(new CollectionDescriptor("docs", 2, null));
        index.upsert("docs", List.of(
                entry("east", new float[] {1f, 0f}),
                entry("north", new float[] {0f, 1f}),
                entry("north-east", new float[] {1f, 1f})));

        List<IndexHit> hits = index.search("docs", new float[] {1f, 0.1f}, 2);

        assertEquals(List.of("east", "north-east"), hits.stream().map(hit -> hit.identity().key()).toList());
    }

    @Test
    void upsertIsKeyedByIdentityAndDeleteRemoves() {
        index.upsert("docs", List.of(entry("a", new float[] {1f, 0f})));
        index.upsert("docs", List.of(entry("a", new float[] {0f, 1f})));
        assertEquals(1, index.count("docs"));

        index.delete("docs", List.of(new ItemIdentity("news", "a")));

        assertEquals(0, index.count("docs"));
        assertTrue(index.search("docs", new float[] {1f, 0f}, 5).isEmpty());
    }

    @Test
    void rejectsDimensionMismatch() {
        assertThrows(IllegalArgumentException.class,
                () -> InMemoryVectorIndex.cosine(new float[] {1f}, new float[] {1f, 0f}));
    }

    private static VectorEntry entry(String key, float[] vector) {
        return new VectorEntry(new ItemIdentity("news", key), "rec-" + key, vector, key, "");
    }
}
