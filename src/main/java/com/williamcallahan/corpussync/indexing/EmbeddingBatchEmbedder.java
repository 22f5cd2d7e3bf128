package com.williamcallahan.corpussync.indexing;

import com.williamcallahan.corpussync.domain.VersionedRecord;
import java.util.List;
import java.util.Objects;

/**
 * Embeds a batch of records in one provider call and checks that vectors line up with records.
 */
final class EmbeddingBatchEmbedder {

    private EmbeddingBatchEmbedder() {}

    static List<float[]> embedRecords(EmbeddingClient embeddingClient, List<VersionedRecord> records) {
        Objects.requireNonNull(embeddingClient, "embeddingClient");
        Objects.requireNonNull(records, "records");
        if (records.isEmpty()) {
            return List.of();
        }

        List<String> texts = records.stream().map(EmbeddingBatchEmbedder::embeddingText).toList();
        List<float[]> embeddings;
        try {
            embeddings = embeddingClient.embed(texts);
        } catch (EmbeddingServiceUnavailableException embeddingFailure) {
            throw new EmbeddingServiceUnavailableException(
                    "Embedding failed for batch of " + records.size() + " records (first="
                            + records.get(0).identity() + ", last="
                            + records.get(records.size() - 1).identity() + ")",
                    embeddingFailure);
        }

        if (embeddings.size() != records.size()) {
            throw new EmbeddingServiceUnavailableException("Embedding response count mismatch: expected "
                    + records.size() + " but received " + embeddings.size());
        }
        for (int index = 0; index < embeddings.size(); index++) {
            float[] vector = embeddings.get(index);
            if (vector == null || vector.length != embeddingClient.dimensions()) {
                throw new EmbeddingServiceUnavailableException(
                        "Embedding for " + records.get(index).identity() + " has unexpected dimensions");
            }
        }
        return embeddings;
    }

    /**
     * Text sent to the embedding provider: title and body, blank parts omitted.
     */
    static String embeddingText(VersionedRecord record) {
        String title = record.title() == null ? "" : record.title().trim();
        String body = record.body() == null ? "" : record.body().trim();
        if (title.isEmpty()) {
            return body;
        }
        return body.isEmpty() ? title : title + "\n\n" + body;
    }
}
