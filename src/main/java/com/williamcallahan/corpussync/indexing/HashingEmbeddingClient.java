package com.williamcallahan.corpussync.indexing;

import com.williamcallahan.corpussync.support.TextNormalizer;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.util.StringHelper;

/**
 * Deterministic feature-hashing embedding that needs no external service.
 *
 * <p>Each analyzed token is hashed to a bucket with Lucene's murmur3 and added with a sign taken
 * from a second hash, then the vector is L2-normalized. Identical text always yields the identical
 * vector, so re-indexing is stable across restarts.</p>
 */
public class HashingEmbeddingClient implements EmbeddingClient {

    private static final String TOKEN_STREAM_FIELD = "embedding_text";
    private static final int BUCKET_SEED = 0;
    private static final int SIGN_SEED = 0x9747b28c;

    private final int dimensions;

    public HashingEmbeddingClient(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.dimensions = dimensions;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embedOne(text == null ? "" : text));
        }
        return List.copyOf(vectors);
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    private float[] embedOne(String text) {
        float[] vector = new float[dimensions];
        String normalized = TextNormalizer.toLowerAscii(TextNormalizer.canonicalize(text));
        int tokens = accumulate(normalized, vector);
        if (tokens == 0 && !normalized.isEmpty()) {
            addFeature(normalized, vector);
        }
        return normalize(vector);
    }

    private int accumulate(String text, float[] vector) {
        int tokens = 0;
        try (StandardAnalyzer analyzer = new StandardAnalyzer();
                TokenStream tokenStream = analyzer.tokenStream(TOKEN_STREAM_FIELD, text)) {
            CharTermAttribute termAttribute = tokenStream.addAttribute(CharTermAttribute.class);
            tokenStream.reset();
            while (tokenStream.incrementToken()) {
                addFeature(termAttribute.toString(), vector);
                tokens++;
            }
            tokenStream.end();
        } catch (IOException ioException) {
            throw new EmbeddingServiceUnavailableException("Failed to tokenize text for hashing embedding", ioException);
        }
        return tokens;
    }

    private void addFeature(String token, float[] vector) {
        byte[] bytes = token.getBytes(StandardCharsets.UTF_8);
        int bucket = Math.floorMod(StringHelper.murmurhash3_x86_32(bytes, 0, bytes.length, BUCKET_SEED), dimensions);
        int sign = (StringHelper.murmurhash3_x86_32(bytes, 0, bytes.length, SIGN_SEED) & 1) == 0 ? 1 : -1;
        vector[bucket] += sign;
    }

    private static float[] normalize(float[] vector) {
        double sumOfSquares = 0;
        for (float component : vector) {
            sumOfSquares += component * component;
        }
        if (sumOfSquares == 0) {
            // Empty text maps to a fixed unit vector so cosine similarity stays defined.
            vector[0] = 1f;
            return vector;
        }
        float norm = (float) Math.sqrt(sumOfSquares);
        for (int index = 0; index < vector.length; index++) {
            vector[index] /= norm;
        }
        return vector;
    }
}
