package com.williamcallahan.corpussync.indexing;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

/**
 * Embedding client for an OpenAI-compatible {@code /v1/embeddings} endpoint.
 *
 * <p>Fails fast on unreachable providers and malformed responses; vectors are returned in input
 * order regardless of the order the provider lists them in.</p>
 */
public class RemoteEmbeddingClient implements EmbeddingClient {

    private static final Logger log = LoggerFactory.getLogger(RemoteEmbeddingClient.class);

    private static final String EMBEDDINGS_PATH = "/v1/embeddings";
    private static final int MAX_ERROR_SNIPPET = 512;

    private final String baseUrl;
    private final String modelName;
    private final String apiKey;
    private final int dimensions;
    private final int batchSize;
    private final RestTemplate restTemplate;

    /**
     * @param baseUrl provider base URL, without the embeddings path
     * @param modelName embedding model name sent with every request
     * @param apiKey bearer token, blank for unauthenticated providers
     * @param dimensions expected vector dimensions
     * @param batchSize maximum texts per HTTP request
     * @param timeout connect and read timeout
     * @param restTemplateBuilder Spring's RestTemplate builder
     */
    public RemoteEmbeddingClient(
            String baseUrl,
            String modelName,
            String apiKey,
            int dimensions,
            int batchSize,
            Duration timeout,
            RestTemplateBuilder restTemplateBuilder) {
        this(baseUrl, modelName, apiKey, dimensions, batchSize,
                restTemplateBuilder.connectTimeout(timeout).readTimeout(timeout).build());
    }

    RemoteEmbeddingClient(
            String baseUrl, String modelName, String apiKey, int dimensions, int batchSize, RestTemplate restTemplate) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        this.baseUrl = trimTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl"));
        this.modelName = Objects.requireNonNull(modelName, "modelName");
        this.apiKey = apiKey == null ? "" : apiKey;
        this.dimensions = dimensions;
        this.batchSize = batchSize;
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate");
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        try {
            return callEmbeddingApi(texts);
        } catch (RestClientResponseException apiException) {
            throw new EmbeddingServiceUnavailableException(formatHttpFailure(apiException), apiException);
        } catch (RestClientException | IllegalStateException apiException) {
            String details = sanitizeMessage(apiException.getMessage());
            String failureMessage = details.isBlank()
                    ? "Embedding request failed against " + baseUrl
                    : "Embedding request failed against " + baseUrl + ": " + details;
            throw new EmbeddingServiceUnavailableException(failureMessage, apiException);
        }
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    private List<float[]> callEmbeddingApi(List<String> texts) {
        List<float[]> embeddings = new ArrayList<>(texts.size());
        for (int startIndex = 0; startIndex < texts.size(); startIndex += batchSize) {
            int endIndex = Math.min(startIndex + batchSize, texts.size());
            List<String> batchInputTexts = List.copyOf(texts.subList(startIndex, endIndex));
            List<float[]> batchEmbeddings = fetchEmbeddingsFromApi(batchInputTexts);
            if (batchEmbeddings.size() != batchInputTexts.size()) {
                throw new EmbeddingServiceUnavailableException(
                        "Embedding response size mismatch for batch starting at index " + startIndex);
            }
            embeddings.addAll(batchEmbeddings);
        }
        log.debug("[EMBEDDING] Generated {} embeddings", embeddings.size());
        return List.copyOf(embeddings);
    }

    private List<float[]> fetchEmbeddingsFromApi(List<String> batchInputTexts) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (!apiKey.isBlank()) {
            headers.setBearerAuth(apiKey);
        }
        HttpEntity<EmbeddingBatchRequestPayload> entity =
                new HttpEntity<>(new EmbeddingBatchRequestPayload(modelName, batchInputTexts), headers);

        log.debug("[EMBEDDING] Calling embedding API batch with {} texts", batchInputTexts.size());
        EmbeddingResponsePayload response =
                restTemplate.postForObject(baseUrl + EMBEDDINGS_PATH, entity, EmbeddingResponsePayload.class);
        return parseEmbeddingResponse(response, batchInputTexts.size());
    }

    private List<float[]> parseEmbeddingResponse(EmbeddingResponsePayload response, int expectedCount) {
        if (response == null || response.data() == null || response.data().isEmpty()) {
            throw new IllegalStateException("Embedding response missing embedding entries");
        }

        float[][] embeddingsByIndex = new float[expectedCount][];
        List<EmbeddingVectorData> entries = response.data();
        for (int entryIndex = 0; entryIndex < entries.size(); entryIndex++) {
            EmbeddingVectorData entry = entries.get(entryIndex);
            if (entry == null) {
                throw new IllegalStateException("Embedding response contained null entry at index " + entryIndex);
            }
            int targetIndex = entry.index() == null ? entryIndex : entry.index();
            if (targetIndex < 0 || targetIndex >= expectedCount) {
                throw new IllegalStateException("Embedding response index out of bounds: " + targetIndex
                        + " (expectedCount=" + expectedCount + ")");
            }
            if (embeddingsByIndex[targetIndex] != null) {
                throw new IllegalStateException("Embedding response contained duplicate index " + targetIndex);
            }
            embeddingsByIndex[targetIndex] = toEmbeddingVector(entry.embedding(), targetIndex);
        }

        List<float[]> ordered = new ArrayList<>(expectedCount);
        for (int expectedIndex = 0; expectedIndex < expectedCount; expectedIndex++) {
            if (embeddingsByIndex[expectedIndex] == null) {
                throw new IllegalStateException("Embedding response missing embedding for index " + expectedIndex);
            }
            ordered.add(embeddingsByIndex[expectedIndex]);
        }
        return ordered;
    }

    private float[] toEmbeddingVector(List<Double> values, int embeddingIndex) {
        if (values == null || values.isEmpty()) {
            throw new IllegalStateException("Embedding response missing payload for index " + embeddingIndex);
        }
        if (values.size() != dimensions) {
            throw new EmbeddingServiceUnavailableException("Embedding dimension mismatch at index "
                    + embeddingIndex + ": expected " + dimensions + " but received " + values.size());
        }
        float[] vector = new float[values.size()];
        for (int valueIndex = 0; valueIndex < values.size(); valueIndex++) {
            Double value = values.get(valueIndex);
            if (value == null) {
                throw new IllegalStateException("Embedding value was null at index " + valueIndex);
            }
            vector[valueIndex] = value.floatValue();
        }
        return vector;
    }

    private static String formatHttpFailure(RestClientResponseException exception) {
        String payload = sanitizeMessage(exception.getResponseBodyAsString());
        String prefix = "Embedding server returned HTTP " + exception.getStatusCode().value();
        return payload.isBlank() ? prefix : prefix + ": " + payload;
    }

    private static String sanitizeMessage(String message) {
        if (message == null || message.isBlank()) {
            return "";
        }
        String sanitized = message.replace("\r", " ").replace("\n", " ").trim();
        if (sanitized.length() > MAX_ERROR_SNIPPET) {
            return sanitized.substring(0, MAX_ERROR_SNIPPET) + "...";
        }
        return sanitized;
    }

    private static String trimTrailingSlash(String url) {
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    record EmbeddingBatchRequestPayload(String model, List<String> input) {}

    record EmbeddingResponsePayload(List<EmbeddingVectorData> data) {}

    record EmbeddingVectorData(Integer index, List<Double> embedding) {}
}
