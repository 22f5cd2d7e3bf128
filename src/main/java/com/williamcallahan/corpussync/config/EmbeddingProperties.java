package com.williamcallahan.corpussync.config;

import com.williamcallahan.corpussync.support.TextNormalizer;
import java.time.Duration;
import java.util.Locale;

/**
 * Embedding provider settings bound from {@code app.embedding}.
 */
public class EmbeddingProperties {

    /** Deterministic feature-hashing embeddings computed in process. */
    public static final String PROVIDER_HASH = "hash";
    /** OpenAI-compatible {@code /v1/embeddings} endpoint. */
    public static final String PROVIDER_REMOTE = "remote";

    private static final int DIM_DEF = 384;
    private static final int BATCH_SIZE_DEF = 32;
    private static final Duration TIMEOUT_DEF = Duration.ofSeconds(30);
    private static final String PROVIDER_KEY = "app.embedding.provider";
    private static final String DIM_KEY = "app.embedding.dimensions";
    private static final String BATCH_SIZE_KEY = "app.embedding.batch-size";
    private static final String URL_KEY = "app.embedding.server-url";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";
    private static final String PROVIDER_FMT = "%s must be '%s' or '%s' (got '%s').";
    private static final String BLANK_URL_MSG = "%s must not be blank when the remote provider is selected.";

    private String provider = PROVIDER_HASH;
    private int dimensions = DIM_DEF;
    private int batchSize = BATCH_SIZE_DEF;
    private String serverUrl = "";
    private String model = "text-embedding-3-small";
    private String apiKey = "";
    private Duration timeout = TIMEOUT_DEF;

    /**
     * Validates embedding settings.
     */
    public void validateConfiguration() {
        String normalizedProvider = TextNormalizer.toLowerAscii(provider).trim();
        if (!PROVIDER_HASH.equals(normalizedProvider) && !PROVIDER_REMOTE.equals(normalizedProvider)) {
            throw new IllegalArgumentException(String.format(
                    Locale.ROOT, PROVIDER_FMT, PROVIDER_KEY, PROVIDER_HASH, PROVIDER_REMOTE, provider));
        }
        if (dimensions < 1) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, DIM_KEY));
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, BATCH_SIZE_KEY));
        }
        if (isRemote() && (serverUrl == null || serverUrl.isBlank())) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, BLANK_URL_MSG, URL_KEY));
        }
    }

    public boolean isRemote() {
        return PROVIDER_REMOTE.equals(TextNormalizer.toLowerAscii(provider).trim());
    }

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public int getDimensions() {
        return dimensions;
    }

    public void setDimensions(int dimensions) {
        this.dimensions = dimensions;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public String getServerUrl() {
        return serverUrl;
    }

    public void setServerUrl(String serverUrl) {
        this.serverUrl = serverUrl == null ? "" : serverUrl;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey == null ? "" : apiKey;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }
}
