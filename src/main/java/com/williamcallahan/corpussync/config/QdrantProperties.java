package com.williamcallahan.corpussync.config;

import java.time.Duration;
import java.util.Locale;

/**
 * Qdrant connection settings bound from {@code app.qdrant}. When disabled the in-memory
 * vector index is used instead.
 */
public class QdrantProperties {

    private static final String HOST_KEY = "app.qdrant.host";
    private static final String PORT_KEY = "app.qdrant.port";
    private static final String TIMEOUT_KEY = "app.qdrant.timeout";
    private static final String BLANK_FMT = "%s must not be blank when Qdrant is enabled.";
    private static final String PORT_FMT = "%s must be between 1 and 65535.";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";

    private boolean enabled;
    private String host = "localhost";
    private int port = 6334;
    private boolean useTls;
    private String apiKey = "";
    private String collectionPrefix = "";
    private Duration timeout = Duration.ofSeconds(10);

    /**
     * Validates Qdrant settings.
     */
    public void validateConfiguration() {
        if (!enabled) {
            return;
        }
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, BLANK_FMT, HOST_KEY));
        }
        if (port < 1 || port > 65_535) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, PORT_FMT, PORT_KEY));
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, TIMEOUT_KEY));
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public boolean isUseTls() {
        return useTls;
    }

    public void setUseTls(boolean useTls) {
        this.useTls = useTls;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey == null ? "" : apiKey;
    }

    public String getCollectionPrefix() {
        return collectionPrefix;
    }

    public void setCollectionPrefix(String collectionPrefix) {
        this.collectionPrefix = collectionPrefix == null ? "" : collectionPrefix;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }
}
