package com.williamcallahan.corpussync.config;

import com.williamcallahan.corpussync.indexing.VectorIndex;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Exposes the vector index backend through {@code /actuator/health}.
 */
@Component
public class VectorIndexHealthIndicator implements HealthIndicator {

    private static final String DETAIL_KEY_BACKEND = "backend";

    private final VectorIndex vectorIndex;

    public VectorIndexHealthIndicator(VectorIndex vectorIndex) {
        this.vectorIndex = vectorIndex;
    }

    @Override
    public Health health() {
        Health.Builder builder = vectorIndex.isHealthy() ? Health.up() : Health.down();
        return builder.withDetail(DETAIL_KEY_BACKEND, vectorIndex.backendName()).build();
    }
}
