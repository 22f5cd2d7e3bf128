package com.williamcallahan.corpussync.domain;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable configuration of one upstream origin.
 *
 * @param name unique source name
 * @param strategy fetch strategy identifier used to select the adapter
 * @param collection collection the source's records are written into
 * @param cadence base reconciliation cadence
 * @param conditionalFetch whether conditional fetch may be used for this source
 * @param urls upstream URLs the adapter reads
 * @param settings adapter-specific settings
 */
public record SourceDescriptor(
        String name,
        String strategy,
        String collection,
        Duration cadence,
        boolean conditionalFetch,
        List<String> urls,
        Map<String, String> settings) {

    public SourceDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(collection, "collection");
        cadence = cadence == null ? Duration.ZERO : cadence;
        urls = urls == null ? List.of() : List.copyOf(urls);
        settings = settings == null ? Map.of() : Map.copyOf(settings);
    }

    public String setting(String key, String fallback) {
        return settings.getOrDefault(key, fallback);
    }
}
