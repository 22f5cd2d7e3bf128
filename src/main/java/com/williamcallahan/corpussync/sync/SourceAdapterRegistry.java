package com.williamcallahan.corpussync.sync;

import com.williamcallahan.corpussync.config.AppProperties;
import com.williamcallahan.corpussync.domain.SourceDescriptor;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Selects the adapter for a source from its configured strategy and caches one adapter per source.
 */
@Component
public class SourceAdapterRegistry {

    private static final Logger log = LoggerFactory.getLogger(SourceAdapterRegistry.class);

    private final Map<String, SourceAdapterFactory> factories;
    private final SyncSettings settings;
    private final Map<String, SourceAdapter> adapters = new ConcurrentHashMap<>();

    @Autowired
    public SourceAdapterRegistry(List<SourceAdapterFactory> factories, AppProperties appProperties) {
        this(factories, SyncSettings.from(appProperties.getSync()));
    }

    SourceAdapterRegistry(List<SourceAdapterFactory> factories, SyncSettings settings) {
        Map<String, SourceAdapterFactory> byStrategy = new HashMap<>();
        for (SourceAdapterFactory factory : factories) {
            SourceAdapterFactory previous = byStrategy.put(factory.strategy(), factory);
            if (previous != null) {
                throw new IllegalStateException("Duplicate source adapter strategy: " + factory.strategy());
            }
        }
        this.factories = Map.copyOf(byStrategy);
        this.settings = settings;
        log.info("[SYNC] Source adapter strategies available: {}", this.factories.keySet());
    }

    /**
     * Returns the adapter for the source, creating it on first use.
     *
     * @throws IllegalStateException if no factory handles the source's strategy
     */
    public SourceAdapter adapterFor(SourceDescriptor source) {
        return adapters.computeIfAbsent(source.name(), name -> {
            SourceAdapterFactory factory = factories.get(source.strategy());
            if (factory == null) {
                throw new IllegalStateException(
                        "No source adapter for strategy '" + source.strategy() + "' of source " + name);
            }
            return factory.create(source, settings);
        });
    }

    public boolean supports(String strategy) {
        return factories.containsKey(strategy);
    }
}
