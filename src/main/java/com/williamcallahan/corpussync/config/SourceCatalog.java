package com.williamcallahan.corpussync.config;

import com.williamcallahan.corpussync.domain.SourceDescriptor;
import com.williamcallahan.corpussync.domain.UnknownSourceException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Immutable view of the configured sources.
 */
@Component
public class SourceCatalog {

    private final Map<String, SourceDescriptor> sources;
    private final List<SourceDescriptor> ordered;

    @Autowired
    public SourceCatalog(AppProperties appProperties) {
        this(appProperties.sourceDescriptors().values());
    }

    /**
     * Creates a catalog from explicit descriptors.
     */
    public SourceCatalog(Collection<SourceDescriptor> descriptors) {
        Map<String, SourceDescriptor> byName = new LinkedHashMap<>();
        for (SourceDescriptor descriptor : descriptors) {
            byName.put(descriptor.name(), descriptor);
        }
        this.sources = Map.copyOf(byName);
        this.ordered = List.copyOf(byName.values());
    }

    public Optional<SourceDescriptor> find(String name) {
        return Optional.ofNullable(name == null ? null : sources.get(name));
    }

    /**
     * Returns the named source.
     *
     * @throws UnknownSourceException if no such source is configured
     */
    public SourceDescriptor require(String name) {
        return find(name).orElseThrow(() -> new UnknownSourceException(name));
    }

    public List<SourceDescriptor> all() {
        return ordered;
    }

    /**
     * Returns the sources writing into the collection.
     */
    public List<SourceDescriptor> feeding(String collection) {
        List<SourceDescriptor> feeding = new ArrayList<>();
        for (SourceDescriptor source : ordered) {
            if (source.collection().equals(collection)) {
                feeding.add(source);
            }
        }
        return feeding;
    }
}
