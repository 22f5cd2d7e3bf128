package com.williamcallahan.corpussync.config;

import com.williamcallahan.corpussync.domain.CollectionDescriptor;
import com.williamcallahan.corpussync.domain.UnknownCollectionException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Immutable view of the configured collections, including wildcard and audience resolution
 * for search requests.
 */
@Component
public class CollectionCatalog {

    /** Request token selecting every configured collection. */
    public static final String WILDCARD = "*";

    private final Map<String, CollectionDescriptor> collections;
    private final List<CollectionDescriptor> ordered;

    @Autowired
    public CollectionCatalog(AppProperties appProperties) {
        this(appProperties.collectionDescriptors().values());
    }

    /**
     * Creates a catalog from explicit descriptors.
     */
    public CollectionCatalog(Collection<CollectionDescriptor> descriptors) {
        Map<String, CollectionDescriptor> byName = new LinkedHashMap<>();
        for (CollectionDescriptor descriptor : descriptors) {
            byName.put(descriptor.name(), descriptor);
        }
        this.collections = Map.copyOf(byName);
        this.ordered = List.copyOf(byName.values());
    }

    public Optional<CollectionDescriptor> find(String name) {
        return Optional.ofNullable(name == null ? null : collections.get(name));
    }

    /**
     * Returns the named collection.
     *
     * @throws UnknownCollectionException if no such collection is configured
     */
    public CollectionDescriptor require(String name) {
        return find(name).orElseThrow(() -> new UnknownCollectionException(name));
    }

    public List<CollectionDescriptor> all() {
        return ordered;
    }

    /**
     * Expands the requested names (where {@code "*"} means every collection) and drops the
     * collections the caller's audience may not see.
     *
     * <p>Naming an unknown collection explicitly is an error; naming a collection the audience
     * cannot see silently removes it, so its existence is not revealed.</p>
     *
     * @param requested requested collection names
     * @param audience caller audience tag, may be null
     * @return visible target collections in configuration order, possibly empty
     * @throws UnknownCollectionException if a requested name is not configured
     */
    public List<CollectionDescriptor> resolveVisible(List<String> requested, String audience) {
        Set<String> names = new LinkedHashSet<>();
        boolean wildcard = false;
        for (String name : requested) {
            String trimmed = name == null ? "" : name.trim();
            if (WILDCARD.equals(trimmed)) {
                wildcard = true;
            } else if (!trimmed.isEmpty()) {
                require(trimmed);
                names.add(trimmed);
            }
        }
        List<CollectionDescriptor> visible = new ArrayList<>();
        for (CollectionDescriptor descriptor : ordered) {
            if ((wildcard || names.contains(descriptor.name())) && descriptor.isVisibleTo(audience)) {
                visible.add(descriptor);
            }
        }
        return visible;
    }
}
