package com.williamcallahan.corpussync.config;

import com.williamcallahan.corpussync.domain.CollectionDescriptor;
import com.williamcallahan.corpussync.domain.SourceDescriptor;
import com.williamcallahan.corpussync.support.TextNormalizer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Root of the {@code app.*} configuration tree.
 */
@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties implements InitializingBean {

    private static final String DUPLICATE_FMT = "%s contains duplicate name '%s'.";
    private static final String BLANK_FMT = "%s[%d].%s must not be blank.";
    private static final String UNKNOWN_COLLECTION_FMT = "app.sources[%d] (%s) targets unknown collection '%s'.";
    private static final String RESERVED_SOURCE_FMT = "app.sources[%d] uses the reserved name '%s'.";
    private static final String RESERVED_SOURCE_NAME = "indexer";
    private static final String DIMENSION_MISMATCH_FMT =
            "app.collections[%d] (%s) declares %d dimensions but app.embedding.dimensions is %d.";

    private Store store = new Store();
    private Lexical lexical = new Lexical();
    private SyncProperties sync = new SyncProperties();
    private IndexerProperties indexer = new IndexerProperties();
    private EmbeddingProperties embedding = new EmbeddingProperties();
    private QdrantProperties qdrant = new QdrantProperties();
    private SearchProperties search = new SearchProperties();
    private List<Source> sources = new ArrayList<>();
    private List<Collection> collections = new ArrayList<>();

    @Override
    public void afterPropertiesSet() {
        validateConfiguration();
    }

    /**
     * Validates every settings group and the references between sources and collections.
     */
    public void validateConfiguration() {
        sync.validateConfiguration();
        indexer.validateConfiguration();
        embedding.validateConfiguration();
        qdrant.validateConfiguration();
        search.validateConfiguration();

        Set<String> collectionNames = new HashSet<>();
        for (int index = 0; index < collections.size(); index++) {
            Collection collection = collections.get(index);
            requireText("app.collections", index, "name", collection.getName());
            if (!collectionNames.add(collection.getName())) {
                throw new IllegalArgumentException(
                        String.format(Locale.ROOT, DUPLICATE_FMT, "app.collections", collection.getName()));
            }
            if (collection.getDimensions() > 0 && collection.getDimensions() != embedding.getDimensions()) {
                throw new IllegalArgumentException(String.format(
                        Locale.ROOT,
                        DIMENSION_MISMATCH_FMT,
                        index,
                        collection.getName(),
                        collection.getDimensions(),
                        embedding.getDimensions()));
            }
        }

        Set<String> sourceNames = new HashSet<>();
        for (int index = 0; index < sources.size(); index++) {
            Source source = sources.get(index);
            requireText("app.sources", index, "name", source.getName());
            requireText("app.sources", index, "strategy", source.getStrategy());
            requireText("app.sources", index, "collection", source.getCollection());
            if (RESERVED_SOURCE_NAME.equals(source.getName())) {
                throw new IllegalArgumentException(
                        String.format(Locale.ROOT, RESERVED_SOURCE_FMT, index, RESERVED_SOURCE_NAME));
            }
            if (!sourceNames.add(source.getName())) {
                throw new IllegalArgumentException(
                        String.format(Locale.ROOT, DUPLICATE_FMT, "app.sources", source.getName()));
            }
            if (!collectionNames.contains(source.getCollection())) {
                throw new IllegalArgumentException(String.format(
                        Locale.ROOT, UNKNOWN_COLLECTION_FMT, index, source.getName(), source.getCollection()));
            }
        }
    }

    private static void requireText(String listKey, int index, String field, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, BLANK_FMT, listKey, index, field));
        }
    }

    /**
     * Returns the configured sources as immutable descriptors, keyed by name in declaration order.
     */
    public Map<String, SourceDescriptor> sourceDescriptors() {
        Map<String, SourceDescriptor> descriptors = new LinkedHashMap<>();
        for (Source source : sources) {
            descriptors.put(source.getName(), source.toDescriptor());
        }
        return descriptors;
    }

    /**
     * Returns the configured collections as immutable descriptors, keyed by name in declaration order.
     * Collections without declared dimensions inherit the embedding dimensionality.
     */
    public Map<String, CollectionDescriptor> collectionDescriptors() {
        Map<String, CollectionDescriptor> descriptors = new LinkedHashMap<>();
        for (Collection collection : collections) {
            int dimensions = collection.getDimensions() > 0 ? collection.getDimensions() : embedding.getDimensions();
            descriptors.put(
                    collection.getName(),
                    new CollectionDescriptor(collection.getName(), dimensions, collection.getAudience()));
        }
        return descriptors;
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public Lexical getLexical() {
        return lexical;
    }

    public void setLexical(Lexical lexical) {
        this.lexical = lexical;
    }

    public SyncProperties getSync() {
        return sync;
    }

    public void setSync(SyncProperties sync) {
        this.sync = sync;
    }

    public IndexerProperties getIndexer() {
        return indexer;
    }

    public void setIndexer(IndexerProperties indexer) {
        this.indexer = indexer;
    }

    public EmbeddingProperties getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingProperties embedding) {
        this.embedding = embedding;
    }

    public QdrantProperties getQdrant() {
        return qdrant;
    }

    public void setQdrant(QdrantProperties qdrant) {
        this.qdrant = qdrant;
    }

    public SearchProperties getSearch() {
        return search;
    }

    public void setSearch(SearchProperties search) {
        this.search = search;
    }

    public List<Source> getSources() {
        return sources;
    }

    public void setSources(List<Source> sources) {
        this.sources = sources;
    }

    public List<Collection> getCollections() {
        return collections;
    }

    public void setCollections(List<Collection> collections) {
        this.collections = collections;
    }

    public static class Store {
        private String dataDir = "data";
        private boolean fsync = true;

        public String getDataDir() { return dataDir; }
        public void setDataDir(String dataDir) { this.dataDir = dataDir; }

        public boolean isFsync() { return fsync; }
        public void setFsync(boolean fsync) { this.fsync = fsync; }
    }

    public static class Lexical {
        // Empty keeps the Lucene index in memory.
        private String indexDir = "";

        public String getIndexDir() { return indexDir; }
        public void setIndexDir(String indexDir) { this.indexDir = indexDir == null ? "" : indexDir; }
    }

    /**
     * One configured upstream origin.
     */
    public static class Source {
        private String name;
        private String strategy;
        private String collection;
        private Duration cadence = Duration.ofHours(1);
        private boolean conditionalFetch = true;
        private List<String> urls = new ArrayList<>();
        private Map<String, String> settings = new LinkedHashMap<>();

        SourceDescriptor toDescriptor() {
            return new SourceDescriptor(
                    name,
                    TextNormalizer.toLowerAscii(strategy).trim(),
                    collection,
                    cadence,
                    conditionalFetch,
                    urls,
                    settings);
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }

        public String getCollection() { return collection; }
        public void setCollection(String collection) { this.collection = collection; }

        public Duration getCadence() { return cadence; }
        public void setCadence(Duration cadence) { this.cadence = cadence; }

        public boolean isConditionalFetch() { return conditionalFetch; }
        public void setConditionalFetch(boolean conditionalFetch) { this.conditionalFetch = conditionalFetch; }

        public List<String> getUrls() { return urls; }
        public void setUrls(List<String> urls) { this.urls = urls; }

        public Map<String, String> getSettings() { return settings; }
        public void setSettings(Map<String, String> settings) { this.settings = settings; }
    }

    /**
     * One configured collection.
     */
    public static class Collection {
        private String name;
        private int dimensions;
        private String audience = CollectionDescriptor.PUBLIC_AUDIENCE;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public int getDimensions() { return dimensions; }
        public void setDimensions(int dimensions) { this.dimensions = dimensions; }

        public String getAudience() { return audience; }
        public void setAudience(String audience) { this.audience = audience; }
    }
}
