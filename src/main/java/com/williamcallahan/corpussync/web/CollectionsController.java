package com.williamcallahan.corpussync.web;

import com.williamcallahan.corpussync.config.CollectionCatalog;
import com.williamcallahan.corpussync.domain.CollectionDescriptor;
import com.williamcallahan.corpussync.indexing.Indexer;
import com.williamcallahan.corpussync.indexing.LexicalIndex;
import com.williamcallahan.corpussync.indexing.VectorIndex;
import com.williamcallahan.corpussync.store.VersionedDocumentStore;
import java.util.List;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lists collections with the counts needed to verify the indexes match the store.
 */
@RestController
public class CollectionsController extends BaseController {

    private static final Logger log = LoggerFactory.getLogger(CollectionsController.class);

    private final CollectionCatalog collectionCatalog;
    private final VersionedDocumentStore documentStore;
    private final VectorIndex vectorIndex;
    private final LexicalIndex lexicalIndex;
    private final Indexer indexer;

    public CollectionsController(
            CollectionCatalog collectionCatalog,
            VersionedDocumentStore documentStore,
            VectorIndex vectorIndex,
            LexicalIndex lexicalIndex,
            Indexer indexer,
            ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.collectionCatalog = collectionCatalog;
        this.documentStore = documentStore;
        this.vectorIndex = vectorIndex;
        this.lexicalIndex = lexicalIndex;
        this.indexer = indexer;
    }

    @GetMapping("/collections")
    public ResponseEntity<List<CollectionSummary>> collections() {
        return ResponseEntity.ok(collectionCatalog.all().stream().map(this::summarize).toList());
    }

    private CollectionSummary summarize(CollectionDescriptor collection) {
        String name = collection.name();
        return new CollectionSummary(
                name,
                collection.audience(),
                collection.dimensions(),
                countOrNull("vector", name, () -> vectorIndex.count(name)),
                countOrNull("lexical", name, () -> lexicalIndex.count(name)),
                documentStore.countCurrent(name),
                documentStore.latestSequence(name),
                indexer.cursor(name));
    }

    private static Long countOrNull(String backend, String collection, LongSupplier count) {
        try {
            return count.getAsLong();
        } catch (RuntimeException failure) {
            log.warn("[INDEXING] {} count unavailable for {}: {}", backend, collection, failure.getMessage());
            return null;
        }
    }

    /**
     * @param name collection name
     * @param audience visibility tag
     * @param dimensions declared vector dimensions
     * @param vectorCount entries in the vector index, null when the backend is unavailable
     * @param lexicalCount entries in the lexical index, null when the backend is unavailable
     * @param currentRecords current records in the document store
     * @param latestSequence newest change sequence in the store
     * @param indexedSequence last change sequence acknowledged by the indexer
     */
    public record CollectionSummary(
            String name,
            String audience,
            int dimensions,
            Long vectorCount,
            Long lexicalCount,
            long currentRecords,
            long latestSequence,
            long indexedSequence) {}
}
