package com.williamcallahan.corpussync.web;

import com.williamcallahan.corpussync.config.CollectionCatalog;
import com.williamcallahan.corpussync.domain.CollectionDescriptor;
import com.williamcallahan.corpussync.indexing.IndexingCoordinator;
import com.williamcallahan.corpussync.indexing.LexicalIndex;
import com.williamcallahan.corpussync.indexing.VectorIndex;
import com.williamcallahan.corpussync.store.VersionedDocumentStore;
import com.williamcallahan.corpussync.sync.ReconcilerService;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Per-component liveness.
 */
@RestController
public class HealthController extends BaseController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String UP = "UP";
    private static final String DOWN = "DOWN";

    private final VersionedDocumentStore documentStore;
    private final CollectionCatalog collectionCatalog;
    private final ReconcilerService reconcilerService;
    private final IndexingCoordinator indexingCoordinator;
    private final VectorIndex vectorIndex;
    private final LexicalIndex lexicalIndex;

    public HealthController(
            VersionedDocumentStore documentStore,
            CollectionCatalog collectionCatalog,
            ReconcilerService reconcilerService,
            IndexingCoordinator indexingCoordinator,
            VectorIndex vectorIndex,
            LexicalIndex lexicalIndex,
            ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.documentStore = documentStore;
        this.collectionCatalog = collectionCatalog;
        this.reconcilerService = reconcilerService;
        this.indexingCoordinator = indexingCoordinator;
        this.vectorIndex = vectorIndex;
        this.lexicalIndex = lexicalIndex;
    }

    /**
     * Returns 200 when every component is up, 503 otherwise, with one status per component.
     */
    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        Map<String, String> components = new LinkedHashMap<>();
        components.put("store", componentStatus("store", this::storeResponds));
        components.put("reconciler", componentStatus("reconciler", reconcilerService::isAcceptingTriggers));
        components.put("indexer", componentStatus("indexer", indexingCoordinator::isAcceptingJobs));
        components.put("vectorIndex", componentStatus("vectorIndex", vectorIndex::isHealthy));
        components.put("lexicalIndex", componentStatus("lexicalIndex", lexicalIndex::isHealthy));

        boolean allUp = components.values().stream().allMatch(UP::equals);
        HealthResponse body = new HealthResponse(allUp ? UP : DOWN, components);
        return ResponseEntity.status(allUp ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    private boolean storeResponds() {
        for (CollectionDescriptor collection : collectionCatalog.all()) {
            documentStore.latestSequence(collection.name());
        }
        return true;
    }

    private static String componentStatus(String component, BooleanSupplier check) {
        try {
            return check.getAsBoolean() ? UP : DOWN;
        } catch (RuntimeException failure) {
            log.warn("Health check for {} failed: {}", component, failure.getMessage());
            return DOWN;
        }
    }

    public record HealthResponse(String status, Map<String, String> components) {}
}
