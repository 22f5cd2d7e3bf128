package com.williamcallahan.corpussync.web;

import com.williamcallahan.corpussync.config.SourceCatalog;
import com.williamcallahan.corpussync.domain.ItemIdentity;
import com.williamcallahan.corpussync.domain.VersionedRecord;
import com.williamcallahan.corpussync.store.VersionedDocumentStore;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read access to the system of record: the current version of an item and its full history.
 */
@RestController
@RequestMapping("/records")
public class RecordsController extends BaseController {

    private final SourceCatalog sourceCatalog;
    private final VersionedDocumentStore documentStore;

    public RecordsController(
            SourceCatalog sourceCatalog, VersionedDocumentStore documentStore, ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.sourceCatalog = sourceCatalog;
        this.documentStore = documentStore;
    }

    @GetMapping("/current")
    public ResponseEntity<?> current(
            @RequestParam("source") String source, @RequestParam("identity") String identity) {
        ItemIdentity itemIdentity = identityOf(source, identity);
        return documentStore.currentFor(itemIdentity)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> exceptionBuilder.buildErrorResponse(
                        HttpStatus.NOT_FOUND, "No current record for " + itemIdentity));
    }

    /**
     * Returns every version of the item in {@code validFrom} order, empty when it was never seen.
     */
    @GetMapping("/history")
    public ResponseEntity<List<VersionedRecord>> history(
            @RequestParam("source") String source, @RequestParam("identity") String identity) {
        return ResponseEntity.ok(documentStore.historyFor(identityOf(source, identity)));
    }

    private ItemIdentity identityOf(String source, String key) {
        sourceCatalog.require(source);
        return new ItemIdentity(source, key);
    }
}
