package com.williamcallahan.corpussync.web;

import com.williamcallahan.corpussync.domain.Checkpoint;
import com.williamcallahan.corpussync.domain.SourceDescriptor;
import com.williamcallahan.corpussync.store.CheckpointStore;
import com.williamcallahan.corpussync.sync.ReconcilerService;
import com.williamcallahan.corpussync.sync.SourceStatus;
import com.williamcallahan.corpussync.sync.SourceStatusTracker;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Per-source operational status.
 */
@RestController
public class SourcesController extends BaseController {

    private final ReconcilerService reconcilerService;
    private final SourceStatusTracker statusTracker;
    private final CheckpointStore checkpointStore;

    public SourcesController(
            ReconcilerService reconcilerService,
            SourceStatusTracker statusTracker,
            CheckpointStore checkpointStore,
            ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.reconcilerService = reconcilerService;
        this.statusTracker = statusTracker;
        this.checkpointStore = checkpointStore;
    }

    @GetMapping("/sources")
    public ResponseEntity<List<SourceSummary>> sources() {
        List<SourceSummary> summaries = reconcilerService.sources().stream()
                .map(source -> SourceSummary.of(
                        source, statusTracker.statusOrEmpty(source.name()), checkpointStore.allFor(source.name())))
                .toList();
        return ResponseEntity.ok(summaries);
    }

    /**
     * @param name source name
     * @param strategy adapter strategy
     * @param collection target collection
     * @param cadence ISO-8601 cadence
     * @param status cycle history summary
     * @param checkpoints latest checkpoint per stream
     */
    public record SourceSummary(
            String name,
            String strategy,
            String collection,
            String cadence,
            SourceStatus status,
            List<Checkpoint> checkpoints) {

        static SourceSummary of(SourceDescriptor source, SourceStatus status, List<Checkpoint> checkpoints) {
            return new SourceSummary(
                    source.name(), source.strategy(), source.collection(), source.cadence().toString(), status, checkpoints);
        }
    }
}
