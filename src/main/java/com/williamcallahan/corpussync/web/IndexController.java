package com.williamcallahan.corpussync.web;

import com.williamcallahan.corpussync.indexing.IndexJob;
import com.williamcallahan.corpussync.indexing.IndexingCoordinator;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Starts or resumes indexing passes and reports job progress.
 */
@RestController
public class IndexController extends BaseController {

    private final IndexingCoordinator coordinator;

    public IndexController(IndexingCoordinator coordinator, ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.coordinator = coordinator;
    }

    @PostMapping("/index")
    public ResponseEntity<IndexJobResponse> index(@Valid @RequestBody IndexRequest request) {
        IndexJob job = coordinator.submit(request.collection(), request.batchSize(), request.fullReindex());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new IndexJobResponse(job.jobId(), job.collection(), job.status()));
    }

    @GetMapping("/index/{jobId}")
    public ResponseEntity<?> job(@PathVariable("jobId") String jobId) {
        return coordinator.job(jobId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> exceptionBuilder.buildErrorResponse(HttpStatus.NOT_FOUND, "Unknown index job " + jobId));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiErrorResponse> handleNotAccepting(IllegalStateException notAccepting) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.SERVICE_UNAVAILABLE, notAccepting.getMessage());
    }
}
