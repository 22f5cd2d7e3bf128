package com.williamcallahan.corpussync.web;

import com.williamcallahan.corpussync.sync.CycleAlreadyRunningException;
import com.williamcallahan.corpussync.sync.CycleStatus;
import com.williamcallahan.corpussync.sync.CycleView;
import com.williamcallahan.corpussync.sync.ReconcilerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Starts reconciliation cycles and reports on them.
 */
@RestController
public class TriggerController extends BaseController {

    private static final Logger log = LoggerFactory.getLogger(TriggerController.class);

    private final ReconcilerService reconcilerService;

    public TriggerController(ReconcilerService reconcilerService, ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.reconcilerService = reconcilerService;
    }

    /**
     * Accepts a cycle for the source; the work happens asynchronously.
     */
    @PostMapping("/trigger/{source}")
    public ResponseEntity<TriggerResponse> trigger(@PathVariable("source") String source) {
        CycleView accepted = reconcilerService.trigger(source);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new TriggerResponse(accepted.cycleId(), accepted.source(), accepted.status()));
    }

    @GetMapping("/cycles/{cycleId}")
    public ResponseEntity<?> cycle(@PathVariable("cycleId") String cycleId) {
        return reconcilerService.cycle(cycleId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> exceptionBuilder.buildErrorResponse(HttpStatus.NOT_FOUND, "Unknown cycle " + cycleId));
    }

    @ExceptionHandler(CycleAlreadyRunningException.class)
    public ResponseEntity<TriggerResponse> handleAlreadyRunning(CycleAlreadyRunningException alreadyRunning) {
        log.debug("[SYNC] Rejected trigger for {}: cycle {} still running",
                alreadyRunning.sourceName(), alreadyRunning.runningCycleId());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new TriggerResponse(
                        alreadyRunning.runningCycleId(), alreadyRunning.sourceName(), CycleStatus.RUNNING));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiErrorResponse> handleNotAccepting(IllegalStateException notAccepting) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.SERVICE_UNAVAILABLE, notAccepting.getMessage());
    }
}
