package com.williamcallahan.corpussync.indexing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically indexes collections whose change log is ahead of the indexer cursor.
 */
@Component
@ConditionalOnProperty(prefix = "app.indexer", name = "poll-enabled", havingValue = "true")
public class IndexPoller {

    private static final Logger log = LoggerFactory.getLogger(IndexPoller.class);

    private final IndexingCoordinator coordinator;

    public IndexPoller(IndexingCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Scheduled(fixedDelayString = "${app.indexer.poll-interval:PT60S}", initialDelayString = "${app.indexer.poll-interval:PT60S}")
    public void poll() {
        if (!coordinator.isAcceptingJobs()) {
            return;
        }
        try {
            coordinator.indexLaggingCollections();
        } catch (RuntimeException failure) {
            log.warn("[INDEXING] Index poll failed: {}", failure.getMessage());
        }
    }
}
