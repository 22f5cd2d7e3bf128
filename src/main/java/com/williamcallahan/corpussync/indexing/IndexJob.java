package com.williamcallahan.corpussync.indexing;

import java.time.Instant;

/**
 * Snapshot of an indexing job as tracked by {@link IndexingCoordinator}.
 *
 * @param jobId job identifier
 * @param collection collection being indexed
 * @param status current status
 * @param fullReindex whether the job started from the beginning of the change log
 * @param batchSize changes per batch
 * @param processed changes acknowledged so far
 * @param total changes pending when the job started, grown if more arrived
 * @param startedAt start instant
 * @param finishedAt finish instant, null while running
 * @param error failure description, null unless {@link IndexJobStatus#FAILED}
 */
public record IndexJob(
        String jobId,
        String collection,
        IndexJobStatus status,
        boolean fullReindex,
        int batchSize,
        long processed,
        long total,
        Instant startedAt,
        Instant finishedAt,
        String error) {

    static IndexJob started(String jobId, String collection, boolean fullReindex, int batchSize, Instant startedAt) {
        return new IndexJob(jobId, collection, IndexJobStatus.RUNNING, fullReindex, batchSize, 0, 0, startedAt, null, null);
    }

    IndexJob withProgress(long processedChanges, long totalChanges) {
        return new IndexJob(jobId, collection, status, fullReindex, batchSize, processedChanges, totalChanges,
                startedAt, finishedAt, error);
    }

    IndexJob finished(IndexJobStatus finalStatus, Instant at, String failure) {
        return new IndexJob(jobId, collection, finalStatus, fullReindex, batchSize, processed, total, startedAt, at,
                failure);
    }
}
