package com.williamcallahan.corpussync.indexing;

import com.williamcallahan.corpussync.domain.Checkpoint;
import com.williamcallahan.corpussync.domain.CollectionDescriptor;
import com.williamcallahan.corpussync.domain.ItemIdentity;
import com.williamcallahan.corpussync.domain.RecordChange;
import com.williamcallahan.corpussync.domain.VersionedRecord;
import com.williamcallahan.corpussync.store.CheckpointStore;
import com.williamcallahan.corpussync.store.VersionedDocumentStore;
import com.williamcallahan.corpussync.support.PipelineMetrics;
import com.williamcallahan.corpussync.support.RetrySupport;
import com.williamcallahan.corpussync.support.TransientErrorClassifier;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Projects the current records of a collection into the vector and lexical indexes.
 *
 * <p>The indexer consumes the collection's change log from its own cursor, kept in the checkpoint
 * store under source {@value #CURSOR_SOURCE} and stream = collection name. A batch is applied to
 * both indexes and only then acknowledged; a failed batch leaves the cursor where it was so the
 * next pass replays it. Replaying is harmless because entries are keyed by identity and reflect
 * whatever is current when the batch runs.</p>
 *
 * <p>When either index keeps its entries in memory, a cursor left on disk by an earlier process
 * describes entries that no longer exist. The first time this indexer touches a collection whose
 * volatile index is empty, a persisted cursor is reset so the next pass rebuilds the collection
 * from the change log.</p>
 */
public class Indexer {

    private static final Logger log = LoggerFactory.getLogger(Indexer.class);
    private static final Logger INDEXING_LOG = LoggerFactory.getLogger("INDEXING");

    public static final String CURSOR_SOURCE = "indexer";

    private final VersionedDocumentStore documentStore;
    private final CheckpointStore checkpointStore;
    private final VectorIndex vectorIndex;
    private final LexicalIndex lexicalIndex;
    private final EmbeddingClient embeddingClient;
    private final IndexerSettings settings;
    private final Set<String> alignedCursors = ConcurrentHashMap.newKeySet();

    public Indexer(
            VersionedDocumentStore documentStore,
            CheckpointStore checkpointStore,
            VectorIndex vectorIndex,
            LexicalIndex lexicalIndex,
            EmbeddingClient embeddingClient,
            IndexerSettings settings) {
        this.documentStore = Objects.requireNonNull(documentStore, "documentStore");
        this.checkpointStore = Objects.requireNonNull(checkpointStore, "checkpointStore");
        this.vectorIndex = Objects.requireNonNull(vectorIndex, "vectorIndex");
        this.lexicalIndex = Objects.requireNonNull(lexicalIndex, "lexicalIndex");
        this.embeddingClient = Objects.requireNonNull(embeddingClient, "embeddingClient");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * Listener notified after every acknowledged batch.
     */
    @FunctionalInterface
    public interface ProgressListener {
        void onBatchCommitted(long changesProcessed, long changesTotal);
    }

    public IndexPassReport runPass(CollectionDescriptor collection, int batchSize, boolean fullReindex) {
        return runPass(collection, batchSize, fullReindex, (processed, total) -> {}, () -> false);
    }

    /**
     * Runs batches until the change log is drained.
     *
     * @param collection collection to index
     * @param batchSize changes per batch
     * @param fullReindex whether to reset the cursor to the start of the change log first
     * @param progress notified after each acknowledged batch
     * @param cancellationRequested polled between batches
     * @return pass summary
     * @throws CancellationException when cancelled between batches; acknowledged batches stay acknowledged
     * @throws RuntimeException the batch failure once retries are exhausted
     */
    public IndexPassReport runPass(
            CollectionDescriptor collection,
            int batchSize,
            boolean fullReindex,
            ProgressListener progress,
            BooleanSupplier cancellationRequested) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        String name = collection.name();
        if (fullReindex) {
            checkpointStore.reset(CURSOR_SOURCE, name);
            INDEXING_LOG.info("[INDEXING] Full reindex requested for {}, cursor reset", name);
        }

        RetrySupport.executeWithRetry(
                () -> vectorIndex.ensureCollection(collection),
                "Ensure vector collection " + name,
                settings.maxAttempts(),
                settings.initialBackoff(),
                TransientErrorClassifier::isTransient);

        alignCursorWithIndexes(name);
        long startCursor = cursorOf(checkpointStore.latest(CURSOR_SOURCE, name));
        long cursor = startCursor;
        long total = Math.max(0, documentStore.latestSequence(name) - startCursor);
        long processed = 0;
        long upserted = 0;
        long deleted = 0;
        int batches = 0;

        while (true) {
            if (cancellationRequested.getAsBoolean()) {
                throw new CancellationException("Indexing of " + name + " cancelled at cursor " + cursor);
            }
            List<RecordChange> changes = documentStore.changesInCollection(name, cursor, batchSize);
            if (changes.isEmpty()) {
                break;
            }
            long batchEnd = changes.get(changes.size() - 1).sequence();
            AtomicInteger attempts = new AtomicInteger();
            BatchResult result;
            try {
                result = RetrySupport.executeWithRetry(
                        () -> {
                            attempts.incrementAndGet();
                            return applyBatch(name, changes);
                        },
                        "Index batch " + name + " up to " + batchEnd,
                        settings.maxAttempts(),
                        settings.initialBackoff(),
                        TransientErrorClassifier::isTransient);
            } catch (RuntimeException batchFailure) {
                PipelineMetrics.recordIndexRetries(name, attempts.get() - 1);
                PipelineMetrics.recordIndexBatch(name, PipelineMetrics.OUTCOME_FAILED);
                throw batchFailure;
            }
            PipelineMetrics.recordIndexRetries(name, attempts.get() - 1);
            checkpointStore.commit(CURSOR_SOURCE, name, Long.toString(batchEnd));
            PipelineMetrics.recordIndexBatch(name, PipelineMetrics.OUTCOME_COMMITTED);

            cursor = batchEnd;
            processed += changes.size();
            upserted += result.upserted();
            deleted += result.deleted();
            batches++;
            total = Math.max(total, processed);
            progress.onBatchCommitted(processed, total);
            INDEXING_LOG.info("[INDEXING] {} batch {} committed: {} changes, {} upserted, {} deleted (cursor={})",
                    name, batches, changes.size(), result.upserted(), result.deleted(), cursor);
            if (changes.size() < batchSize) {
                break;
            }
        }

        IndexPassReport report = new IndexPassReport(name, startCursor, cursor, processed, upserted, deleted, batches);
        log.info("[INDEXING] Pass over {} finished: {} changes in {} batches", name, processed, batches);
        return report;
    }

    /**
     * Returns the last acknowledged change sequence for the collection.
     */
    public long cursor(String collection) {
        alignCursorWithIndexes(collection);
        return cursorOf(checkpointStore.latest(CURSOR_SOURCE, collection));
    }

    /**
     * Returns true when both indexes survive a restart, so a persisted cursor still matches them.
     */
    public boolean indexesAreDurable() {
        return vectorIndex.isDurable() && lexicalIndex.isDurable();
    }

    private void alignCursorWithIndexes(String collection) {
        if (indexesAreDurable() || !alignedCursors.add(collection)) {
            return;
        }
        boolean volatileIndexEmpty = (!vectorIndex.isDurable() && vectorIndex.count(collection) == 0)
                || (!lexicalIndex.isDurable() && lexicalIndex.count(collection) == 0);
        if (volatileIndexEmpty && cursorOf(checkpointStore.latest(CURSOR_SOURCE, collection)) > 0) {
            checkpointStore.reset(CURSOR_SOURCE, collection);
            INDEXING_LOG.info("[INDEXING] Volatile index for {}: persisted cursor reset, collection will be rebuilt",
                    collection);
        }
    }

    private BatchResult applyBatch(String collection, List<RecordChange> changes) {
        Set<ItemIdentity> identities = new LinkedHashSet<>();
        for (RecordChange change : changes) {
            identities.add(change.identity());
        }

        List<VersionedRecord> toUpsert = new ArrayList<>();
        List<ItemIdentity> toDelete = new ArrayList<>();
        for (ItemIdentity identity : identities) {
            Optional<VersionedRecord> current = documentStore.currentFor(identity);
            if (current.isPresent() && current.get().collection().equals(collection)) {
                toUpsert.add(current.get());
            } else {
                toDelete.add(identity);
            }
        }

        if (!toUpsert.isEmpty()) {
            List<float[]> vectors = EmbeddingBatchEmbedder.embedRecords(embeddingClient, toUpsert);
            List<VectorEntry> vectorEntries = new ArrayList<>(toUpsert.size());
            List<LexicalEntry> lexicalEntries = new ArrayList<>(toUpsert.size());
            for (int index = 0; index < toUpsert.size(); index++) {
                VersionedRecord record = toUpsert.get(index);
                vectorEntries.add(new VectorEntry(
                        record.identity(), record.id(), vectors.get(index), record.title(), record.location()));
                lexicalEntries.add(new LexicalEntry(record.identity(), record.id(), record.title(), record.body()));
            }
            vectorIndex.upsert(collection, vectorEntries);
            lexicalIndex.upsert(collection, lexicalEntries);
        }
        if (!toDelete.isEmpty()) {
            vectorIndex.delete(collection, toDelete);
            lexicalIndex.delete(collection, toDelete);
        }
        return new BatchResult(toUpsert.size(), toDelete.size());
    }

    private static long cursorOf(Checkpoint checkpoint) {
        if (!checkpoint.hasCursor()) {
            return 0;
        }
        try {
            return Long.parseLong(checkpoint.cursor());
        } catch (NumberFormatException malformed) {
            throw new IllegalStateException(
                    "Indexer cursor for " + checkpoint.stream() + " is not a sequence: " + checkpoint.cursor(),
                    malformed);
        }
    }

    private record BatchResult(int upserted, int deleted) {}
}
