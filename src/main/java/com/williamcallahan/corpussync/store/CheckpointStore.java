package com.williamcallahan.corpussync.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.corpussync.domain.Checkpoint;
import com.williamcallahan.corpussync.support.SafeFileNames;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Durable per-(source, stream) resumption cursors.
 *
 * <p>Every commit appends one line to {@code <directory>/<source>.jsonl}; the latest line per
 * stream wins on replay. Partitions are independent, so sources never share a lock.</p>
 */
public class CheckpointStore implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(CheckpointStore.class);

    private final Path directory;
    private final boolean fsync;
    private final Clock clock;
    private final ObjectMapper mapper = StoreJson.mapper();
    private final Map<String, Partition> partitions = new ConcurrentHashMap<>();

    /**
     * Creates a store rooted at {@code directory}.
     *
     * @param directory directory holding one journal per source
     * @param fsync whether each commit is forced to disk before returning
     * @param clock clock used for commit timestamps
     */
    public CheckpointStore(Path directory, boolean fsync, Clock clock) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.fsync = fsync;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Returns the most recently committed checkpoint, or the generation-zero checkpoint when
     * the stream has never been committed.
     */
    public Checkpoint latest(String source, String stream) {
        return partition(source).latest(stream);
    }

    /**
     * Durably commits a new cursor for the stream, one generation after the previous commit.
     *
     * @param source owning source
     * @param stream logical stream
     * @param cursor new cursor value
     * @return the committed checkpoint
     */
    public Checkpoint commit(String source, String stream, String cursor) {
        Objects.requireNonNull(cursor, "cursor");
        return partition(source).commit(stream, cursor);
    }

    /**
     * Commits an empty cursor so the next run starts from the beginning of the stream.
     * The generation still advances.
     */
    public Checkpoint reset(String source, String stream) {
        return partition(source).commit(stream, "");
    }

    /**
     * Lists the latest checkpoint of every stream committed for the source, ordered by stream name.
     */
    public List<Checkpoint> allFor(String source) {
        List<Checkpoint> checkpoints = new ArrayList<>(partition(source).snapshot().values());
        checkpoints.sort(Comparator.comparing(Checkpoint::stream));
        return checkpoints;
    }

    @Override
    public void close() throws IOException {
        for (Partition partition : partitions.values()) {
            partition.journal.close();
        }
    }

    private Partition partition(String source) {
        Objects.requireNonNull(source, "source");
        return partitions.computeIfAbsent(source, this::openPartition);
    }

    private Partition openPartition(String source) {
        JsonLinesJournal journal =
                new JsonLinesJournal(directory.resolve(SafeFileNames.safeName(source) + ".jsonl"), mapper, fsync);
        Map<String, Checkpoint> latest = new LinkedHashMap<>();
        for (Checkpoint checkpoint : journal.readAll(Checkpoint.class)) {
            Checkpoint previous = latest.get(checkpoint.stream());
            if (previous == null || checkpoint.generation() > previous.generation()) {
                latest.put(checkpoint.stream(), checkpoint);
            }
        }
        if (!latest.isEmpty()) {
            log.debug("[STORE] Replayed {} checkpoint stream(s) for source {}", latest.size(), source);
        }
        return new Partition(source, journal, latest);
    }

    private final class Partition {
        private final String source;
        private final JsonLinesJournal journal;
        private final Map<String, Checkpoint> latestByStream;

        private Partition(String source, JsonLinesJournal journal, Map<String, Checkpoint> latestByStream) {
            this.source = source;
            this.journal = journal;
            this.latestByStream = latestByStream;
        }

        synchronized Checkpoint latest(String stream) {
            Checkpoint checkpoint = latestByStream.get(stream);
            return checkpoint != null ? checkpoint : Checkpoint.initial(source, stream);
        }

        synchronized Checkpoint commit(String stream, String cursor) {
            Checkpoint previous = latest(stream);
            Checkpoint next = new Checkpoint(source, stream, cursor, previous.generation() + 1, Instant.now(clock));
            journal.append(next);
            latestByStream.put(stream, next);
            return next;
        }

        synchronized Map<String, Checkpoint> snapshot() {
            return new LinkedHashMap<>(latestByStream);
        }
    }
}
