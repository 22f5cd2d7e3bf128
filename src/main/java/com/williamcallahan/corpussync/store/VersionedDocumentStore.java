package com.williamcallahan.corpussync.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.Striped;
import com.williamcallahan.corpussync.domain.ItemIdentity;
import com.williamcallahan.corpussync.domain.RecordChange;
import com.williamcallahan.corpussync.domain.VersionedRecord;
import com.williamcallahan.corpussync.support.SafeFileNames;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only system of record holding every version of every item.
 *
 * <p>Writes for one identity are serialized by a striped lock, so writers for different
 * identities proceed in parallel. Each write is appended to the owning source's journal
 * before it becomes visible in memory. Every transition into or out of the current state
 * is published as a {@link RecordChange} carrying a per-collection sequence number; the
 * sequence is assigned and published under that collection's lock, so readers observe a
 * gap-free, strictly increasing change log.</p>
 */
public class VersionedDocumentStore implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(VersionedDocumentStore.class);
    private static final int IDENTITY_LOCK_STRIPES = 256;
    private static final String JOURNAL_SUFFIX = ".jsonl";

    private final Path directory;
    private final boolean fsync;
    private final Clock clock;
    private final ObjectMapper mapper = StoreJson.mapper();

    private final Map<String, JsonLinesJournal> journals = new ConcurrentHashMap<>();
    private final Map<String, VersionedRecord> recordsById = new ConcurrentHashMap<>();
    private final Map<ItemIdentity, List<String>> chains = new ConcurrentHashMap<>();
    private final Map<ItemIdentity, String> currentIds = new ConcurrentHashMap<>();
    private final Map<String, CollectionLog> collections = new ConcurrentHashMap<>();
    private final Striped<Lock> identityLocks = Striped.lock(IDENTITY_LOCK_STRIPES);

    /**
     * Opens the store, replaying every source journal found under {@code directory}.
     *
     * @param directory directory holding one journal per source
     * @param fsync whether each write is forced to disk before returning
     * @param clock clock used when callers do not supply an instant
     */
    public VersionedDocumentStore(Path directory, boolean fsync, Clock clock) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.fsync = fsync;
        this.clock = Objects.requireNonNull(clock, "clock");
        replay();
    }

    /**
     * Inserts a new current record for an identity that has no current record.
     *
     * @param record record with {@code validTo == null}
     * @return the stored record
     * @throws StoreWriteConflictException if the identity already has a current record
     */
    public VersionedRecord insert(VersionedRecord record) {
        requireFreshCurrent(record);
        return withIdentityLock(record.identity(), () -> {
            String existing = currentIds.get(record.identity());
            if (existing != null) {
                throw new StoreWriteConflictException(
                        "Identity " + record.identity() + " already has current record " + existing);
            }
            return withCollectionLocks(List.of(record.collection()), () -> {
                long sequence = collectionLog(record.collection()).nextSequence();
                DocumentEvent event = DocumentEvent.inserted(record, sequence);
                journalFor(record.identity().source()).append(event);
                apply(event);
                return record;
            });
        });
    }

    /**
     * Atomically closes the current record {@code oldId} and inserts its replacement.
     * The old record's {@code validTo} is the replacement's {@code validFrom}.
     *
     * @param oldId id of the record being replaced
     * @param replacement new current record for the same identity
     * @return the stored replacement
     * @throws StoreWriteConflictException if {@code oldId} is unknown or no longer current
     */
    public VersionedRecord supersede(String oldId, VersionedRecord replacement) {
        requireFreshCurrent(replacement);
        VersionedRecord previous = requireRecord(oldId);
        if (!previous.identity().equals(replacement.identity())) {
            throw new IllegalArgumentException(
                    "Replacement identity " + replacement.identity() + " differs from " + previous.identity());
        }
        if (replacement.validFrom().isBefore(previous.validFrom())) {
            throw new IllegalArgumentException("Replacement cannot become valid before " + previous.validFrom());
        }
        return withIdentityLock(previous.identity(), () -> {
            requireCurrent(oldId, previous.identity(), "supersede");
            VersionedRecord closing = recordsById.get(oldId);
            return withCollectionLocks(List.of(closing.collection(), replacement.collection()), () -> {
                long closeSequence = collectionLog(closing.collection()).nextSequence();
                long insertSequence = closing.collection().equals(replacement.collection())
                        ? closeSequence + 1
                        : collectionLog(replacement.collection()).nextSequence();
                DocumentEvent event = DocumentEvent.superseded(closing.id(), replacement, closeSequence, insertSequence);
                journalFor(replacement.identity().source()).append(event);
                apply(event);
                return replacement;
            });
        });
    }

    /**
     * Terminally retracts a current record as of now.
     *
     * @see #retract(String, Instant)
     */
    public VersionedRecord retract(String id) {
        return retract(id, Instant.now(clock));
    }

    /**
     * Terminally retracts a current record; {@code supersededBy} stays null forever.
     *
     * @param id current record id
     * @param at instant the record stops being current
     * @return the closed record
     * @throws StoreWriteConflictException if {@code id} is unknown or no longer current
     */
    public VersionedRecord retract(String id, Instant at) {
        Objects.requireNonNull(at, "at");
        VersionedRecord record = requireRecord(id);
        return withIdentityLock(record.identity(), () -> {
            requireCurrent(id, record.identity(), "retract");
            VersionedRecord current = recordsById.get(id);
            Instant closedAt = at.isBefore(current.validFrom()) ? current.validFrom() : at;
            return withCollectionLocks(List.of(current.collection()), () -> {
                long sequence = collectionLog(current.collection()).nextSequence();
                DocumentEvent event = DocumentEvent.retracted(id, closedAt, sequence);
                journalFor(current.identity().source()).append(event);
                apply(event);
                return recordsById.get(id);
            });
        });
    }

    /**
     * Records an upstream confirmation of an unchanged current record. Only {@code lastChecked}
     * changes and no change is published.
     *
     * @param id current record id
     * @param at confirmation instant
     * @return the updated record
     * @throws StoreWriteConflictException if {@code id} is unknown or no longer current
     */
    public VersionedRecord touch(String id, Instant at) {
        Objects.requireNonNull(at, "at");
        VersionedRecord record = requireRecord(id);
        return withIdentityLock(record.identity(), () -> {
            requireCurrent(id, record.identity(), "touch");
            DocumentEvent event = DocumentEvent.touched(id, at);
            journalFor(record.identity().source()).append(event);
            apply(event);
            return recordsById.get(id);
        });
    }

    public Optional<VersionedRecord> currentFor(ItemIdentity identity) {
        String id = currentIds.get(identity);
        return id == null ? Optional.empty() : Optional.ofNullable(recordsById.get(id));
    }

    /**
     * Returns every version of the identity in {@code validFrom} order, oldest first.
     */
    public List<VersionedRecord> historyFor(ItemIdentity identity) {
        List<String> chain = chains.get(identity);
        if (chain == null) {
            return List.of();
        }
        List<VersionedRecord> history = new ArrayList<>(chain.size());
        for (String id : chain) {
            history.add(recordsById.get(id));
        }
        // chain order breaks validFrom ties
        history.sort(Comparator.comparing(VersionedRecord::validFrom));
        return history;
    }

    public Optional<VersionedRecord> recordById(String id) {
        return Optional.ofNullable(recordsById.get(id));
    }

    /**
     * Returns the records of a collection that became current after {@code sinceCursor} and
     * are still current, in change order.
     *
     * @param collection collection name
     * @param sinceCursor exclusive lower bound on the change sequence, 0 for the whole history
     */
    public List<VersionedRecord> currentInCollection(String collection, long sinceCursor) {
        CollectionLog changeLog = collections.get(collection);
        if (changeLog == null) {
            return List.of();
        }
        Map<ItemIdentity, VersionedRecord> current = new LinkedHashMap<>();
        for (RecordChange change : changeLog.changes.tailMap(sinceCursor, false).values()) {
            if (change.kind() != RecordChange.Kind.BECAME_CURRENT) {
                continue;
            }
            VersionedRecord record = recordsById.get(change.recordId());
            if (record != null && record.isCurrent()) {
                current.put(record.identity(), record);
            }
        }
        return new ArrayList<>(current.values());
    }

    /**
     * Returns up to {@code limit} changes of a collection with a sequence above {@code sinceCursor},
     * in sequence order.
     */
    public List<RecordChange> changesInCollection(String collection, long sinceCursor, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        CollectionLog changeLog = collections.get(collection);
        if (changeLog == null) {
            return List.of();
        }
        List<RecordChange> changes = new ArrayList<>(Math.min(limit, 256));
        for (RecordChange change : changeLog.changes.tailMap(sinceCursor, false).values()) {
            if (changes.size() >= limit) {
                break;
            }
            changes.add(change);
        }
        return changes;
    }

    /**
     * Returns the highest change sequence published for the collection, 0 when none.
     */
    public long latestSequence(String collection) {
        CollectionLog changeLog = collections.get(collection);
        return changeLog == null ? 0 : changeLog.lastSequence;
    }

    public long countCurrent(String collection) {
        long count = 0;
        for (String id : currentIds.values()) {
            VersionedRecord record = recordsById.get(id);
            if (record != null && record.collection().equals(collection)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Lists identities of the source that currently have a current record.
     */
    public Set<ItemIdentity> currentIdentities(String source) {
        Set<ItemIdentity> identities = new HashSet<>();
        for (ItemIdentity identity : currentIds.keySet()) {
            if (identity.source().equals(source)) {
                identities.add(identity);
            }
        }
        return identities;
    }

    @Override
    public void close() throws IOException {
        for (JsonLinesJournal journal : journals.values()) {
            journal.close();
        }
    }

    private void replay() {
        if (!Files.isDirectory(directory)) {
            return;
        }
        int events = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + JOURNAL_SUFFIX)) {
            for (Path file : files) {
                String baseName = file.getFileName().toString();
                baseName = baseName.substring(0, baseName.length() - JOURNAL_SUFFIX.length());
                JsonLinesJournal journal = new JsonLinesJournal(file, mapper, fsync);
                journals.put(baseName, journal);
                for (DocumentEvent event : journal.readAll(DocumentEvent.class)) {
                    apply(event);
                    events++;
                }
            }
        } catch (IOException e) {
            throw new StoreIOException("[STORE] Cannot list journals in " + directory, e);
        }
        if (events > 0) {
            log.info("[STORE] Replayed {} document event(s); {} current record(s) across {} collection(s)",
                    events, currentIds.size(), collections.size());
        }
    }

    private void apply(DocumentEvent event) {
        switch (event.type()) {
            case INSERTED -> {
                putCurrent(event.record());
                publish(event.record(), event.sequence(), RecordChange.Kind.BECAME_CURRENT);
            }
            case SUPERSEDED -> {
                VersionedRecord closed = close(event.recordId(), event.record().validFrom(), event.record().id());
                putCurrent(event.record());
                publish(closed, event.sequence(), RecordChange.Kind.BECAME_NON_CURRENT);
                publish(event.record(), event.replacementSequence(), RecordChange.Kind.BECAME_CURRENT);
            }
            case RETRACTED -> {
                VersionedRecord closed = close(event.recordId(), event.at(), null);
                publish(closed, event.sequence(), RecordChange.Kind.BECAME_NON_CURRENT);
            }
            case TOUCHED -> {
                VersionedRecord record = requireRecord(event.recordId());
                recordsById.put(record.id(), record.confirmedAt(event.at()));
            }
        }
    }

    private void putCurrent(VersionedRecord record) {
        recordsById.put(record.id(), record);
        chains.computeIfAbsent(record.identity(), identity -> new CopyOnWriteArrayList<>()).add(record.id());
        currentIds.put(record.identity(), record.id());
    }

    private VersionedRecord close(String id, Instant at, String replacementId) {
        VersionedRecord closed = requireRecord(id).closedAt(at, replacementId);
        recordsById.put(id, closed);
        currentIds.remove(closed.identity(), id);
        return closed;
    }

    private void publish(VersionedRecord record, long sequence, RecordChange.Kind kind) {
        collectionLog(record.collection())
                .publish(new RecordChange(sequence, record.collection(), record.id(), record.identity(), kind));
    }

    private void requireFreshCurrent(VersionedRecord record) {
        Objects.requireNonNull(record, "record");
        if (!record.isCurrent()) {
            throw new IllegalArgumentException("Only current records can be written, got closed " + record.id());
        }
        if (recordsById.containsKey(record.id())) {
            throw new StoreWriteConflictException("Record id " + record.id() + " already exists");
        }
    }

    private VersionedRecord requireRecord(String id) {
        VersionedRecord record = recordsById.get(Objects.requireNonNull(id, "id"));
        if (record == null) {
            throw new StoreWriteConflictException("Unknown record " + id);
        }
        return record;
    }

    private void requireCurrent(String id, ItemIdentity identity, String operation) {
        if (!id.equals(currentIds.get(identity))) {
            throw new StoreWriteConflictException(
                    "Cannot " + operation + " record " + id + " of " + identity + ": it is not the current version");
        }
    }

    private JsonLinesJournal journalFor(String source) {
        String baseName = SafeFileNames.safeName(source);
        return journals.computeIfAbsent(
                baseName, name -> new JsonLinesJournal(directory.resolve(name + JOURNAL_SUFFIX), mapper, fsync));
    }

    private CollectionLog collectionLog(String collection) {
        return collections.computeIfAbsent(collection, name -> new CollectionLog());
    }

    private <T> T withIdentityLock(ItemIdentity identity, Supplier<T> action) {
        Lock lock = identityLocks.get(identity);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private <T> T withCollectionLocks(List<String> names, Supplier<T> action) {
        // Fixed name order keeps cross-collection supersedes deadlock free.
        List<Lock> locks = new ArrayList<>();
        for (String name : new TreeSet<>(names)) {
            locks.add(collectionLog(name).lock);
        }
        for (Lock lock : locks) {
            lock.lock();
        }
        try {
            return action.get();
        } finally {
            for (int i = locks.size() - 1; i >= 0; i--) {
                locks.get(i).unlock();
            }
        }
    }

    private static final class CollectionLog {
        private final ReentrantLock lock = new ReentrantLock();
        private final ConcurrentSkipListMap<Long, RecordChange> changes = new ConcurrentSkipListMap<>();
        private volatile long lastSequence;

        long nextSequence() {
            return lastSequence + 1;
        }

        void publish(RecordChange change) {
            changes.put(change.sequence(), change);
            if (change.sequence() > lastSequence) {
                lastSequence = change.sequence();
            }
        }
    }

    /**
     * One journal line describing a single atomic write.
     *
     * @param type kind of write
     * @param record inserted record for {@code INSERTED} and {@code SUPERSEDED}
     * @param recordId closed or touched record for {@code SUPERSEDED}, {@code RETRACTED} and {@code TOUCHED}
     * @param at closing or confirmation instant
     * @param sequence change sequence of the first published change
     * @param replacementSequence change sequence of the replacement for {@code SUPERSEDED}
     */
    public record DocumentEvent(
            Type type, VersionedRecord record, String recordId, Instant at, long sequence, long replacementSequence) {

        public enum Type {
            INSERTED,
            SUPERSEDED,
            RETRACTED,
            TOUCHED
        }

        static DocumentEvent inserted(VersionedRecord record, long sequence) {
            return new DocumentEvent(Type.INSERTED, record, null, record.validFrom(), sequence, 0);
        }

        static DocumentEvent superseded(
                String oldId, VersionedRecord replacement, long closeSequence, long insertSequence) {
            return new DocumentEvent(
                    Type.SUPERSEDED, replacement, oldId, replacement.validFrom(), closeSequence, insertSequence);
        }

        static DocumentEvent retracted(String id, Instant at, long sequence) {
            return new DocumentEvent(Type.RETRACTED, null, id, at, sequence, 0);
        }

        static DocumentEvent touched(String id, Instant at) {
            return new DocumentEvent(Type.TOUCHED, null, id, at, 0, 0);
        }
    }
}
