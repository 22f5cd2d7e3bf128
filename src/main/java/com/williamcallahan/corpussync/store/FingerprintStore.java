package com.williamcallahan.corpussync.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.corpussync.domain.ItemIdentity;
import com.williamcallahan.corpussync.support.SafeFileNames;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Durable mapping from item identity to the last fingerprint written to the document store.
 *
 * <p>Partitioned by source: one append-only journal per source, replayed on first access.
 * A forgotten identity is recorded as a tombstone line so replay does not resurrect it.</p>
 */
public class FingerprintStore implements Closeable {

    private final Path directory;
    private final boolean fsync;
    private final Clock clock;
    private final ObjectMapper mapper = StoreJson.mapper();
    private final Map<String, Partition> partitions = new ConcurrentHashMap<>();

    public FingerprintStore(Path directory, boolean fsync, Clock clock) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.fsync = fsync;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Returns the remembered fingerprint for the identity, if any.
     */
    public Optional<String> lookup(ItemIdentity identity) {
        return Optional.ofNullable(partition(identity.source()).fingerprints.get(identity.key()));
    }

    /**
     * Durably records the fingerprint now held by the identity's current record.
     */
    public void remember(ItemIdentity identity, String fingerprint) {
        Objects.requireNonNull(fingerprint, "fingerprint");
        Partition partition = partition(identity.source());
        partition.journal.append(new FingerprintEntry(identity.key(), fingerprint, Instant.now(clock), false));
        partition.fingerprints.put(identity.key(), fingerprint);
    }

    /**
     * Durably drops the identity, so a later reappearance classifies as new.
     */
    public void forget(ItemIdentity identity) {
        Partition partition = partition(identity.source());
        if (!partition.fingerprints.containsKey(identity.key())) {
            return;
        }
        partition.journal.append(new FingerprintEntry(identity.key(), null, Instant.now(clock), true));
        partition.fingerprints.remove(identity.key());
    }

    /**
     * Lists every identity of the source that currently has a remembered fingerprint.
     */
    public Set<ItemIdentity> knownIdentities(String source) {
        Set<ItemIdentity> identities = new HashSet<>();
        for (String key : partition(source).fingerprints.keySet()) {
            identities.add(new ItemIdentity(source, key));
        }
        return identities;
    }

    @Override
    public void close() throws IOException {
        for (Partition partition : partitions.values()) {
            partition.journal.close();
        }
    }

    private Partition partition(String source) {
        return partitions.computeIfAbsent(source, this::openPartition);
    }

    private Partition openPartition(String source) {
        JsonLinesJournal journal =
                new JsonLinesJournal(directory.resolve(SafeFileNames.safeName(source) + ".jsonl"), mapper, fsync);
        Map<String, String> fingerprints = new ConcurrentHashMap<>();
        for (FingerprintEntry entry : journal.readAll(FingerprintEntry.class)) {
            if (entry.tombstone()) {
                fingerprints.remove(entry.key());
            } else {
                fingerprints.put(entry.key(), entry.fingerprint());
            }
        }
        return new Partition(journal, fingerprints);
    }

    private record Partition(JsonLinesJournal journal, Map<String, String> fingerprints) {}

    /**
     * One journal line.
     *
     * @param key item key within the source
     * @param fingerprint remembered fingerprint, null for tombstones
     * @param recordedAt write instant
     * @param tombstone whether the line forgets the key
     */
    public record FingerprintEntry(String key, String fingerprint, Instant recordedAt, boolean tombstone) {}
}
