package com.williamcallahan.corpussync.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.corpussync.domain.ItemIdentity;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Verifies fingerprint persistence, tombstones and per-source partitioning.
 */
class FingerprintStoreTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    @Test
    void remembersLatestFingerprintAcrossReopen() throws IOException {
        ItemIdentity identity = new ItemIdentity("feeds", "https://example.com/a");
        try (FingerprintStore store = new FingerprintStore(tempDir, false, CLOCK)) {
            store.remember(identity, "fp-1");
            store.remember(identity, "fp-2");
        }

        try (FingerprintStore reopened = new FingerprintStore(tempDir, false, CLOCK)) {
            assertEquals(Optional.of("fp-2"), reopened.lookup(identity));
        }
    }

    @Test
    void forgottenIdentityStaysForgottenAfterReplay() throws IOException {
        ItemIdentity identity = new ItemIdentity("feeds", "item-1");
        try (FingerprintStore store = new FingerprintStore(tempDir, false, CLOCK)) {
            store.remember(identity, "fp");
            store.forget(identity);
            assertTrue(store.lookup(identity).isEmpty());
        }

        try (FingerprintStore reopened = new FingerprintStore(tempDir, false, CLOCK)) {
            assertTrue(reopened.lookup(identity).isEmpty());
            assertTrue(reopened.knownIdentities("feeds").isEmpty());
        }
    }

    @Test
    void listsKnownIdentitiesPerSource() {
        FingerprintStore store = new FingerprintStore(tempDir, false, CLOCK);
        store.remember(new ItemIdentity("feeds", "a"), "1");
        store.remember(new ItemIdentity("feeds", "b"), "2");
        store.remember(new ItemIdentity("pages", "a"), "3");

        Set<ItemIdentity> known = store.knownIdentities("feeds");

        assertEquals(Set.of(new ItemIdentity("feeds", "a"), new ItemIdentity("feeds", "b")), known);
    }
}
