package com.williamcallahan.corpussync.sync;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Verifies fingerprints ignore formatting noise but track every significant field.
 */
class ContentFingerprinterTest {

    private final ContentFingerprinter fingerprinter = new ContentFingerprinter();

    @Test
    void ignoresWhitespaceFieldOrderAndModificationTime() {
        Map<String, String> ordered = new LinkedHashMap<>();
        ordered.put("author", "Ada");
        ordered.put("section", "News");
        Map<String, String> reversed = new LinkedHashMap<>();
        reversed.put("Section", "News ");
        reversed.put("author", "  Ada");

        String first = fingerprinter.fingerprint(
                ItemContent.of("Title", "Some   body\ntext", ordered, Instant.parse("2026-01-01T00:00:00Z")));
        String second = fingerprinter.fingerprint(
                ItemContent.of(" Title ", "Some body text", reversed, Instant.parse("2026-02-01T00:00:00Z")));

        assertEquals(first, second);
        assertEquals(64, first.length());
    }

    @Test
    void changesWhenAnySignificantFieldChanges() {
        String base = fingerprinter.fingerprint(ItemContent.of("Title", "body", Map.of("author", "Ada"), null));

        assertNotEquals(base, fingerprinter.fingerprint(ItemContent.of("Title!", "body", Map.of("author", "Ada"), null)));
        assertNotEquals(base, fingerprinter.fingerprint(ItemContent.of("Title", "body.", Map.of("author", "Ada"), null)));
        assertNotEquals(base, fingerprinter.fingerprint(ItemContent.of("Title", "body", Map.of("author", "Bob"), null)));
    }

    @Test
    void rejectsEmptyAndNotModifiedContent() {
        assertThrows(MalformedItemException.class,
                () -> fingerprinter.fingerprint(ItemContent.of("  ", "", Map.of(), null)));
        assertThrows(MalformedItemException.class,
                () -> fingerprinter.fingerprint(ItemContent.notModifiedResponse()));
    }
}
