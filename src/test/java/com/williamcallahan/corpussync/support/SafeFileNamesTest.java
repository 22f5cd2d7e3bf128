package com.williamcallahan.corpussync.support;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class SafeFileNamesTest {

    @Test
    void keepsSafeNamesUnchanged() {
        assertEquals("feeds-2026.v1", SafeFileNames.safeName("feeds-2026.v1"));
    }

    @Test
    void disambiguatesNamesThatSanitizeAlike() {
        String slash = SafeFileNames.safeName("a/b");
        String underscore = SafeFileNames.safeName("a_b");

        assertNotEquals(slash, underscore);
        assertTrue(slash.matches("[a-zA-Z0-9._-]+"));
    }

    @Test
    void shortensVeryLongNames() {
        String longName = "x".repeat(400);

        assertTrue(SafeFileNames.safeName(longName).length() <= 150);
    }
}
