package com.williamcallahan.corpussync.search;

import java.util.Locale;

/**
 * Retrieval strategy requested by a search caller.
 */
public enum SearchMode {
    VECTOR,
    LEXICAL,
    HYBRID;

    /**
     * Parses the lower-case wire name, ignoring case.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static SearchMode fromWireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("mode must be one of vector, lexical, hybrid");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException unknown) {
            throw new IllegalArgumentException("Unknown search mode '" + name + "'", unknown);
        }
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    boolean usesVectors() {
        return this != LEXICAL;
    }

    boolean usesLexical() {
        return this != VECTOR;
    }
}
