package com.williamcallahan.corpussync.support;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Locale-independent text normalization used for fingerprints, configuration keys and snippets.
 */
public final class TextNormalizer {

    private static final int CASE_OFFSET = 'a' - 'A';
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private TextNormalizer() {}

    /**
     * Converts ASCII uppercase letters to lowercase, leaving other characters unchanged.
     *
     * @param text the input text to normalize (may be null)
     * @return the normalized text with ASCII letters lowercased, or empty string if null
     */
    public static String toLowerAscii(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder normalized = new StringBuilder(text.length());
        for (int index = 0; index < text.length(); index++) {
            char current = text.charAt(index);
            if (current >= 'A' && current <= 'Z') {
                normalized.append((char) (current + CASE_OFFSET));
            } else {
                normalized.append(current);
            }
        }
        return normalized.toString();
    }

    /**
     * Applies Unicode NFC composition, collapses every whitespace run to a single space and trims.
     *
     * @param text raw text (may be null)
     * @return canonical text, empty when the input is null or blank
     */
    public static String canonicalize(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String composed = Normalizer.normalize(text, Normalizer.Form.NFC);
        return WHITESPACE_RUN.matcher(composed).replaceAll(" ").trim();
    }

    /**
     * Returns a whitespace-collapsed prefix of {@code text} suitable for display.
     *
     * @param text source text
     * @param maxChars maximum snippet length before the ellipsis
     * @return snippet, never null
     */
    public static String snippet(String text, int maxChars) {
        String canonical = canonicalize(text);
        if (canonical.length() <= maxChars) {
            return canonical;
        }
        int cut = canonical.lastIndexOf(' ', maxChars);
        if (cut < maxChars / 2) {
            cut = maxChars;
        }
        // never split a surrogate pair
        if (cut > 0 && Character.isHighSurrogate(canonical.charAt(cut - 1))) {
            cut--;
        }
        return canonical.substring(0, cut) + "...";
    }
}
