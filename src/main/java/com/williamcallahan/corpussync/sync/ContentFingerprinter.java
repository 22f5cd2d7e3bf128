package com.williamcallahan.corpussync.sync;

import com.williamcallahan.corpussync.support.ContentHasher;
import com.williamcallahan.corpussync.support.TextNormalizer;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

/**
 * Computes the content fingerprint of an item.
 *
 * <p>Significant fields are canonicalized (NFC, whitespace runs collapsed, trimmed), sorted by
 * name and hashed with SHA-256, so formatting noise and field order never change the result.
 * Blank fields are ignored.</p>
 */
@Component
public class ContentFingerprinter {

    private static final char NAME_SEPARATOR = '\u001f';
    private static final char FIELD_SEPARATOR = '\u001e';

    /**
     * Fingerprints fetched content.
     *
     * @param content fetched item content
     * @return 64 character hex fingerprint
     * @throws MalformedItemException if the content is a not-modified marker or carries no text
     */
    public String fingerprint(ItemContent content) {
        if (content == null || content.notModified()) {
            throw new MalformedItemException("A not-modified response has no content to fingerprint");
        }
        SortedMap<String, String> significant = new TreeMap<>();
        put(significant, "title", content.title());
        put(significant, "body", content.body());
        for (Map.Entry<String, String> field : content.fields().entrySet()) {
            put(significant, "field." + TextNormalizer.toLowerAscii(field.getKey()).trim(), field.getValue());
        }
        if (significant.isEmpty()) {
            throw new MalformedItemException("Item has no fingerprintable content");
        }
        StringBuilder canonical = new StringBuilder();
        for (Map.Entry<String, String> entry : significant.entrySet()) {
            canonical.append(entry.getKey()).append(NAME_SEPARATOR).append(entry.getValue()).append(FIELD_SEPARATOR);
        }
        return ContentHasher.sha256(canonical.toString());
    }

    private static void put(SortedMap<String, String> significant, String name, String value) {
        String canonical = TextNormalizer.canonicalize(value);
        if (!canonical.isEmpty()) {
            significant.put(name, canonical);
        }
    }
}
