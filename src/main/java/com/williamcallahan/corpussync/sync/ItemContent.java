package com.williamcallahan.corpussync.sync;

import java.time.Instant;
import java.util.Map;

/**
 * Content fetched for one item.
 *
 * @param notModified whether the upstream answered a conditional fetch with "not modified";
 *        the remaining fields are empty in that case
 * @param title item title
 * @param body item body text
 * @param fields further significant fields included in the fingerprint
 * @param lastModified upstream modification time, null when not reported
 */
public record ItemContent(
        boolean notModified, String title, String body, Map<String, String> fields, Instant lastModified) {

    public ItemContent {
        title = title == null ? "" : title;
        body = body == null ? "" : body;
        fields = fields == null ? Map.of() : Map.copyOf(fields);
    }

    public static ItemContent notModifiedResponse() {
        return new ItemContent(true, "", "", Map.of(), null);
    }

    public static ItemContent of(String title, String body, Map<String, String> fields, Instant lastModified) {
        return new ItemContent(false, title, body, fields, lastModified);
    }
}
