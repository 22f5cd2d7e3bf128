package com.williamcallahan.corpussync.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One version of an item in the system of record.
 *
 * <p>A record with {@code validTo == null} is the current version of its identity. Once
 * {@code validTo} is set the record is history and none of its fields change again.</p>
 *
 * @param id unique record id
 * @param identity item identity this version belongs to
 * @param collection collection the record is indexed into
 * @param location upstream location (URL or locator), may be empty
 * @param title item title, may be empty
 * @param body normalized content body
 * @param fingerprint content fingerprint of the significant fields
 * @param validFrom instant this version became current
 * @param validTo instant this version stopped being current, null while current
 * @param supersededBy id of the record that replaced this one, null while current or when repealed
 * @param lastChecked most recent confirmation of this version upstream
 */
public record VersionedRecord(
        String id,
        ItemIdentity identity,
        String collection,
        String location,
        String title,
        String body,
        String fingerprint,
        Instant validFrom,
        Instant validTo,
        String supersededBy,
        Instant lastChecked) {

    public VersionedRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(collection, "collection");
        Objects.requireNonNull(fingerprint, "fingerprint");
        Objects.requireNonNull(validFrom, "validFrom");
        Objects.requireNonNull(lastChecked, "lastChecked");
        location = location == null ? "" : location;
        title = title == null ? "" : title;
        body = body == null ? "" : body;
        if (validTo == null && supersededBy != null) {
            throw new IllegalArgumentException("A current record cannot be superseded");
        }
    }

    /**
     * Creates a fresh current version with a new random id.
     */
    public static VersionedRecord newVersion(
            ItemIdentity identity,
            String collection,
            String location,
            String title,
            String body,
            String fingerprint,
            Instant now) {
        return new VersionedRecord(
                UUID.randomUUID().toString(),
                identity,
                collection,
                location,
                title,
                body,
                fingerprint,
                now,
                null,
                null,
                now);
    }

    public boolean isCurrent() {
        return validTo == null;
    }

    public boolean isRepealed() {
        return validTo != null && supersededBy == null;
    }

    /**
     * Returns a copy with an updated confirmation time; only legal while current.
     *
     * @param checkedAt confirmation instant
     * @return updated copy
     */
    public VersionedRecord confirmedAt(Instant checkedAt) {
        if (!isCurrent()) {
            throw new IllegalStateException("Record " + id + " is history and cannot be modified");
        }
        return new VersionedRecord(
                id, identity, collection, location, title, body, fingerprint, validFrom, null, null, checkedAt);
    }

    /**
     * Returns a closed copy of this record.
     *
     * @param closedAt instant the record stops being current
     * @param replacementId replacing record id, or null for a terminal repeal
     * @return closed copy
     */
    public VersionedRecord closedAt(Instant closedAt, String replacementId) {
        if (!isCurrent()) {
            throw new IllegalStateException("Record " + id + " is already closed");
        }
        Objects.requireNonNull(closedAt, "closedAt");
        return new VersionedRecord(
                id, identity, collection, location, title, body, fingerprint, validFrom, closedAt, replacementId,
                lastChecked);
    }
}
