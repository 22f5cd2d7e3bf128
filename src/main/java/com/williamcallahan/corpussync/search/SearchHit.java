package com.williamcallahan.corpussync.search;

import java.time.Instant;

/**
 * One ranked search result.
 *
 * @param identity item identity rendered as {@code source:key}
 * @param score fused score in hybrid mode, backend score otherwise
 * @param snippet leading excerpt of the current record body
 * @param collection collection the result came from
 * @param lastChecked last confirmation time of the current record
 * @param title current record title
 * @param location current record location
 */
public record SearchHit(
        String identity, double score, String snippet, String collection, Instant lastChecked, String title,
        String location) {}
