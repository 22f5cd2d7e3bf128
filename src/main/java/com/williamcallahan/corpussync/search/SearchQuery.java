package com.williamcallahan.corpussync.search;

import java.util.List;
import java.util.Objects;

/**
 * A validated search request.
 *
 * @param query free-text query
 * @param collections requested collection names, {@code "*"} for all
 * @param mode retrieval mode
 * @param limit maximum number of results
 * @param audience caller audience tag, null for the public audience
 */
public record SearchQuery(String query, List<String> collections, SearchMode mode, int limit, String audience) {

    public SearchQuery {
        Objects.requireNonNull(mode, "mode");
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        if (collections == null || collections.isEmpty()) {
            throw new IllegalArgumentException("collections must not be empty");
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1");
        }
        collections = List.copyOf(collections);
    }
}
