package com.williamcallahan.corpussync.web;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

/**
 * Body of {@code POST /search}.
 *
 * @param query free-text query
 * @param collections collection names, {@code "*"} for all
 * @param mode {@code vector}, {@code lexical} or {@code hybrid}
 * @param limit maximum results, defaults to 10
 * @param audience caller audience, public when absent
 */
public record SearchRequest(
        @NotBlank String query,
        @NotEmpty List<String> collections,
        @NotBlank String mode,
        @Min(1) Integer limit,
        String audience) {

    static final int DEFAULT_LIMIT = 10;

    int effectiveLimit() {
        return limit == null ? DEFAULT_LIMIT : limit;
    }
}
