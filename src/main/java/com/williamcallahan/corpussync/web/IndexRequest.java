package com.williamcallahan.corpussync.web;

import com.williamcallahan.corpussync.config.IndexerProperties;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Body of {@code POST /index}.
 *
 * @param collection collection to index
 * @param batchSize changes per batch, null for the configured default
 * @param fullReindex whether to restart from the beginning of the collection's history
 */
public record IndexRequest(
        @NotBlank String collection,
        @Min(1) @Max(IndexerProperties.MAX_BATCH_SIZE) Integer batchSize,
        boolean fullReindex) {}
