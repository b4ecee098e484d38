package com.alexandria.rag.controller;

import com.alexandria.rag.model.ChunkStrategy;
import com.alexandria.rag.model.IngestionOptions;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;

import java.util.Optional;

public record IngestOptionsRequest(
    @JsonProperty("chunk_strategy") String chunkStrategy,
    @JsonProperty("chunk_size") @Min(1) Integer chunkSize,
    @JsonProperty("min_chunk_size") @Min(0) Integer minChunkSize,
    @JsonProperty("overlap_size") @Min(0) Integer overlapSize,
    Boolean force,
    @JsonProperty("update_existing") Boolean updateExisting
) {

    /**
     * {@code force} reprocesses whatever is stored; otherwise unset flags fall back to
     * {@code defaults}.
     */
    public IngestionOptions toOptions(IngestionOptions defaults) {
        IngestionOptions options = new IngestionOptions(
            Optional.ofNullable(chunkStrategy).map(ChunkStrategy::fromValue),
            Optional.ofNullable(chunkSize),
            Optional.ofNullable(minChunkSize),
            Optional.ofNullable(overlapSize),
            defaults.skipExisting(),
            updateExisting != null ? updateExisting : defaults.updateExisting()
        );
        return Boolean.TRUE.equals(force) ? options.forced() : options;
    }
}
