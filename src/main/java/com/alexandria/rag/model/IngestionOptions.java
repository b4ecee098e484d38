package com.alexandria.rag.model;

import java.util.Optional;

/**
 * Per-run overrides on top of the configured ingestion and chunking defaults.
 */
public record IngestionOptions(
    Optional<ChunkStrategy> chunkStrategy,
    Optional<Integer> maxChunkSize,
    Optional<Integer> minChunkSize,
    Optional<Integer> overlapSize,
    boolean skipExisting,
    boolean updateExisting
) {

    public static IngestionOptions defaults(boolean skipExisting, boolean updateExisting) {
        return new IngestionOptions(Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(),
            skipExisting, updateExisting);
    }

    /**
     * Reprocess regardless of what is already stored.
     */
    public IngestionOptions forced() {
        return new IngestionOptions(chunkStrategy, maxChunkSize, minChunkSize, overlapSize, false, false);
    }
}
