package com.alexandria.rag.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record IngestionResult(
    @JsonProperty("total_files") int totalFiles,
    @JsonProperty("processed_files") int processedFiles,
    @JsonProperty("skipped_files") int skippedFiles,
    @JsonProperty("failed_files") int failedFiles,
    @JsonProperty("total_chunks") int totalChunks,
    List<String> errors
) {

    public IngestionResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean isSuccessful() {
        return failedFiles == 0 && errors.isEmpty();
    }
}
