package com.alexandria.rag.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record IngestionStats(
    @JsonProperty("document_stats") Map<DocumentStatus, Long> documentsByStatus,
    @JsonProperty("content_type_stats") Map<ContentType, Long> documentsByContentType,
    @JsonProperty("total_chunks") long totalChunks
) {}
