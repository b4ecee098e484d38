package com.alexandria.rag.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

public record DocumentMatch(
    @JsonProperty("chunk_id") UUID chunkId,
    @JsonProperty("document_id") UUID documentId,
    @JsonProperty("chunk_index") int chunkIndex,
    String content,
    @JsonProperty("similarity_score") double similarityScore,
    String filename,
    String filepath,
    @JsonProperty("content_type") ContentType contentType,
    Map<String, Object> metadata,
    @JsonProperty("created_at") OffsetDateTime createdAt
) {
    public DocumentMatch {
        if (Double.isNaN(similarityScore) || similarityScore < 0 || similarityScore > 1.000001) {
            throw new IllegalArgumentException("Invalid similarity score: " + similarityScore);
        }
    }
}
