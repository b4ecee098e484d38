package com.alexandria.rag.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ContextualMatch(
    @JsonProperty("main_match") DocumentMatch mainMatch,
    @JsonProperty("context_chunks") List<DocumentMatch> contextChunks,
    @JsonProperty("context_start_index") int contextStartIndex,
    @JsonProperty("total_chunks_in_document") int totalChunksInDocument
) {}
