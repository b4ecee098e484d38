package com.alexandria.rag.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

public record SearchResult(
    String query,
    List<DocumentMatch> matches,
    @JsonProperty("total_matches") int totalMatches,
    @JsonProperty("search_time_ms") double searchTimeMs,
    @JsonProperty("embedding_time_ms") double embeddingTimeMs
) {

    @JsonProperty("has_results")
    public boolean hasResults() {
        return !matches.isEmpty();
    }

    @JsonIgnore
    public Optional<DocumentMatch> bestMatch() {
        return matches.stream().findFirst();
    }
}
