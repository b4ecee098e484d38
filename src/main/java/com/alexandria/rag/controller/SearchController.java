package com.alexandria.rag.controller;

import com.alexandria.rag.config.SearchProperties;
import com.alexandria.rag.exception.WrongQueryException;
import com.alexandria.rag.model.ContentType;
import com.alexandria.rag.model.ContextualMatch;
import com.alexandria.rag.model.DateRange;
import com.alexandria.rag.model.DistanceMetric;
import com.alexandria.rag.model.DocumentMatch;
import com.alexandria.rag.model.SearchQuery;
import com.alexandria.rag.model.SearchResult;
import com.alexandria.rag.service.RetrievalService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/search")
@RequiredArgsConstructor
public class SearchController {

    private final RetrievalService retrievalService;
    private final SearchProperties searchProperties;

    @GetMapping
    public ResponseEntity<SearchResult> search(
        @RequestParam(name = "q") String query,
        @RequestParam(name = "max_results", required = false) Integer maxResults,
        @RequestParam(name = "document_ids", required = false) List<UUID> documentIds,
        @RequestParam(name = "content_types", required = false) List<String> contentTypes,
        @RequestParam(name = "days_back", required = false) Integer daysBack,
        @RequestParam(name = "metric", required = false) String metric,
        @RequestParam(name = "min_similarity", required = false) Double minSimilarity) {

        SearchQuery searchQuery = SearchQuery.of(query, limit(maxResults))
            .withDistanceMetric(metric == null ? searchProperties.distanceMetric() : parse(metric))
            .withDocumentIds(documentIds)
            .withContentTypes(contentTypes == null ? List.of() : contentTypes.stream().map(this::contentType).toList());

        if (daysBack != null) {
            if (daysBack < 1) {
                throw new WrongQueryException("days_back must be at least 1");
            }
            OffsetDateTime now = OffsetDateTime.now();
            searchQuery = searchQuery.withDateRange(new DateRange(now.minusDays(daysBack), now));
        }
        if (minSimilarity != null) {
            searchQuery = searchQuery.withMinSimilarity(minSimilarity);
        }

        return ResponseEntity.ok(retrievalService.search(searchQuery));
    }

    @GetMapping("/context")
    public ResponseEntity<List<ContextualMatch>> searchWithContext(
        @RequestParam(name = "q") String query,
        @RequestParam(name = "context_size", required = false) Integer contextSize,
        @RequestParam(name = "max_results", required = false) Integer maxResults) {

        int size = contextSize == null ? searchProperties.contextSize() : contextSize;
        return ResponseEntity.ok(retrievalService.searchWithContext(query, size, limit(maxResults)));
    }

    @GetMapping("/similar/{chunkId}")
    public ResponseEntity<List<DocumentMatch>> similar(
        @PathVariable UUID chunkId,
        @RequestParam(name = "k", required = false) Integer k) {
        return ResponseEntity.ok(retrievalService.findSimilar(chunkId, limit(k)));
    }

    private int limit(Integer requested) {
        int value = requested == null ? searchProperties.maxResults() : requested;
        if (value < 1) {
            throw new WrongQueryException("max_results must be positive");
        }
        return value;
    }

    private DistanceMetric parse(String metric) {
        try {
            return DistanceMetric.fromValue(metric);
        } catch (IllegalArgumentException e) {
            throw new WrongQueryException(e.getMessage());
        }
    }

    private ContentType contentType(String value) {
        try {
            return ContentType.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new WrongQueryException(e.getMessage());
        }
    }
}
