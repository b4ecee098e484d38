package com.alexandria.rag.service;

import com.alexandria.rag.config.SearchProperties;
import com.alexandria.rag.exception.ChunkNotFoundException;
import com.alexandria.rag.exception.DocumentNotFoundException;
import com.alexandria.rag.exception.WrongQueryException;
import com.alexandria.rag.model.ContentType;
import com.alexandria.rag.model.ContextualMatch;
import com.alexandria.rag.model.DateRange;
import com.alexandria.rag.model.DocumentMatch;
import com.alexandria.rag.model.SearchQuery;
import com.alexandria.rag.model.SearchResult;
import com.alexandria.rag.model.SimilarityFilter;
import com.alexandria.rag.repository.DocumentChunkRepository;
import com.alexandria.rag.repository.DocumentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class RetrievalServiceImpl implements RetrievalService {

    private static final int MAX_RESULTS = 100;
    private static final int MAX_CONTEXT_SIZE = 20;

    private final EmbeddingService embeddingService;
    private final DocumentRepository documentRepository;
    private final DocumentChunkRepository chunkRepository;
    private final SearchProperties searchProperties;

    @Override
    public SearchResult search(SearchQuery query) {
        validateQuery(query.queryText());
        validateLimit(query.maxResults());

        long started = System.nanoTime();
        float[] vector = embeddingService.embedQuery(query.queryText());
        double embeddingMs = elapsedMs(started);

        List<DocumentMatch> ranked = chunkRepository.findSimilar(
            vector, query.distanceMetric(), SimilarityFilter.from(query), query.maxResults());

        double threshold = query.minSimilarity().orElse(searchProperties.minSimilarity());
        List<DocumentMatch> matches = ranked.stream()
            .filter(match -> match.similarityScore() >= threshold)
            .toList();
        double searchMs = elapsedMs(started);

        if (matches.isEmpty()) {
            log.info("No relevant results for '{}' ({} candidates below {})", query.queryText(), ranked.size(), threshold);
        } else {
            log.debug("Query '{}' returned {} matches in {} ms", query.queryText(), matches.size(), searchMs);
        }
        return new SearchResult(query.queryText(), matches, matches.size(), searchMs, embeddingMs);
    }

    @Override
    public SearchResult searchDocuments(String query, int maxResults) {
        return search(baseQuery(query, maxResults));
    }

    @Override
    public SearchResult searchInDocuments(String query, List<UUID> documentIds, int maxResults) {
        return search(baseQuery(query, maxResults).withDocumentIds(documentIds));
    }

    @Override
    public SearchResult searchByContentType(String query, List<ContentType> contentTypes, int maxResults) {
        return search(baseQuery(query, maxResults).withContentTypes(contentTypes));
    }

    @Override
    public SearchResult searchRecent(String query, int daysBack, int maxResults) {
        if (daysBack < 1) {
            throw new WrongQueryException("days_back must be at least 1");
        }
        OffsetDateTime now = OffsetDateTime.now();
        return search(baseQuery(query, maxResults).withDateRange(new DateRange(now.minusDays(daysBack), now)));
    }

    @Override
    public List<DocumentMatch> getDocumentChunks(UUID documentId, int maxChunks) {
        if (maxChunks < 1) {
            throw new WrongQueryException("max_chunks must be positive");
        }
        documentRepository.findById(documentId)
            .orElseThrow(() -> new DocumentNotFoundException(documentId));
        return chunkRepository.findByDocumentId(documentId, maxChunks);
    }

    @Override
    public List<DocumentMatch> findSimilar(UUID chunkId, int limit) {
        validateLimit(limit);
        float[] vector = chunkRepository.findEmbedding(chunkId)
            .orElseThrow(() -> new ChunkNotFoundException(chunkId));

        return chunkRepository.findSimilar(vector, searchProperties.distanceMetric(),
            SimilarityFilter.none().excluding(chunkId), limit);
    }

    @Override
    public List<ContextualMatch> searchWithContext(String query, int contextSize, int maxResults) {
        if (contextSize < 0 || contextSize > MAX_CONTEXT_SIZE) {
            throw new WrongQueryException("context_size must be between 0 and " + MAX_CONTEXT_SIZE);
        }

        List<ContextualMatch> results = new ArrayList<>();
        for (DocumentMatch match : searchDocuments(query, maxResults).matches()) {
            int from = Math.max(0, match.chunkIndex() - contextSize);
            int to = match.chunkIndex() + contextSize;

            List<DocumentMatch> window = chunkRepository.findRange(match.documentId(), from, to);
            List<DocumentMatch> context = window.stream()
                .filter(chunk -> chunk.chunkIndex() != match.chunkIndex())
                .toList();
            int startIndex = window.isEmpty() ? match.chunkIndex() : window.get(0).chunkIndex();

            results.add(new ContextualMatch(match, context, startIndex,
                chunkRepository.countByDocumentId(match.documentId())));
        }
        return results;
    }

    @Override
    public List<DocumentMatch> bestMatches(String query, int topN) {
        return searchDocuments(query, topN).matches();
    }

    private SearchQuery baseQuery(String query, int maxResults) {
        validateQuery(query);
        validateLimit(maxResults);
        return SearchQuery.of(query, maxResults).withDistanceMetric(searchProperties.distanceMetric());
    }

    private static void validateQuery(String query) {
        if (query == null || query.isBlank()) {
            throw new WrongQueryException("Query cannot be blank");
        }
    }

    private static void validateLimit(int limit) {
        if (limit < 1 || limit > MAX_RESULTS) {
            throw new WrongQueryException("Result limit must be between 1 and " + MAX_RESULTS);
        }
    }

    private static double elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000.0;
    }
}
