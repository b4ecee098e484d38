package com.alexandria.rag.service;

import com.alexandria.rag.config.SearchProperties;
import com.alexandria.rag.exception.ChunkNotFoundException;
import com.alexandria.rag.exception.DocumentNotFoundException;
import com.alexandria.rag.exception.WrongQueryException;
import com.alexandria.rag.model.ContentType;
import com.alexandria.rag.model.ContextualMatch;
import com.alexandria.rag.model.DistanceMetric;
import com.alexandria.rag.model.DocumentMatch;
import com.alexandria.rag.model.SearchResult;
import com.alexandria.rag.model.SimilarityFilter;
import com.alexandria.rag.repository.DocumentChunkRepository;
import com.alexandria.rag.repository.DocumentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class RetrievalServiceTest {

    private final EmbeddingService embeddingService = Mockito.mock(EmbeddingService.class);
    private final DocumentRepository documentRepository = Mockito.mock(DocumentRepository.class);
    private final DocumentChunkRepository chunkRepository = Mockito.mock(DocumentChunkRepository.class);
    private final SearchProperties properties = new SearchProperties(10, 0.3, DistanceMetric.L2, 1);
    private final RetrievalService retrievalService =
        new RetrievalServiceImpl(embeddingService, documentRepository, chunkRepository, properties);

    private final float[] queryVector = {0.1f, 0.2f, 0.3f};
    private final UUID documentId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        when(embeddingService.embedQuery(any())).thenReturn(queryVector);
    }

    private DocumentMatch match(int index, double score) {
        return new DocumentMatch(UUID.randomUUID(), documentId, index, "chunk " + index, score,
            "notes.md", "/data/notes.md", ContentType.MARKDOWN, Map.of(), OffsetDateTime.now());
    }

    @Test
    @DisplayName("Should drop matches below the similarity threshold and keep ranking order")
    void shouldFilterByThreshold() {
        when(chunkRepository.findSimilar(eq(queryVector), eq(DistanceMetric.L2), any(), eq(5)))
            .thenReturn(List.of(match(3, 0.9), match(1, 0.5), match(7, 0.2)));

        SearchResult result = retrievalService.searchDocuments("vector search", 5);

        assertThat(result.matches()).extracting(DocumentMatch::chunkIndex).containsExactly(3, 1);
        assertThat(result.totalMatches()).isEqualTo(2);
        assertThat(result.hasResults()).isTrue();
        assertThat(result.bestMatch()).get().extracting(DocumentMatch::chunkIndex).isEqualTo(3);
        assertThat(result.query()).isEqualTo("vector search");
    }

    @Test
    @DisplayName("Should report no results when nothing passes the threshold")
    void shouldReturnEmptyResult() {
        when(chunkRepository.findSimilar(any(), any(), any(), anyInt())).thenReturn(List.of(match(0, 0.1)));

        SearchResult result = retrievalService.searchDocuments("unrelated", 5);

        assertThat(result.hasResults()).isFalse();
        assertThat(result.bestMatch()).isEmpty();
    }

    @Test
    @DisplayName("Should pass document and content type filters to the store")
    void shouldForwardFilters() {
        UUID other = UUID.randomUUID();
        when(chunkRepository.findSimilar(any(), any(), any(), anyInt())).thenReturn(List.of());

        retrievalService.searchInDocuments("q", List.of(documentId, other), 3);
        retrievalService.searchByContentType("q", List.of(ContentType.CODE), 3);

        ArgumentCaptor<SimilarityFilter> filters = ArgumentCaptor.forClass(SimilarityFilter.class);
        verify(chunkRepository, Mockito.times(2)).findSimilar(any(), any(), filters.capture(), eq(3));
        assertThat(filters.getAllValues().get(0).documentIds()).containsExactly(documentId, other);
        assertThat(filters.getAllValues().get(1).contentTypes()).containsExactly(ContentType.CODE);
    }

    @Test
    @DisplayName("Should restrict recent searches to the requested number of days")
    void shouldFilterByDate() {
        when(chunkRepository.findSimilar(any(), any(), any(), anyInt())).thenReturn(List.of());

        retrievalService.searchRecent("q", 7, 10);

        ArgumentCaptor<SimilarityFilter> filter = ArgumentCaptor.forClass(SimilarityFilter.class);
        verify(chunkRepository).findSimilar(any(), any(), filter.capture(), eq(10));
        OffsetDateTime from = filter.getValue().createdFrom().orElseThrow();
        OffsetDateTime to = filter.getValue().createdTo().orElseThrow();
        assertThat(from).isBetween(to.minusDays(7).minusMinutes(1), to.minusDays(7).plusMinutes(1));
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @ParameterizedTest
        @ValueSource(strings = {"", "   "})
        void shouldRejectBlankQuery(String query) {
            assertThatThrownBy(() -> retrievalService.searchDocuments(query, 5))
                .isInstanceOf(WrongQueryException.class);
            verifyNoInteractions(embeddingService);
        }

        @ParameterizedTest
        @ValueSource(ints = {0, -1, 101})
        void shouldRejectLimitsOutOfRange(int limit) {
            assertThatThrownBy(() -> retrievalService.searchDocuments("q", limit))
                .isInstanceOf(WrongQueryException.class);
        }

        @Test
        void shouldRejectNonPositiveDaysBack() {
            assertThatThrownBy(() -> retrievalService.searchRecent("q", 0, 5))
                .isInstanceOf(WrongQueryException.class);
        }

        @Test
        void shouldRejectContextSizeOutOfRange() {
            assertThatThrownBy(() -> retrievalService.searchWithContext("q", 21, 5))
                .isInstanceOf(WrongQueryException.class);
        }
    }

    @Nested
    @DisplayName("Chunk level lookups")
    class ChunkLookups {

        @Test
        @DisplayName("Should fail for an unknown document")
        void shouldFailForUnknownDocument() {
            when(documentRepository.findById(documentId)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> retrievalService.getDocumentChunks(documentId, 10))
                .isInstanceOf(DocumentNotFoundException.class);
        }

        @Test
        @DisplayName("Should fail for a chunk without embedding")
        void shouldFailForUnknownChunk() {
            UUID chunkId = UUID.randomUUID();
            when(chunkRepository.findEmbedding(chunkId)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> retrievalService.findSimilar(chunkId, 5))
                .isInstanceOf(ChunkNotFoundException.class);
        }

        @Test
        @DisplayName("Should exclude the reference chunk from related results")
        void shouldExcludeReferenceChunk() {
            UUID chunkId = UUID.randomUUID();
            float[] stored = {1f, 0f, 0f};
            when(chunkRepository.findEmbedding(chunkId)).thenReturn(Optional.of(stored));
            when(chunkRepository.findSimilar(eq(stored), any(), any(), eq(4))).thenReturn(List.of(match(2, 0.8)));

            List<DocumentMatch> related = retrievalService.findSimilar(chunkId, 4);

            ArgumentCaptor<SimilarityFilter> filter = ArgumentCaptor.forClass(SimilarityFilter.class);
            verify(chunkRepository).findSimilar(eq(stored), eq(DistanceMetric.L2), filter.capture(), eq(4));
            assertThat(filter.getValue().excludeChunkId()).contains(chunkId);
            assertThat(related).hasSize(1);
            verifyNoInteractions(embeddingService);
        }

        @Test
        @DisplayName("Should surround each match with its neighbouring chunks")
        void shouldAddContext() {
            DocumentMatch main = match(5, 0.9);
            when(chunkRepository.findSimilar(any(), any(), any(), anyInt())).thenReturn(List.of(main));
            when(chunkRepository.findRange(documentId, 3, 7))
                .thenReturn(List.of(match(3, 0), match(4, 0), match(5, 0), match(6, 0)));
            when(chunkRepository.countByDocumentId(documentId)).thenReturn(7);

            List<ContextualMatch> results = retrievalService.searchWithContext("q", 2, 5);

            assertThat(results).hasSize(1);
            ContextualMatch contextual = results.get(0);
            assertThat(contextual.mainMatch()).isEqualTo(main);
            assertThat(contextual.contextChunks()).extracting(DocumentMatch::chunkIndex).containsExactly(3, 4, 6);
            assertThat(contextual.contextStartIndex()).isEqualTo(3);
            assertThat(contextual.totalChunksInDocument()).isEqualTo(7);
        }

        @Test
        @DisplayName("Should clamp the context window at the first chunk")
        void shouldClampContextAtDocumentStart() {
            when(chunkRepository.findSimilar(any(), any(), any(), anyInt())).thenReturn(List.of(match(0, 0.9)));
            when(chunkRepository.findRange(documentId, 0, 1)).thenReturn(List.of(match(0, 0), match(1, 0)));
            when(chunkRepository.countByDocumentId(documentId)).thenReturn(2);

            ContextualMatch contextual = retrievalService.searchWithContext("q", 1, 5).get(0);

            assertThat(contextual.contextStartIndex()).isZero();
            assertThat(contextual.contextChunks()).extracting(DocumentMatch::chunkIndex).containsExactly(1);
        }
    }
}
