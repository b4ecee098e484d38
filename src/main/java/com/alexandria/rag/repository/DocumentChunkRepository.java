package com.alexandria.rag.repository;

import com.alexandria.rag.model.ChunkRecord;
import com.alexandria.rag.model.DistanceMetric;
import com.alexandria.rag.model.DocumentMatch;
import com.alexandria.rag.model.SimilarityFilter;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface DocumentChunkRepository {

    /**
     * Deletes the current chunk set of the document and inserts {@code records}. Must run inside
     * the caller's transaction so readers never observe a partial set.
     */
    void replaceChunks(UUID documentId, List<ChunkRecord> records);

    int countByDocumentId(UUID documentId);

    /**
     * Nearest chunks by ascending distance. Similarity on the returned matches is
     * {@code 1 / (1 + distance)}.
     */
    List<DocumentMatch> findSimilar(float[] vector, DistanceMetric metric, SimilarityFilter filter, int limit);

    /**
     * Chunks in index order, unranked (similarity 0).
     */
    List<DocumentMatch> findByDocumentId(UUID documentId, int limit);

    List<DocumentMatch> findRange(UUID documentId, int fromIndex, int toIndex);

    Optional<float[]> findEmbedding(UUID chunkId);
}
