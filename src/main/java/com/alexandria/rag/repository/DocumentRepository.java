package com.alexandria.rag.repository;

import com.alexandria.rag.model.Document;
import com.alexandria.rag.model.DocumentStatus;
import com.alexandria.rag.model.IngestionStats;
import com.alexandria.rag.model.SourceDocument;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public interface DocumentRepository {
    Optional<Document> findByHash(String contentHash);
    Optional<Document> findById(UUID id);
    Document create(SourceDocument source, Map<String, Object> metadata);
    void refresh(UUID id, SourceDocument source, Map<String, Object> metadata);
    void updateStatus(UUID id, DocumentStatus status);
    void updateStatus(UUID id, DocumentStatus status, int chunkCount);
    boolean deleteByHash(String contentHash);
    IngestionStats getStats();
}
