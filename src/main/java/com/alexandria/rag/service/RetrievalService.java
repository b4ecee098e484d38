package com.alexandria.rag.service;

import com.alexandria.rag.model.ContentType;
import com.alexandria.rag.model.ContextualMatch;
import com.alexandria.rag.model.DocumentMatch;
import com.alexandria.rag.model.SearchQuery;
import com.alexandria.rag.model.SearchResult;

import java.util.List;
import java.util.UUID;

public interface RetrievalService {

    SearchResult search(SearchQuery query);

    SearchResult searchDocuments(String query, int maxResults);

    SearchResult searchInDocuments(String query, List<UUID> documentIds, int maxResults);

    SearchResult searchByContentType(String query, List<ContentType> contentTypes, int maxResults);

    SearchResult searchRecent(String query, int daysBack, int maxResults);

    List<DocumentMatch> getDocumentChunks(UUID documentId, int maxChunks);

    List<DocumentMatch> findSimilar(UUID chunkId, int limit);

    List<ContextualMatch> searchWithContext(String query, int contextSize, int maxResults);

    List<DocumentMatch> bestMatches(String query, int topN);
}
