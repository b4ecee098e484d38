package com.alexandria.rag.model;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

public record Document(
    UUID id,
    String filename,
    String filepath,
    String contentHash,
    long fileSize,
    String mimeType,
    ContentType contentType,
    DocumentStatus status,
    int chunkCount,
    Map<String, Object> metadata,
    OffsetDateTime lastModified,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {}
