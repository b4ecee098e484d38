package com.alexandria.rag.model;

import java.nio.file.Path;
import java.time.OffsetDateTime;

/**
 * A file submitted for ingestion. Identity is the SHA-256 of its bytes.
 */
public record SourceDocument(
    Path path,
    String filename,
    String filepath,
    String contentHash,
    long fileSize,
    String mimeType,
    ContentType contentType,
    String extension,
    OffsetDateTime lastModified
) {}
