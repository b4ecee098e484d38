package com.alexandria.rag.model;

import java.util.UUID;

public record ChunkRecord(
    UUID documentId,
    TextChunk chunk,
    float[] embedding
) {}
