package com.alexandria.rag.exception;

import java.util.UUID;

public class ChunkNotFoundException extends EntityNotFoundException {

    public ChunkNotFoundException(UUID chunkId) {
        super(chunkId, "Chunk not found: " + chunkId);
    }
}
