package com.alexandria.rag.model;

import com.alexandria.rag.infra.Digests;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A bounded slice of extracted text. Derived fields (hash, char count) are computed once by
 * {@link #of}; use {@link #withIndex} and {@link #withMetadata} to derive renumbered or
 * annotated copies.
 */
public record TextChunk(
    int index,
    String content,
    String contentHash,
    int charCount,
    int tokenCount,
    ChunkStrategy strategy,
    String headerTitle,
    Integer sectionLevel,
    Map<String, Object> metadata
) {

    public TextChunk {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static TextChunk of(int index, String content, int tokenCount, ChunkStrategy strategy,
                               String headerTitle, Integer sectionLevel) {
        return new TextChunk(
            index,
            content,
            Digests.sha256Hex(content),
            content.length(),
            tokenCount,
            strategy,
            headerTitle,
            sectionLevel,
            Map.of()
        );
    }

    public TextChunk withMetadata(Map<String, Object> extra) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.putAll(extra);
        return new TextChunk(index, content, contentHash, charCount, tokenCount, strategy,
            headerTitle, sectionLevel, merged);
    }
}
