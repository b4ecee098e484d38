package com.alexandria.rag.model;

import com.alexandria.rag.infra.Digests;

import java.nio.file.Path;
import java.util.Map;

/**
 * A contiguous byte range of an oversized source file, materialized as a temp file.
 * Only valid while the owning {@code SegmentedFile} is open.
 */
public record FileSegment(
    String id,
    int index,
    Path sourcePath,
    Path tempFile,
    long startByte,
    long endByte,
    Integer lineStart,
    Integer lineEnd,
    Map<String, Object> metadata
) {

    public FileSegment {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static FileSegment of(int index, Path sourcePath, Path tempFile, long startByte, long endByte,
                                 Integer lineStart, Integer lineEnd, Map<String, Object> metadata) {
        String id = Digests.md5Hex(sourcePath + ":" + index + ":" + startByte + ":" + endByte).substring(0, 12);
        return new FileSegment(id, index, sourcePath, tempFile, startByte, endByte, lineStart, lineEnd, metadata);
    }

    public long sizeBytes() {
        return endByte - startByte;
    }
}
