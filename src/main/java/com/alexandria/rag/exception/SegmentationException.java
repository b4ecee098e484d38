package com.alexandria.rag.exception;

import lombok.Getter;

import java.nio.file.Path;

@Getter
public class SegmentationException extends RuntimeException {
    private final Path path;

    public SegmentationException(Path path, Throwable cause) {
        super("Failed to segment " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }
}
