package com.alexandria.rag.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * The file could not be read or decoded with any supported encoding.
 */
@Getter
public class ExtractionException extends RuntimeException {
    private final Path path;

    public ExtractionException(Path path, String message) {
        super(message);
        this.path = path;
    }

    public ExtractionException(Path path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }
}
