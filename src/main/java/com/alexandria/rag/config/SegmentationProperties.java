package com.alexandria.rag.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

/**
 * File-level segmentation of oversized text files.
 *
 * <p>{@code sizeOverlapLineLength} is the assumed bytes per line used to turn
 * {@code overlapLines} into a byte overlap for size-based segments. It is an approximation;
 * {@code 0} disables overlap for that strategy.
 */
@Validated
@ConfigurationProperties(prefix = "app.segmentation")
public record SegmentationProperties(
    @DefaultValue("true") boolean enabled,
    @NotNull @DefaultValue("100MB") DataSize maxFileSize,
    @NotNull @DefaultValue("50MB") DataSize preferredSegmentSize,
    @Min(0) @DefaultValue("50") int overlapLines,
    @NotNull @DefaultValue("SIZE_BASED") Strategy strategy,
    @Min(1) @DefaultValue("1000") int lineSampleSize,
    @Min(1) @DefaultValue("1000") int minLinesPerSegment,
    @Min(0) @DefaultValue("0") int sizeOverlapLineLength,
    @Min(1) @DefaultValue("4096") int lookaheadBytes,
    Path tempDir,
    @DefaultValue("true") boolean fallbackOnError
) {

    public enum Strategy {
        SIZE_BASED,
        LINE_BASED,
        MARKDOWN_SECTION
    }

    public Path resolvedTempDir() {
        return tempDir != null ? tempDir : Path.of(System.getProperty("java.io.tmpdir"), "alexandria_segments");
    }

    public long sizeOverlapBytes() {
        return (long) overlapLines * sizeOverlapLineLength;
    }
}
