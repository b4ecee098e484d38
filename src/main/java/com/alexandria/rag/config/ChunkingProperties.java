package com.alexandria.rag.config;

import com.alexandria.rag.model.ChunkStrategy;
import com.alexandria.rag.model.IngestionOptions;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Text chunking budgets. Sizes are in characters, {@code maxTokens} in tokenizer units.
 */
@Validated
@ConfigurationProperties(prefix = "app.chunking")
public record ChunkingProperties(
    @NotNull @DefaultValue("SENTENCE_BASED") ChunkStrategy strategy,
    @Min(1) @DefaultValue("1000") int maxChunkSize,
    @Min(0) @DefaultValue("100") int minChunkSize,
    @Min(0) @DefaultValue("100") int overlapSize,
    @Min(1) @DefaultValue("512") int maxTokens,
    @DecimalMin("0.5") @DefaultValue("4.0") double charsPerToken,
    @DefaultValue("true") boolean preserveHeaders,
    @NotNull @DefaultValue("EMIT") OversizePolicy oversizePolicy,
    @Min(1) @DefaultValue("8") int maxSplitDepth
) {

    /**
     * What to do with a piece that still exceeds the token budget once splitting bottoms out.
     */
    public enum OversizePolicy {
        EMIT,
        DROP,
        FAIL
    }

    public ChunkingProperties {
        if (minChunkSize > maxChunkSize) {
            throw new IllegalArgumentException(
                "min-chunk-size (" + minChunkSize + ") exceeds max-chunk-size (" + maxChunkSize + ")");
        }
        if (overlapSize >= maxChunkSize) {
            throw new IllegalArgumentException(
                "overlap-size (" + overlapSize + ") must be smaller than max-chunk-size (" + maxChunkSize + ")");
        }
    }

    public ChunkingProperties withSizes(int maxChunkSize, int minChunkSize, int overlapSize) {
        return new ChunkingProperties(strategy, maxChunkSize, minChunkSize, overlapSize, maxTokens,
            charsPerToken, preserveHeaders, oversizePolicy, maxSplitDepth);
    }

    /**
     * Applies the size overrides of a run. A strategy override is resolved separately because it
     * takes precedence over content-type dispatch.
     */
    public ChunkingProperties withOverrides(IngestionOptions options) {
        return withSizes(
            options.maxChunkSize().orElse(maxChunkSize),
            options.minChunkSize().orElse(minChunkSize),
            options.overlapSize().orElse(overlapSize));
    }
}
