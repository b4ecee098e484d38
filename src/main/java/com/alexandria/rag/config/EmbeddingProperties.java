package com.alexandria.rag.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.embedding")
public record EmbeddingProperties(
    @NotBlank @DefaultValue("gemini-embedding-001") String modelName,
    @Min(1) @DefaultValue("768") int dimensions,
    @Min(1) @DefaultValue("3") int maxAttempts,
    @Min(0) @DefaultValue("1000") long retryDelayMs,
    @Min(1) @DefaultValue("12") int rpmLimit,
    @Min(1) @DefaultValue("500000") int tpmLimit,
    @NotBlank @DefaultValue("gpt-4o-mini") String tokenizerModel
) {}
