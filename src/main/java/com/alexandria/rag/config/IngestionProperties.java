package com.alexandria.rag.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.ingestion")
public record IngestionProperties(
    @DefaultValue("true") boolean skipExisting,
    @DefaultValue("false") boolean updateExisting,
    @Min(1) @Max(64) @DefaultValue("4") int workers,
    @Min(1) @DefaultValue("10") int maxReportedErrors
) {}
