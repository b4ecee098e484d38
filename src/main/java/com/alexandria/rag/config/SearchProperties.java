package com.alexandria.rag.config;

import com.alexandria.rag.model.DistanceMetric;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.search")
public record SearchProperties(
    @Min(1) @Max(100) @DefaultValue("10") int maxResults,
    @DecimalMin("0.0") @DecimalMax("1.0") @DefaultValue("0.0") double minSimilarity,
    @NotNull @DefaultValue("L2") DistanceMetric distanceMetric,
    @Min(0) @Max(20) @DefaultValue("1") int contextSize
) {}
