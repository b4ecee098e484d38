package com.alexandria.rag.config;

import com.alexandria.rag.infra.InMemoryDualRateLimiter;
import com.alexandria.rag.infra.RateLimiter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LimiterConfig {

    @Bean("embeddingLimiter")
    public RateLimiter embeddingLimiter(EmbeddingProperties properties) {
        return new InMemoryDualRateLimiter(properties.rpmLimit(), properties.tpmLimit());
    }
}
