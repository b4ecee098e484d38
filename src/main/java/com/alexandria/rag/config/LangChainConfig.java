package com.alexandria.rag.config;

import com.alexandria.rag.chunking.TokenCounter;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.googleai.GoogleAiEmbeddingModel;
import dev.langchain4j.model.openai.OpenAiTokenCountEstimator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class LangChainConfig {

    @Value("${app.gemini.api-key}")
    private String apiKey;

    @Bean
    public EmbeddingModel embeddingModel(EmbeddingProperties properties) {
        return GoogleAiEmbeddingModel.builder()
            .apiKey(apiKey)
            .modelName(properties.modelName())
            .outputDimensionality(properties.dimensions())
            .timeout(Duration.ofSeconds(60))
            .maxRetries(1)
            .build();
    }

    /**
     * Local BPE tables, no network access.
     */
    @Bean
    public TokenCounter tokenCounter(EmbeddingProperties properties) {
        OpenAiTokenCountEstimator estimator = new OpenAiTokenCountEstimator(properties.tokenizerModel());
        return estimator::estimateTokenCountInText;
    }
}
