package com.alexandria.rag.service;

import com.alexandria.rag.config.EmbeddingProperties;
import com.alexandria.rag.exception.EmbeddingException;
import com.alexandria.rag.infra.RateLimiter;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.exception.RetriableException;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
@Slf4j
public class EmbeddingServiceImpl implements EmbeddingService {

    public static final String EMBEDDING_LIMIT = "embedding_limit";

    private static final int MAX_QUERY_LENGTH = 1000;
    private static final int BATCH_SIZE = 100;

    private final EmbeddingModel embeddingModel;
    private final RateLimiter embeddingLimiter;
    private final EmbeddingProperties properties;

    public EmbeddingServiceImpl(
        @Qualifier("embeddingLimiter") RateLimiter embeddingLimiter,
        EmbeddingModel embeddingModel,
        EmbeddingProperties properties
    ) {
        this.embeddingLimiter = embeddingLimiter;
        this.embeddingModel = embeddingModel;
        this.properties = properties;
    }

    @Override
    @Retryable(
        retryFor = RetriableException.class,
        maxAttemptsExpression = "${app.embedding.max-attempts:3}",
        backoff = @Backoff(delayExpression = "${app.embedding.retry-delay-ms:1000}", multiplier = 2),
        recover = "recoverSingle"
    )
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Text cannot be empty");
        }
        Response<Embedding> response = embeddingLimiter.execute(EMBEDDING_LIMIT, estimateTokens(text),
            () -> embeddingModel.embed(text));
        return validate(response.content());
    }

    @Override
    @Retryable(
        retryFor = RetriableException.class,
        maxAttemptsExpression = "${app.embedding.max-attempts:3}",
        backoff = @Backoff(delayExpression = "${app.embedding.retry-delay-ms:1000}", multiplier = 2),
        recover = "recoverBatch"
    )
    public List<float[]> embedAll(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }

        List<float[]> vectors = new ArrayList<>(texts.size());
        for (int from = 0; from < texts.size(); from += BATCH_SIZE) {
            List<TextSegment> batch = texts.subList(from, Math.min(texts.size(), from + BATCH_SIZE)).stream()
                .map(TextSegment::from)
                .toList();
            int estimatedTokens = batch.stream().mapToInt(segment -> estimateTokens(segment.text())).sum();

            Response<List<Embedding>> response = embeddingLimiter.execute(EMBEDDING_LIMIT, estimatedTokens,
                () -> embeddingModel.embedAll(batch));

            List<Embedding> embeddings = response.content();
            if (embeddings == null || embeddings.size() != batch.size()) {
                throw new RetriableException("Expected " + batch.size() + " embeddings, got "
                    + (embeddings == null ? 0 : embeddings.size()));
            }
            embeddings.forEach(embedding -> vectors.add(validate(embedding)));
        }
        log.debug("Embedded {} texts", texts.size());
        return vectors;
    }

    @Override
    @Retryable(
        retryFor = RetriableException.class,
        maxAttemptsExpression = "${app.embedding.max-attempts:3}",
        backoff = @Backoff(delayExpression = "${app.embedding.retry-delay-ms:1000}", multiplier = 2),
        recover = "recoverSingle"
    )
    public float[] embedQuery(String inputQuery) {
        if (inputQuery == null || inputQuery.isBlank()) {
            throw new IllegalArgumentException("Query cannot be empty");
        }

        String query = inputQuery.strip();
        if (query.length() > MAX_QUERY_LENGTH) {
            query = query.substring(0, MAX_QUERY_LENGTH);
            log.warn("Query was truncated to {} characters for embedding", MAX_QUERY_LENGTH);
        }

        log.debug("Generating embedding for query: '{}'", query);
        String text = query;
        Response<Embedding> response = embeddingLimiter.execute(EMBEDDING_LIMIT, estimateTokens(text),
            () -> embeddingModel.embed(text));
        return validate(response.content());
    }

    @Recover
    public float[] recoverSingle(Exception e, String text) {
        throw failure(e);
    }

    @Recover
    public List<float[]> recoverBatch(Exception e, List<String> texts) {
        throw failure(e);
    }

    private RuntimeException failure(Exception e) {
        if (e instanceof IllegalArgumentException || e instanceof EmbeddingException) {
            return (RuntimeException) e;
        }
        log.error("Embedding request failed: {}", e.getMessage(), e);
        return new EmbeddingException("Embedding provider failed: " + e.getMessage(), e);
    }

    private float[] validate(Embedding embedding) {
        float[] vector = embedding == null ? null : embedding.vector();
        if (vector == null || vector.length == 0) {
            throw new EmbeddingException("Embedding model returned an empty vector");
        }
        if (vector.length != properties.dimensions()) {
            throw new EmbeddingException("Expected " + properties.dimensions() + " dimensions, got " + vector.length);
        }
        return vector;
    }

    private static int estimateTokens(String text) {
        return Math.max(1, text.length() / 4);
    }
}
