package com.alexandria.rag.infra;

import java.util.function.Supplier;

/**
 * Throttles calls to an external provider. One call costs one request plus its estimated tokens.
 */
public interface RateLimiter {

    /**
     * Blocks until the call identified by {@code key} may go ahead.
     */
    void acquire(String key, int estimatedTokens);

    default <T> T execute(String key, int estimatedTokens, Supplier<T> call) {
        acquire(key, estimatedTokens);
        return call.get();
    }
}
