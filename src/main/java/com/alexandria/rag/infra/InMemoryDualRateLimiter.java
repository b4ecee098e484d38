package com.alexandria.rag.infra;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Requests-per-minute and tokens-per-minute budgets per key. Callers block until both buckets
 * grant the permits.
 */
@Slf4j
public class InMemoryDualRateLimiter implements RateLimiter {

    private final ConcurrentHashMap<String, Bucket> rpmBuckets = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Bucket> tpmBuckets = new ConcurrentHashMap<>();

    private final int rpmLimit;
    private final int tpmLimit;

    public InMemoryDualRateLimiter(int rpmLimit, int tpmLimit) {
        this.rpmLimit = rpmLimit;
        this.tpmLimit = tpmLimit;
    }

    private static Bucket perMinute(long capacity) {
        return Bucket.builder()
            .addLimit(Bandwidth.builder().capacity(capacity).refillGreedy(capacity, Duration.ofMinutes(1)).build())
            .build();
    }

    @Override
    public void acquire(String key, int estimatedTokens) {
        Bucket rpmBucket = rpmBuckets.computeIfAbsent(key, k -> perMinute(rpmLimit));
        Bucket tpmBucket = tpmBuckets.computeIfAbsent(key, k -> perMinute(tpmLimit));

        // a single request larger than the whole minute budget could never be granted
        int cost = Math.max(1, Math.min(estimatedTokens, tpmLimit));
        try {
            rpmBucket.asBlocking().consume(1);
            tpmBucket.asBlocking().consume(cost);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for rate limit '" + key + "'", e);
        }
        log.trace("Acquired 1 request and {} tokens on '{}'", cost, key);
    }

    public long availableTokens(String key) {
        Bucket bucket = tpmBuckets.get(key);
        return bucket == null ? tpmLimit : bucket.getAvailableTokens();
    }

    public long availableRequests(String key) {
        Bucket bucket = rpmBuckets.get(key);
        return bucket == null ? rpmLimit : bucket.getAvailableTokens();
    }
}
