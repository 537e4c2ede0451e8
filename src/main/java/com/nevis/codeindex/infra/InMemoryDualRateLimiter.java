package com.nevis.codeindex.infra;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import lombok.SneakyThrows;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryDualRateLimiter implements RateLimiter {

    private final ConcurrentHashMap<String, Bucket> rpmBuckets = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Bucket> tpmBuckets = new ConcurrentHashMap<>();

    private final int rpmLimit;
    private final int tpmLimit;

    public InMemoryDualRateLimiter(int rpmLimit, int tpmLimit) {
        if (rpmLimit <= 0 || tpmLimit <= 0) {
            throw new IllegalArgumentException("Rate limits must be positive");
        }
        this.rpmLimit = rpmLimit;
        this.tpmLimit = tpmLimit;
    }

    private Bucket createRpmBucket() {
        return Bucket.builder()
            .addLimit(Bandwidth.classic(rpmLimit, Refill.greedy(rpmLimit, Duration.ofMinutes(1))))
            .build();
    }

    private Bucket createTpmBucket() {
        return Bucket.builder()
            .addLimit(Bandwidth.classic(tpmLimit, Refill.greedy(tpmLimit, Duration.ofMinutes(1))))
            .build();
    }

    @Override
    @SneakyThrows
    public void acquire(String key, int tokens) {
        Bucket rpmBucket = rpmBuckets.computeIfAbsent(key, k -> createRpmBucket());
        Bucket tpmBucket = tpmBuckets.computeIfAbsent(key, k -> createTpmBucket());

        rpmBucket.asBlocking().consume(1);
        tpmBucket.asBlocking().consume(Math.max(1, Math.min(tokens, tpmLimit)));
    }

    @Override
    public void release(String key, int permits) {
    }

    long availableRequests(String key) {
        return rpmBuckets.computeIfAbsent(key, k -> createRpmBucket()).getAvailableTokens();
    }

    long availableTokens(String key) {
        return tpmBuckets.computeIfAbsent(key, k -> createTpmBucket()).getAvailableTokens();
    }
}
