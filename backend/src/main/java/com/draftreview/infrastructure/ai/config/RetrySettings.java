package com.draftreview.infrastructure.ai.config;

import java.time.Duration;

/**
 * Retry and admission settings shared by every backend adapter.
 *
 * @param maxAttempts       total attempts per call, including the first
 * @param initialBackoff    delay before the second attempt, doubled for each later one
 * @param rateLimitMaxWait  how long one attempt may wait for a rate limiter token
 * @param limiterMaxTokens  rate limiter capacity
 * @param limiterRefillRate rate limiter refill, tokens per second
 */
public record RetrySettings(
        int maxAttempts,
        Duration initialBackoff,
        Duration rateLimitMaxWait,
        int limiterMaxTokens,
        double limiterRefillRate
) {

    public RetrySettings {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        initialBackoff = initialBackoff != null ? initialBackoff : Duration.ofSeconds(1);
        rateLimitMaxWait = rateLimitMaxWait != null ? rateLimitMaxWait : Duration.ofSeconds(30);
    }

    public static RetrySettings defaults() {
        return new RetrySettings(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 10, 1.0);
    }

    /**
     * Backoff before the attempt following {@code attempt} (zero-based): {@code initialBackoff * 2^attempt}.
     */
    public long backoffMillis(int attempt) {
        return initialBackoff.toMillis() * (1L << Math.min(attempt, 20));
    }
}
