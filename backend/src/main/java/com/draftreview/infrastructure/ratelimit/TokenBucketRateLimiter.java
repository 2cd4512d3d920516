package com.draftreview.infrastructure.ratelimit;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.function.LongSupplier;

/**
 * Token bucket rate limiter.
 *
 * The bucket holds at most {@code maxTokens} and refills continuously at {@code refillRate}
 * tokens per second. Refill is computed lazily from elapsed time on every call; no timer runs
 * in the background.
 *
 * Thread-safe.
 */
@Slf4j
public class TokenBucketRateLimiter {

    public static final long DEFAULT_MAX_WAIT_MS = 30_000;
    static final long POLL_INTERVAL_MS = 100;

    @Getter
    private final String name;
    @Getter
    private final int maxTokens;
    @Getter
    private final double refillRate;
    private final LongSupplier clock;
    private final Sleeper sleeper;

    private double tokens;
    private long lastRefillMillis;

    /**
     * @param name       limiter name, used in log lines
     * @param maxTokens  bucket capacity
     * @param refillRate tokens added per second
     */
    public TokenBucketRateLimiter(String name, int maxTokens, double refillRate) {
        this(name, maxTokens, refillRate, System::currentTimeMillis, Sleeper.THREAD);
    }

    TokenBucketRateLimiter(String name, int maxTokens, double refillRate, LongSupplier clock, Sleeper sleeper) {
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive: " + maxTokens);
        }
        if (!(refillRate > 0)) {
            throw new IllegalArgumentException("refillRate must be positive: " + refillRate);
        }
        this.name = name;
        this.maxTokens = maxTokens;
        this.refillRate = refillRate;
        this.clock = clock;
        this.sleeper = sleeper;
        this.tokens = maxTokens;
        this.lastRefillMillis = clock.getAsLong();
    }

    public boolean tryConsume() {
        return tryConsume(1);
    }

    public synchronized boolean tryConsume(int count) {
        requirePositive(count);
        refill();
        if (tokens >= count) {
            tokens -= count;
            return true;
        }
        log.debug("Rate limiter [{}] rejected (requested: {}, available: {})",
                name, count, String.format("%.2f", tokens));
        return false;
    }

    /**
     * Waits until {@code count} tokens are available and takes them, polling every 100ms.
     *
     * @throws RateLimitTimeoutException when more than {@code maxWaitMillis} elapse without success
     */
    public void consume(int count, long maxWaitMillis) {
        requirePositive(count);
        long start = clock.getAsLong();
        while (!tryConsume(count)) {
            long waited = clock.getAsLong() - start;
            if (waited > maxWaitMillis) {
                log.warn("Rate limiter [{}] gave up after {}ms (budget: {}ms)", name, waited, maxWaitMillis);
                throw new RateLimitTimeoutException(name, waited);
            }
            try {
                sleeper.sleep(POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RateLimitTimeoutException(name, clock.getAsLong() - start);
            }
        }
    }

    public void consume(int count) {
        consume(count, DEFAULT_MAX_WAIT_MS);
    }

    /**
     * @return whole tokens currently available
     */
    public synchronized int availableTokens() {
        refill();
        return (int) Math.floor(tokens);
    }

    /**
     * @return milliseconds until at least one whole token is available, 0 when one already is
     */
    public synchronized long timeUntilNextToken() {
        refill();
        if (tokens >= 1) {
            return 0;
        }
        return (long) Math.ceil((1 - tokens) / refillRate * 1000);
    }

    public synchronized void reset() {
        tokens = maxTokens;
        lastRefillMillis = clock.getAsLong();
        log.info("Rate limiter [{}] reset", name);
    }

    private void refill() {
        long now = clock.getAsLong();
        long elapsed = now - lastRefillMillis;
        if (elapsed > 0) {
            tokens = Math.min(maxTokens, tokens + elapsed / 1000.0 * refillRate);
        }
        lastRefillMillis = now;
    }

    private static void requirePositive(int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("Token count must be positive: " + count);
        }
    }
}
