package com.draftreview.infrastructure.ratelimit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One {@link TokenBucketRateLimiter} per provider key, created on first use and reused afterwards.
 */
@Slf4j
@Component
public class RateLimiterRegistry {

    public static final int DEFAULT_MAX_TOKENS = 10;
    public static final double DEFAULT_REFILL_RATE = 1.0;

    private final Map<String, TokenBucketRateLimiter> limiters = new ConcurrentHashMap<>();

    public TokenBucketRateLimiter getOrCreate(String providerKey) {
        return getOrCreate(providerKey, DEFAULT_MAX_TOKENS, DEFAULT_REFILL_RATE);
    }

    /**
     * Capacity and rate only apply when the limiter does not exist yet.
     */
    public TokenBucketRateLimiter getOrCreate(String providerKey, int maxTokens, double refillRate) {
        return limiters.computeIfAbsent(providerKey, key -> {
            log.info("[RateLimiterRegistry] Creating limiter - provider: {}, maxTokens: {}, refillRate: {}/s",
                    key, maxTokens, refillRate);
            return new TokenBucketRateLimiter(key, maxTokens, refillRate);
        });
    }

    public void resetAll() {
        limiters.values().forEach(TokenBucketRateLimiter::reset);
    }

    public void clearAll() {
        limiters.clear();
    }

    public int size() {
        return limiters.size();
    }
}
