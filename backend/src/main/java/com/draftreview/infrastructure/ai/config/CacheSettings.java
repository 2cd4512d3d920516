package com.draftreview.infrastructure.ai.config;

import java.time.Duration;

/**
 * Response cache tuning.
 *
 * @param enabled      whether responses are cached at all
 * @param ttl          time to live after write
 * @param maxSizeBytes upper bound on the summed size of cached payloads
 */
public record CacheSettings(boolean enabled, Duration ttl, long maxSizeBytes) {

    public static final Duration DEFAULT_TTL = Duration.ofHours(1);
    public static final long DEFAULT_MAX_SIZE_BYTES = 100L * 1024 * 1024;

    public CacheSettings {
        ttl = ttl != null ? ttl : DEFAULT_TTL;
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Cache ttl must be positive: " + ttl);
        }
        if (maxSizeBytes <= 0) {
            throw new IllegalArgumentException("Cache max size must be positive: " + maxSizeBytes);
        }
    }

    public static CacheSettings defaults() {
        return new CacheSettings(true, DEFAULT_TTL, DEFAULT_MAX_SIZE_BYTES);
    }

    public static CacheSettings disabled() {
        return new CacheSettings(false, DEFAULT_TTL, DEFAULT_MAX_SIZE_BYTES);
    }
}
