package com.draftreview.infrastructure.ai;

import com.draftreview.infrastructure.ai.cache.CacheKeyBuilder;
import com.draftreview.infrastructure.ai.cache.ResponseCache;
import com.draftreview.infrastructure.ai.config.RetrySettings;
import com.draftreview.infrastructure.ratelimit.Sleeper;
import com.draftreview.infrastructure.ratelimit.TokenBucketRateLimiter;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Collaborators every backend adapter needs besides its own client.
 *
 * @param responseCache null when caching is disabled
 */
public record BackendSupport(
        RetrySettings retry,
        TokenBucketRateLimiter rateLimiter,
        ResponseCache responseCache,
        CacheKeyBuilder cacheKeyBuilder,
        ReviewPromptBuilder promptBuilder,
        TokenUsageTracker usageTracker,
        ObjectMapper objectMapper,
        Sleeper sleeper
) {
}
