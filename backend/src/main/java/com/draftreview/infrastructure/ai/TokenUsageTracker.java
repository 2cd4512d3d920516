package com.draftreview.infrastructure.ai;

import com.draftreview.domain.review.model.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

@Slf4j
@Component
public class TokenUsageTracker {

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong cacheHitRequests = new AtomicLong();
    private final AtomicLong totalPromptTokens = new AtomicLong();
    private final AtomicLong totalCompletionTokens = new AtomicLong();

    public void recordUsage(String providerKey, String operation, TokenUsage usage) {
        totalRequests.incrementAndGet();
        totalPromptTokens.addAndGet(usage.promptTokens());
        totalCompletionTokens.addAndGet(usage.completionTokens());

        log.info("Token usage - provider: {}, operation: {}, prompt: {}, completion: {}, total: {}, " +
                        "cumulative: requests={}, promptTokens={}, completionTokens={}",
                providerKey, operation, usage.promptTokens(), usage.completionTokens(), usage.totalTokens(),
                totalRequests.get(), totalPromptTokens.get(), totalCompletionTokens.get());
    }

    public void recordCacheHit(String providerKey, String operation) {
        totalRequests.incrementAndGet();
        cacheHitRequests.incrementAndGet();
        log.info("Response cache hit - provider: {}, operation: {}, cacheHitRate={}%",
                providerKey, operation, String.format("%.1f", getCacheHitRate()));
    }

    public double getCacheHitRate() {
        long total = totalRequests.get();
        return total > 0 ? (double) cacheHitRequests.get() / total * 100 : 0;
    }

    public long getTotalRequests() {
        return totalRequests.get();
    }

    public long getTotalTokens() {
        return totalPromptTokens.get() + totalCompletionTokens.get();
    }
}
