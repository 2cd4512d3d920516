package com.draftreview.infrastructure.ratelimit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimiterRegistryTest {

    private final RateLimiterRegistry registry = new RateLimiterRegistry();

    @Test
    @DisplayName("같은 키 → 같은 리미터")
    void getOrCreate_reuses_limiter() {
        TokenBucketRateLimiter first = registry.getOrCreate("openai", 5, 2.0);
        TokenBucketRateLimiter second = registry.getOrCreate("openai", 99, 9.0);

        assertThat(second).isSameAs(first);
        assertThat(second.getMaxTokens()).isEqualTo(5);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("기본 리미터: 10 토큰, 초당 1 토큰")
    void getOrCreate_defaults() {
        TokenBucketRateLimiter limiter = registry.getOrCreate("claude");

        assertThat(limiter.getMaxTokens()).isEqualTo(10);
        assertThat(limiter.getRefillRate()).isEqualTo(1.0);
        assertThat(limiter.getName()).isEqualTo("claude");
    }

    @Test
    @DisplayName("resetAll은 재충전, clearAll은 리미터 제거")
    void resetAll_and_clearAll() {
        TokenBucketRateLimiter limiter = registry.getOrCreate("openai", 2, 0.001);
        limiter.tryConsume(2);

        registry.resetAll();
        assertThat(limiter.availableTokens()).isEqualTo(2);

        registry.clearAll();
        assertThat(registry.size()).isZero();
        assertThat(registry.getOrCreate("openai", 2, 0.001)).isNotSameAs(limiter);
    }
}
