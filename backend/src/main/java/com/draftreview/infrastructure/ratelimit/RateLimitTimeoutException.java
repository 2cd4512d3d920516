package com.draftreview.infrastructure.ratelimit;

import lombok.Getter;

/**
 * Thrown when {@link TokenBucketRateLimiter#consume(int, long)} cannot obtain tokens within its wait budget.
 */
@Getter
public class RateLimitTimeoutException extends RuntimeException {

    private final String limiterName;
    private final long waitedMillis;

    public RateLimitTimeoutException(String limiterName, long waitedMillis) {
        super("Rate limit: maximum wait time exceeded for [" + limiterName + "] after " + waitedMillis + "ms");
        this.limiterName = limiterName;
        this.waitedMillis = waitedMillis;
    }
}
