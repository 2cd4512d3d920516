package com.draftreview.domain.review.model;

/**
 * Token counts reported by a backend for one call.
 */
public record TokenUsage(long promptTokens, long completionTokens) {

    public static final TokenUsage ZERO = new TokenUsage(0, 0);

    public long totalTokens() {
        return promptTokens + completionTokens;
    }
}
