package com.draftreview.domain.review.model;

/**
 * Parsed backend payload plus call metadata.
 *
 * @param data       parsed payload
 * @param modelId    model that produced it
 * @param tokenUsage token counts, {@link TokenUsage#ZERO} on a cache hit
 * @param cached     whether the payload came from the response cache
 */
public record BackendResponse<T>(T data, String modelId, TokenUsage tokenUsage, boolean cached) {

    public BackendResponse {
        tokenUsage = tokenUsage != null ? tokenUsage : TokenUsage.ZERO;
    }
}
