package com.draftreview.infrastructure.ai.cache;

import com.draftreview.domain.review.model.ReviewContext;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Builds deterministic SHA-256 cache keys from a backend operation and its inputs.
 */
@Component
public class CacheKeyBuilder {

    /**
     * @param operation operation name, e.g. {@code text-review}
     * @param modelId   model the response would come from
     * @param content   text or diff sent to the backend
     * @param context   review context (nullable)
     * @return hex-encoded SHA-256 hash
     */
    public String buildKey(String operation, String modelId, String content, ReviewContext context) {
        String raw = operation + "|"
                + modelId + "|"
                + (context != null && context.filePath() != null ? context.filePath() : "") + "|"
                + (context != null ? context.documentType().name() : "") + "|"
                + (context != null ? context.writingStyle().name() : "") + "|"
                + (content != null ? content : "");

        return sha256(raw);
    }

    private String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
