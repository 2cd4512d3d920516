package com.draftreview.infrastructure.ai;

import com.draftreview.domain.review.model.BackendResponse;
import com.draftreview.domain.review.model.ConsistencyReport;
import com.draftreview.domain.review.model.DiffAnalysis;
import com.draftreview.domain.review.model.RawCritique;
import com.draftreview.domain.review.model.ReviewContext;
import com.draftreview.domain.review.model.SemanticChange;
import com.draftreview.domain.review.model.TokenUsage;
import com.draftreview.domain.review.service.ReviewBackend;
import com.draftreview.infrastructure.ratelimit.RateLimitTimeoutException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Retry, admission control, caching and payload parsing shared by all backend adapters.
 * Subclasses only perform a single chat completion and translate their client's exceptions.
 */
@Slf4j
public abstract class AbstractReviewBackend implements ReviewBackend {

    static final int MAX_PAYLOAD_CHARS = 10 * 1024 * 1024;
    static final String NO_NOTABLE_CHANGE = "无明显变化";

    private static final String OP_TEXT_REVIEW = "text-review";
    private static final String OP_DIFF_ANALYSIS = "diff-analysis";

    private static final Pattern LEADING_FENCE = Pattern.compile("^```(?:json)?\\s*\\n?", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_FENCE = Pattern.compile("\\n?```\\s*$");

    protected final BackendSupport support;

    protected AbstractReviewBackend(BackendSupport support) {
        this.support = support;
    }

    /**
     * Raw completion text plus the usage the backend reported for it.
     */
    protected record Completion(String content, TokenUsage usage) {
    }

    /**
     * Performs exactly one call to the backend. Retrying is handled by the caller.
     */
    protected abstract Completion complete(String systemPrompt, String userPrompt);

    /**
     * Translates a client-specific failure into a classified backend exception.
     */
    protected ReviewBackendException translateFailure(RuntimeException failure) {
        return BackendFailures.classify(null, failure);
    }

    @Override
    public BackendResponse<RawCritique> reviewText(String text, ReviewContext context) {
        String key = support.cacheKeyBuilder().buildKey(OP_TEXT_REVIEW, modelId(), text, context);
        return cached(OP_TEXT_REVIEW, key, RawCritique.class, () -> {
            String prompt = support.promptBuilder().buildTextReviewPrompt(text, context);
            Completion completion = callWithRetry(prompt, OP_TEXT_REVIEW);
            JsonNode payload = readPayload(completion.content(), OP_TEXT_REVIEW);
            try {
                RawCritique critique = support.objectMapper().treeToValue(payload, RawCritique.class);
                return new BackendResponse<>(critique, modelId(), completion.usage(), false);
            } catch (JsonProcessingException e) {
                throw new ReviewBackendException(BackendErrorCode.PARSE_ERROR,
                        "Failed to parse text review response", e);
            }
        });
    }

    @Override
    public BackendResponse<DiffAnalysis> analyzeDiff(String diff, ReviewContext context) {
        String key = support.cacheKeyBuilder().buildKey(OP_DIFF_ANALYSIS, modelId(), diff, context);
        return cached(OP_DIFF_ANALYSIS, key, DiffAnalysis.class, () -> {
            String prompt = support.promptBuilder().buildDiffAnalysisPrompt(diff, context);
            Completion completion = callWithRetry(prompt, OP_DIFF_ANALYSIS);
            JsonNode payload = readPayload(completion.content(), OP_DIFF_ANALYSIS);
            return new BackendResponse<>(toDiffAnalysis(payload, diff), modelId(), completion.usage(), false);
        });
    }

    private <T> BackendResponse<T> cached(String operation, String key, Class<T> type,
                                          Supplier<BackendResponse<T>> call) {
        if (support.responseCache() != null) {
            var hit = support.responseCache().get(key, type);
            if (hit.isPresent()) {
                support.usageTracker().recordCacheHit(providerKey(), operation);
                return new BackendResponse<>(hit.get(), modelId(), TokenUsage.ZERO, true);
            }
        }
        BackendResponse<T> response = call.get();
        support.usageTracker().recordUsage(providerKey(), operation, response.tokenUsage());
        if (support.responseCache() != null) {
            support.responseCache().put(key, response.data());
        }
        return response;
    }

    /**
     * Calls the backend with admission control and bounded exponential backoff.
     * Only failures whose code is retryable are attempted again.
     */
    Completion callWithRetry(String userPrompt, String operation) {
        int maxAttempts = support.retry().maxAttempts();
        ReviewBackendException lastFailure = null;

        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            acquirePermit();
            try {
                return complete(support.promptBuilder().getSystemPrompt(), userPrompt);
            } catch (RuntimeException e) {
                ReviewBackendException failure = e instanceof ReviewBackendException classified
                        ? classified
                        : translateFailure(e);
                if (!failure.isRetryable()) {
                    log.warn("[{}] {} failed without retry - code: {}, message: {}",
                            providerKey(), operation, failure.getCode(), failure.getMessage());
                    throw failure;
                }
                lastFailure = failure;
                log.warn("[{}] {} attempt {}/{} failed - code: {}, message: {}",
                        providerKey(), operation, attempt + 1, maxAttempts, failure.getCode(), failure.getMessage());
                if (attempt < maxAttempts - 1) {
                    pause(support.retry().backoffMillis(attempt));
                }
            }
        }

        throw new ReviewBackendException(BackendErrorCode.MAX_RETRIES_EXCEEDED,
                "Failed after " + maxAttempts + " attempts",
                lastFailure != null ? lastFailure.getStatusCode() : null, lastFailure);
    }

    private void acquirePermit() {
        try {
            support.rateLimiter().consume(1, support.retry().rateLimitMaxWait().toMillis());
        } catch (RateLimitTimeoutException e) {
            throw new ReviewBackendException(BackendErrorCode.RATE_LIMIT_TIMEOUT, e.getMessage(), e);
        }
    }

    private void pause(long millis) {
        try {
            support.sleeper().sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReviewBackendException(BackendErrorCode.UNKNOWN, "Interrupted while backing off", e);
        }
    }

    /**
     * Strips Markdown code fences and parses the payload, which must be a JSON object.
     */
    JsonNode readPayload(String content, String operation) {
        if (content == null || content.isBlank()) {
            throw new ReviewBackendException(BackendErrorCode.PARSE_ERROR, "Empty " + operation + " response");
        }
        String cleaned = stripCodeFences(content);
        if (cleaned.length() > MAX_PAYLOAD_CHARS) {
            throw new ReviewBackendException(BackendErrorCode.PARSE_ERROR,
                    operation + " response exceeds " + MAX_PAYLOAD_CHARS + " characters");
        }
        JsonNode node;
        try {
            node = support.objectMapper().readTree(cleaned);
        } catch (JsonProcessingException e) {
            throw new ReviewBackendException(BackendErrorCode.PARSE_ERROR,
                    "Failed to parse " + operation + " response", e);
        }
        if (node == null || !node.isObject()) {
            throw new ReviewBackendException(BackendErrorCode.PARSE_ERROR,
                    operation + " response is not a JSON object");
        }
        return node;
    }

    static String stripCodeFences(String content) {
        String cleaned = content.trim();
        cleaned = LEADING_FENCE.matcher(cleaned).replaceFirst("");
        cleaned = TRAILING_FENCE.matcher(cleaned).replaceFirst("");
        return cleaned.trim();
    }

    /**
     * Counts come from the diff text itself; the backend only contributes the semantic part.
     */
    static DiffAnalysis toDiffAnalysis(JsonNode payload, String diff) {
        int additions = 0;
        int deletions = 0;
        for (String line : diff.split("\r?\n")) {
            if (line.startsWith("+") && !line.startsWith("+++")) {
                additions++;
            } else if (line.startsWith("-") && !line.startsWith("---")) {
                deletions++;
            }
        }

        String summary = payload.path("summary").asText("");
        if (summary.isBlank()) {
            summary = NO_NOTABLE_CHANGE;
        }

        List<SemanticChange> changes = new ArrayList<>();
        for (JsonNode change : payload.path("semanticChanges")) {
            changes.add(new SemanticChange(
                    changeType(change.path("type").asText("")),
                    change.path("description").asText(""),
                    Math.max(0, change.path("lineNumber").asInt(0)),
                    change.path("confidence").asDouble(0.0)));
        }

        JsonNode report = payload.path("consistencyReport");
        ConsistencyReport consistency = report.isObject()
                ? new ConsistencyReport(report.path("score").asInt(ConsistencyReport.DEFAULT_SCORE),
                        textList(report.path("issues")), textList(report.path("suggestions")))
                : ConsistencyReport.defaultReport();

        return new DiffAnalysis(summary, additions, deletions, Math.min(additions, deletions), changes, consistency);
    }

    private static SemanticChange.ChangeType changeType(String value) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "addition" -> SemanticChange.ChangeType.ADDITION;
            case "deletion" -> SemanticChange.ChangeType.DELETION;
            default -> SemanticChange.ChangeType.MODIFICATION;
        };
    }

    private static List<String> textList(JsonNode array) {
        List<String> values = new ArrayList<>();
        for (JsonNode item : array) {
            if (item.isTextual() && !item.asText().isBlank()) {
                values.add(item.asText());
            }
        }
        return values;
    }
}
