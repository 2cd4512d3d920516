package com.draftreview.infrastructure.ai;

import com.draftreview.domain.review.model.TokenUsage;
import com.draftreview.infrastructure.ai.config.ClaudeSettings;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.util.List;
import java.util.Map;

/**
 * Anthropic Messages API over {@link RestClient}.
 */
@Slf4j
public class ClaudeReviewBackend extends AbstractReviewBackend {

    static final String BASE_URL = "https://api.anthropic.com";
    static final String MESSAGES_PATH = "/v1/messages";
    static final String API_VERSION = "2023-06-01";

    private final RestClient restClient;
    private final ClaudeSettings settings;
    private final int maxOutputTokens;

    /**
     * @param restClientBuilder builder carrying the HTTP request factory (timeouts, or a mock server in tests)
     */
    public ClaudeReviewBackend(String apiKey, ClaudeSettings settings, int maxOutputTokens,
                               RestClient.Builder restClientBuilder, BackendSupport support) {
        super(support);
        if (apiKey == null || apiKey.isBlank()) {
            throw new ReviewBackendException(BackendErrorCode.INVALID_CONFIGURATION, "Claude API key is required");
        }
        this.settings = settings;
        this.maxOutputTokens = maxOutputTokens;
        this.restClient = restClientBuilder
                .baseUrl(BASE_URL)
                .defaultHeader("x-api-key", apiKey)
                .defaultHeader("anthropic-version", API_VERSION)
                .build();
        log.info("[ClaudeReviewBackend] Initialized - model: {}", settings.resolvedModel());
    }

    @Override
    public String providerKey() {
        return settings.providerKey();
    }

    @Override
    public String modelId() {
        return settings.resolvedModel();
    }

    @Override
    protected Completion complete(String systemPrompt, String userPrompt) {
        Map<String, Object> request = Map.of(
                "model", settings.resolvedModel(),
                "max_tokens", maxOutputTokens,
                "temperature", OpenAiReviewBackend.TEMPERATURE,
                "system", systemPrompt,
                "messages", List.of(Map.of("role", "user", "content", userPrompt))
        );

        JsonNode response = restClient.post()
                .uri(MESSAGES_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(JsonNode.class);

        if (response == null) {
            throw new ReviewBackendException(BackendErrorCode.PARSE_ERROR, "Claude response has no body");
        }

        StringBuilder content = new StringBuilder();
        for (JsonNode block : response.path("content")) {
            if ("text".equals(block.path("type").asText())) {
                content.append(block.path("text").asText(""));
            }
        }
        if (content.length() == 0) {
            throw new ReviewBackendException(BackendErrorCode.PARSE_ERROR, "Claude response has no text content");
        }

        JsonNode usage = response.path("usage");
        TokenUsage tokenUsage = new TokenUsage(
                usage.path("input_tokens").asLong(0),
                usage.path("output_tokens").asLong(0));

        return new Completion(content.toString(), tokenUsage);
    }

    @Override
    protected ReviewBackendException translateFailure(RuntimeException failure) {
        if (failure instanceof RestClientResponseException responseException) {
            return BackendFailures.classify(responseException.getStatusCode().value(), failure);
        }
        if (failure instanceof ResourceAccessException) {
            return new ReviewBackendException(BackendErrorCode.NETWORK_ERROR,
                    "Network error: unable to connect to Claude", null, failure);
        }
        return BackendFailures.classify(null, failure);
    }
}
