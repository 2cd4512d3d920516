package com.draftreview.infrastructure.ai;

import com.draftreview.domain.review.model.TokenUsage;
import com.draftreview.infrastructure.ai.config.OpenAiSettings;
import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.errors.OpenAIIoException;
import com.openai.errors.OpenAIServiceException;
import com.openai.models.ResponseFormatJsonObject;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Set;

/**
 * OpenAI chat completions, or any OpenAI-compatible service when a base URL is configured.
 * The SDK's own retries are disabled; {@link AbstractReviewBackend} owns the retry policy.
 */
@Slf4j
public class OpenAiReviewBackend extends AbstractReviewBackend {

    static final double TEMPERATURE = 0.3;

    private static final Set<String> LOCAL_HOSTS = Set.of("localhost", "127.0.0.1", "::1", "[::1]");

    private final OpenAIClient client;
    private final OpenAiSettings settings;

    public OpenAiReviewBackend(String apiKey, OpenAiSettings settings, Duration timeout, BackendSupport support) {
        this(buildClient(apiKey, settings, timeout), settings, support);
    }

    OpenAiReviewBackend(OpenAIClient client, OpenAiSettings settings, BackendSupport support) {
        super(support);
        this.client = client;
        this.settings = settings;
    }

    private static OpenAIClient buildClient(String apiKey, OpenAiSettings settings, Duration timeout) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ReviewBackendException(BackendErrorCode.INVALID_CONFIGURATION, "OpenAI API key is required");
        }
        var builder = OpenAIOkHttpClient.builder()
                .apiKey(apiKey)
                .timeout(timeout)
                .maxRetries(0);
        if (settings.baseUrl() != null) {
            String baseUrl = normalizeBaseUrl(settings.baseUrl());
            log.info("[OpenAiReviewBackend] Using OpenAI-compatible endpoint: {}", baseUrl);
            builder.baseUrl(baseUrl);
        }
        return builder.build();
    }

    /**
     * Validates a base URL override and appends the {@code /v1} path compatible services expect.
     * Plain HTTP is only accepted for loopback hosts.
     *
     * @throws ReviewBackendException with {@link BackendErrorCode#INVALID_CONFIGURATION}
     */
    static String normalizeBaseUrl(String baseUrl) {
        URI uri;
        try {
            uri = new URI(baseUrl);
        } catch (URISyntaxException e) {
            throw new ReviewBackendException(BackendErrorCode.INVALID_CONFIGURATION,
                    "Invalid base URL format: " + baseUrl, e);
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            throw new ReviewBackendException(BackendErrorCode.INVALID_CONFIGURATION,
                    "Invalid base URL format: " + baseUrl);
        }
        boolean local = LOCAL_HOSTS.contains(uri.getHost());
        if (!"https".equalsIgnoreCase(uri.getScheme()) && !local) {
            throw new ReviewBackendException(BackendErrorCode.INVALID_CONFIGURATION,
                    "Base URL must use HTTPS to protect API keys (HTTP is only allowed for localhost): " + baseUrl);
        }
        String trimmed = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return trimmed.endsWith("/v1") ? trimmed : trimmed + "/v1";
    }

    @Override
    public String providerKey() {
        return settings.providerKey();
    }

    @Override
    public String modelId() {
        return settings.model();
    }

    @Override
    protected Completion complete(String systemPrompt, String userPrompt) {
        ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
                .model(settings.model())
                .temperature(TEMPERATURE)
                .addSystemMessage(systemPrompt)
                .addUserMessage(userPrompt)
                .responseFormat(ResponseFormatJsonObject.builder().build())
                .build();

        ChatCompletion completion = client.chat().completions().create(params);

        TokenUsage usage = completion.usage()
                .map(u -> new TokenUsage(u.promptTokens(), u.completionTokens()))
                .orElse(TokenUsage.ZERO);

        String content = completion.choices().stream()
                .findFirst()
                .flatMap(choice -> choice.message().content())
                .orElseThrow(() -> new ReviewBackendException(BackendErrorCode.PARSE_ERROR,
                        "OpenAI response has no content"));

        return new Completion(content, usage);
    }

    @Override
    protected ReviewBackendException translateFailure(RuntimeException failure) {
        if (failure instanceof OpenAIServiceException serviceException) {
            return BackendFailures.classify(serviceException.statusCode(), failure);
        }
        if (failure instanceof OpenAIIoException) {
            return new ReviewBackendException(BackendErrorCode.NETWORK_ERROR,
                    "Network error: unable to connect to OpenAI", null, failure);
        }
        return BackendFailures.classify(null, failure);
    }
}
