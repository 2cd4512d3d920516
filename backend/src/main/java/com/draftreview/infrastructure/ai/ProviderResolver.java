package com.draftreview.infrastructure.ai;

import com.draftreview.domain.review.service.CredentialStore;
import com.draftreview.infrastructure.ai.cache.CacheKeyBuilder;
import com.draftreview.infrastructure.ai.cache.ResponseCache;
import com.draftreview.infrastructure.ai.config.BackendProperties;
import com.draftreview.infrastructure.ai.config.CacheSettings;
import com.draftreview.infrastructure.ai.config.ClaudeSettings;
import com.draftreview.infrastructure.ai.config.OpenAiSettings;
import com.draftreview.infrastructure.ai.config.ProviderSettings;
import com.draftreview.infrastructure.ai.config.RetrySettings;
import com.draftreview.infrastructure.ratelimit.RateLimiterRegistry;
import com.draftreview.infrastructure.ratelimit.Sleeper;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.Optional;

/**
 * Builds the backend adapter for the configured provider. Each call to {@link #resolve()} constructs
 * a new adapter; the caller owns it. Missing credentials and construction failures are returned as
 * values, never thrown.
 */
@Component
@RequiredArgsConstructor
public class ProviderResolver {

    private final BackendProperties properties;
    private final CredentialStore credentialStore;
    private final RateLimiterRegistry rateLimiterRegistry;
    private final CacheKeyBuilder cacheKeyBuilder;
    private final ReviewPromptBuilder promptBuilder;
    private final TokenUsageTracker usageTracker;
    private final ObjectMapper objectMapper;

    public ProviderResolution resolve() {
        Optional<ProviderSettings> configured;
        try {
            configured = properties.toProviderSettings();
        } catch (IllegalStateException e) {
            return new ProviderResolution.Failed(
                    new ReviewBackendException(BackendErrorCode.INVALID_CONFIGURATION, e.getMessage(), e));
        }
        if (configured.isEmpty()) {
            return new ProviderResolution.Disabled();
        }

        ProviderSettings settings = configured.get();
        Optional<String> credential;
        try {
            credential = credentialStore.get(settings.providerKey());
        } catch (RuntimeException e) {
            return new ProviderResolution.Failed(new ReviewBackendException(BackendErrorCode.INVALID_CONFIGURATION,
                    "Credential lookup failed for " + settings.providerKey() + ": " + e.getMessage(), e));
        }
        if (credential.isEmpty()) {
            return new ProviderResolution.CredentialMissing(settings.providerKey());
        }

        try {
            return new ProviderResolution.Ready(createBackend(settings, credential.get()));
        } catch (ReviewBackendException e) {
            return new ProviderResolution.Failed(e);
        } catch (RuntimeException e) {
            return new ProviderResolution.Failed(
                    new ReviewBackendException(BackendErrorCode.INVALID_CONFIGURATION, e.getMessage(), e));
        }
    }

    private AbstractReviewBackend createBackend(ProviderSettings settings, String apiKey) {
        BackendSupport support = supportFor(settings.providerKey());
        if (settings instanceof OpenAiSettings openAi) {
            return new OpenAiReviewBackend(apiKey, openAi, properties.getTimeout(), support);
        }
        if (settings instanceof ClaudeSettings claude) {
            SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
            requestFactory.setConnectTimeout(properties.getTimeout());
            requestFactory.setReadTimeout(properties.getTimeout());
            return new ClaudeReviewBackend(apiKey, claude, properties.getMaxOutputTokens(),
                    RestClient.builder().requestFactory(requestFactory), support);
        }
        throw new IllegalStateException("Unsupported provider settings: " + settings.getClass().getSimpleName());
    }

    private BackendSupport supportFor(String providerKey) {
        RetrySettings retry = properties.toRetrySettings();
        CacheSettings cacheSettings = properties.toCacheSettings();
        ResponseCache cache = cacheSettings.enabled() ? new ResponseCache(cacheSettings, objectMapper) : null;
        return new BackendSupport(
                retry,
                rateLimiterRegistry.getOrCreate(providerKey, retry.limiterMaxTokens(), retry.limiterRefillRate()),
                cache,
                cacheKeyBuilder,
                promptBuilder,
                usageTracker,
                objectMapper,
                Sleeper.THREAD);
    }
}
