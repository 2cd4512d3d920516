package com.draftreview.infrastructure.ai.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Backend selection and tuning, bound from {@code review.backend}.
 * <pre>
 * review:
 *   backend:
 *     provider: openai        # openai | claude | none
 *     model: gpt-4
 *     base-url:               # OpenAI-compatible services only
 *     cache:
 *       enabled: true
 *       ttl: 1h
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "review.backend")
public class BackendProperties {

    @NotNull
    @Pattern(regexp = "(?i)openai|claude|none", message = "review.backend.provider must be one of openai, claude, none")
    private String provider = "none";

    private String model;

    private String baseUrl;

    @NotNull
    private Duration timeout = Duration.ofSeconds(60);

    @Positive
    private int maxOutputTokens = 4096;

    @Valid
    private Cache cache = new Cache();

    @Valid
    private Retry retry = new Retry();

    @Data
    public static class Cache {
        private boolean enabled = true;
        private Duration ttl = CacheSettings.DEFAULT_TTL;
        @Positive
        private long maxSizeBytes = CacheSettings.DEFAULT_MAX_SIZE_BYTES;
    }

    @Data
    public static class Retry {
        @Min(1)
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration rateLimitMaxWait = Duration.ofSeconds(30);
        @Positive
        private int limiterMaxTokens = 10;
        @Positive
        private double limiterRefillRate = 1.0;
    }

    /**
     * @return the configured provider variant, empty when the provider is {@code none}
     */
    public Optional<ProviderSettings> toProviderSettings() {
        String key = provider == null ? "none" : provider.trim().toLowerCase(Locale.ROOT);
        return switch (key) {
            case OpenAiSettings.PROVIDER_KEY -> Optional.of(new OpenAiSettings(model, baseUrl));
            case ClaudeSettings.PROVIDER_KEY -> Optional.of(new ClaudeSettings(model));
            case "none" -> Optional.empty();
            default -> throw new IllegalStateException("Unknown review backend provider: " + provider);
        };
    }

    public CacheSettings toCacheSettings() {
        return new CacheSettings(cache.isEnabled(), cache.getTtl(), cache.getMaxSizeBytes());
    }

    public RetrySettings toRetrySettings() {
        return new RetrySettings(retry.getMaxAttempts(), retry.getInitialBackoff(), retry.getRateLimitMaxWait(),
                retry.getLimiterMaxTokens(), retry.getLimiterRefillRate());
    }
}
