package com.draftreview.infrastructure.ai;

import com.draftreview.domain.review.service.CredentialStore;
import com.draftreview.infrastructure.ai.cache.CacheKeyBuilder;
import com.draftreview.infrastructure.ai.config.BackendProperties;
import com.draftreview.infrastructure.ratelimit.RateLimiterRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderResolverTest {

    private BackendProperties properties;
    private Map<String, String> credentials;
    private RateLimiterRegistry registry;
    private ProviderResolver resolver;

    @BeforeEach
    void setUp() {
        properties = new BackendProperties();
        credentials = new HashMap<>();
        registry = new RateLimiterRegistry();
        CredentialStore store = providerKey -> Optional.ofNullable(credentials.get(providerKey));
        resolver = new ProviderResolver(properties, store, registry, new CacheKeyBuilder(),
                new ReviewPromptBuilder(), new TokenUsageTracker(), new ObjectMapper());
    }

    @Test
    @DisplayName("provider none → Disabled")
    void resolve_disabled() {
        assertThat(resolver.resolve()).isInstanceOf(ProviderResolution.Disabled.class);
    }

    @Test
    @DisplayName("자격 증명 저장소 예외 → Failed(INVALID_CONFIGURATION), 예외 전파 없음")
    void resolve_credential_store_failure() {
        properties.setProvider("openai");
        CredentialStore broken = providerKey -> {
            throw new IllegalStateException("keychain locked");
        };
        ProviderResolver brokenResolver = new ProviderResolver(properties, broken, registry, new CacheKeyBuilder(),
                new ReviewPromptBuilder(), new TokenUsageTracker(), new ObjectMapper());

        ProviderResolution resolution = brokenResolver.resolve();

        assertThat(resolution).isInstanceOfSatisfying(ProviderResolution.Failed.class, failed -> {
            assertThat(failed.error().getCode()).isEqualTo(BackendErrorCode.INVALID_CONFIGURATION);
            assertThat(failed.error().getMessage()).contains("keychain locked");
        });
    }

    @Test
    @DisplayName("자격 증명 없는 프로바이더 → CredentialMissing")
    void resolve_credential_missing() {
        properties.setProvider("claude");

        ProviderResolution resolution = resolver.resolve();

        assertThat(resolution).isEqualTo(new ProviderResolution.CredentialMissing("claude"));
        assertThat(resolution.readyBackend()).isEmpty();
    }

    @Test
    @DisplayName("자격 증명 있는 OpenAI → Ready, 기본 모델 사용")
    void resolve_openai_ready() {
        properties.setProvider("OpenAI");
        credentials.put("openai", "sk-test-0123456789abcdef");

        ProviderResolution resolution = resolver.resolve();

        assertThat(resolution).isInstanceOf(ProviderResolution.Ready.class);
        assertThat(resolution.readyBackend()).get()
                .satisfies(backend -> {
                    assertThat(backend.providerKey()).isEqualTo("openai");
                    assertThat(backend.modelId()).isEqualTo("gpt-4");
                });
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Claude 모델 별칭 → 날짜 포함 id로 확장")
    void resolve_claude_ready() {
        properties.setProvider("claude");
        properties.setModel("claude-3-haiku");
        credentials.put("claude", "sk-ant-test");

        assertThat(resolver.resolve().readyBackend()).get()
                .satisfies(backend -> assertThat(backend.modelId()).isEqualTo("claude-3-haiku-20240307"));
    }

    @Test
    @DisplayName("안전하지 않은 base URL → INVALID_CONFIGURATION")
    void resolve_insecure_base_url_fails() {
        properties.setProvider("openai");
        properties.setBaseUrl("http://llm.example.com");
        credentials.put("openai", "sk-test-0123456789abcdef");

        ProviderResolution resolution = resolver.resolve();

        assertThat(resolution).isInstanceOfSatisfying(ProviderResolution.Failed.class,
                failed -> assertThat(failed.error().getCode()).isEqualTo(BackendErrorCode.INVALID_CONFIGURATION));
    }

    @Test
    @DisplayName("알 수 없는 프로바이더 → Failed")
    void resolve_unknown_provider_fails() {
        properties.setProvider("gemini");

        assertThat(resolver.resolve()).isInstanceOf(ProviderResolution.Failed.class);
    }
}
