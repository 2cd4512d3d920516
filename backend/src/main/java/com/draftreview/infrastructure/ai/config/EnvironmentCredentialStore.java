package com.draftreview.infrastructure.ai.config;

import com.draftreview.domain.review.service.CredentialStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Reads API keys from {@code credentials.<provider>.api-key}. For OpenAI the plain
 * {@code API_KEY} variable is accepted as a development fallback.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EnvironmentCredentialStore implements CredentialStore {

    static final String LEGACY_OPENAI_VARIABLE = "API_KEY";

    private final Environment environment;

    @Override
    public Optional<String> get(String providerKey) {
        Optional<String> stored = nonBlank(environment.getProperty("credentials." + providerKey + ".api-key"));
        if (stored.isPresent() || !OpenAiSettings.PROVIDER_KEY.equals(providerKey)) {
            return stored;
        }
        Optional<String> legacy = nonBlank(environment.getProperty(LEGACY_OPENAI_VARIABLE));
        legacy.ifPresent(key -> log.warn("[CredentialStore] Using {} environment variable for openai ({}); " +
                "configure credentials.openai.api-key instead", LEGACY_OPENAI_VARIABLE, mask(key)));
        return legacy;
    }

    /**
     * Masks an API key for logging, keeping the first 7 and last 4 characters.
     */
    public static String mask(String key) {
        if (key == null || key.length() < 12) {
            return "***";
        }
        return key.substring(0, 7) + "..." + key.substring(key.length() - 4);
    }

    private static Optional<String> nonBlank(String value) {
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }
}
