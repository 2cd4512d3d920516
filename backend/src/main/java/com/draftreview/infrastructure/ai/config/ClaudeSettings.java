package com.draftreview.infrastructure.ai.config;

import java.util.Map;

/**
 * Anthropic Claude via the Messages API.
 */
public record ClaudeSettings(String model) implements ProviderSettings {

    public static final String PROVIDER_KEY = "claude";
    public static final String DEFAULT_MODEL = "claude-3-sonnet";

    private static final Map<String, String> MODEL_ALIASES = Map.of(
            "claude-3-opus", "claude-3-opus-20240229",
            "claude-3-sonnet", "claude-3-sonnet-20240229",
            "claude-3-haiku", "claude-3-haiku-20240307"
    );

    public ClaudeSettings {
        model = model == null || model.isBlank() ? DEFAULT_MODEL : model.trim();
    }

    @Override
    public String providerKey() {
        return PROVIDER_KEY;
    }

    /**
     * Full model id sent to the API; short aliases expand to their dated ids.
     */
    public String resolvedModel() {
        return MODEL_ALIASES.getOrDefault(model, model);
    }
}
