package com.draftreview.infrastructure.ai.config;

/**
 * OpenAI or an OpenAI-compatible service.
 *
 * @param model   model id, defaults to {@value #DEFAULT_MODEL}
 * @param baseUrl optional endpoint override for compatible services (nullable)
 */
public record OpenAiSettings(String model, String baseUrl) implements ProviderSettings {

    public static final String PROVIDER_KEY = "openai";
    public static final String DEFAULT_MODEL = "gpt-4";

    public OpenAiSettings {
        model = model == null || model.isBlank() ? DEFAULT_MODEL : model.trim();
        baseUrl = baseUrl == null || baseUrl.isBlank() ? null : baseUrl.trim();
    }

    @Override
    public String providerKey() {
        return PROVIDER_KEY;
    }
}
