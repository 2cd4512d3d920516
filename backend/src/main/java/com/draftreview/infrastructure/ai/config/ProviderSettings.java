package com.draftreview.infrastructure.ai.config;

/**
 * Configuration of one backend provider family. The set of providers is closed.
 */
public sealed interface ProviderSettings permits OpenAiSettings, ClaudeSettings {

    /**
     * Key used for the credential lookup and the rate limiter.
     */
    String providerKey();

    String model();
}
