package com.draftreview.infrastructure.ai;

import com.draftreview.domain.review.service.ReviewBackend;

import java.util.Optional;

/**
 * Outcome of resolving the configured backend. Callers decide how each outcome is reported.
 */
public sealed interface ProviderResolution {

    record Ready(ReviewBackend backend) implements ProviderResolution {
    }

    /**
     * A provider is configured but no credential is stored for it. Expected; triggers the fallback.
     */
    record CredentialMissing(String providerKey) implements ProviderResolution {
    }

    /**
     * No provider is configured.
     */
    record Disabled() implements ProviderResolution {
    }

    /**
     * The adapter could not be constructed, e.g. because its configuration is malformed.
     */
    record Failed(ReviewBackendException error) implements ProviderResolution {
    }

    default Optional<ReviewBackend> readyBackend() {
        return this instanceof Ready ready ? Optional.of(ready.backend()) : Optional.empty();
    }
}
