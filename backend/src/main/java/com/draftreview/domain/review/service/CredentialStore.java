package com.draftreview.domain.review.service;

import java.util.Optional;

/**
 * Source of API credentials, keyed by provider.
 */
public interface CredentialStore {

    /**
     * @return the credential, or empty when none is stored or it is blank
     */
    Optional<String> get(String providerKey);
}
