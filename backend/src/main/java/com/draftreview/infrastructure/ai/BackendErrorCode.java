package com.draftreview.infrastructure.ai;

/**
 * Failure categories for backend calls.
 */
public enum BackendErrorCode {
    INVALID_CREDENTIAL(false),
    RATE_LIMITED(true),
    RATE_LIMIT_TIMEOUT(false),
    MAX_RETRIES_EXCEEDED(false),
    PARSE_ERROR(false),
    SERVICE_UNAVAILABLE(true),
    NETWORK_ERROR(true),
    CLIENT_ERROR(false),
    INVALID_CONFIGURATION(false),
    UNKNOWN(true);

    private final boolean retryable;

    BackendErrorCode(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
