package com.draftreview.infrastructure.ai;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Maps transport-level failures onto {@link BackendErrorCode}s. Shared by all adapters so that
 * the retry decision does not depend on which client library raised the error.
 */
public final class BackendFailures {

    private BackendFailures() {
    }

    /**
     * @param status HTTP status of the failed call, null when no response was received
     * @param cause  the underlying failure
     */
    public static ReviewBackendException classify(Integer status, Throwable cause) {
        if (cause instanceof ReviewBackendException classified) {
            return classified;
        }
        String detail = cause != null && cause.getMessage() != null ? cause.getMessage() : "no detail";
        if (status == null) {
            if (hasIoCause(cause)) {
                return new ReviewBackendException(BackendErrorCode.NETWORK_ERROR,
                        "Network error: unable to reach backend (" + detail + ")", null, cause);
            }
            return new ReviewBackendException(BackendErrorCode.UNKNOWN, "Backend call failed: " + detail, null, cause);
        }
        if (status == 401 || status == 403) {
            return new ReviewBackendException(BackendErrorCode.INVALID_CREDENTIAL, "Invalid API key", status, cause);
        }
        if (status == 429) {
            return new ReviewBackendException(BackendErrorCode.RATE_LIMITED, "Rate limit exceeded", status, cause);
        }
        if (status == 408 || status >= 500) {
            return new ReviewBackendException(BackendErrorCode.SERVICE_UNAVAILABLE,
                    "Backend service unavailable (HTTP " + status + ")", status, cause);
        }
        if (status >= 400) {
            return new ReviewBackendException(BackendErrorCode.CLIENT_ERROR,
                    "Backend rejected the request (HTTP " + status + "): " + detail, status, cause);
        }
        return new ReviewBackendException(BackendErrorCode.UNKNOWN,
                "Unexpected backend response (HTTP " + status + ")", status, cause);
    }

    private static boolean hasIoCause(Throwable failure) {
        Throwable current = failure;
        while (current != null) {
            if (current instanceof IOException || current instanceof UncheckedIOException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
