package com.draftreview.infrastructure.ai;

import lombok.Getter;

@Getter
public class ReviewBackendException extends RuntimeException {

    private final BackendErrorCode code;
    private final Integer statusCode;

    public ReviewBackendException(BackendErrorCode code, String message) {
        this(code, message, null, null);
    }

    public ReviewBackendException(BackendErrorCode code, String message, Throwable cause) {
        this(code, message, null, cause);
    }

    public ReviewBackendException(BackendErrorCode code, String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.statusCode = statusCode;
    }

    public boolean isRetryable() {
        return code.isRetryable();
    }
}
