package com.draftreview.domain.document;

public class DocumentAccessException extends RuntimeException {

    public DocumentAccessException(String message) {
        super(message);
    }

    public DocumentAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
