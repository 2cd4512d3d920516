package com.draftreview.interfaces.api;

import com.draftreview.application.review.exception.ReviewSessionNotFoundException;
import com.draftreview.application.review.exception.SuggestionNotFoundException;
import com.draftreview.domain.document.DocumentAccessException;
import com.draftreview.infrastructure.ai.ReviewBackendException;
import com.draftreview.infrastructure.ratelimit.RateLimitTimeoutException;
import com.draftreview.interfaces.api.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ReviewSessionNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleReviewNotFound(ReviewSessionNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("REVIEW_NOT_FOUND", e.getMessage()));
    }

    @ExceptionHandler(SuggestionNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSuggestionNotFound(SuggestionNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("SUGGESTION_NOT_FOUND", e.getMessage()));
    }

    @ExceptionHandler(DocumentAccessException.class)
    public ResponseEntity<ErrorResponse> handleDocumentAccess(DocumentAccessException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("DOCUMENT_ACCESS_ERROR", e.getMessage()));
    }

    @ExceptionHandler(RateLimitTimeoutException.class)
    public ResponseEntity<ErrorResponse> handleRateLimitTimeout(RateLimitTimeoutException e) {
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .body(new ErrorResponse("RATE_LIMIT_TIMEOUT", e.getMessage()));
    }

    @ExceptionHandler(ReviewBackendException.class)
    public ResponseEntity<ErrorResponse> handleBackend(ReviewBackendException e) {
        log.warn("[GlobalExceptionHandler] Backend failure - code: {}, message: {}", e.getCode(), e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse(e.getCode().name(), e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_ARGUMENT", e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("MALFORMED_REQUEST", "Request body could not be read"));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(error -> error.getDefaultMessage())
                .orElse("Invalid request");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("VALIDATION_ERROR", message));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("[GlobalExceptionHandler] Unhandled exception", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("INTERNAL_ERROR", "Internal server error. Please try again later."));
    }
}
