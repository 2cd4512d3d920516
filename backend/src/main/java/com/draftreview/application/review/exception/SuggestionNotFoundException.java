package com.draftreview.application.review.exception;

public class SuggestionNotFoundException extends RuntimeException {

    public SuggestionNotFoundException(String reviewId, String suggestionId) {
        super("Suggestion " + suggestionId + " does not belong to review " + reviewId);
    }
}
