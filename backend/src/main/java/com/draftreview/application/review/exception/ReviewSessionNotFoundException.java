package com.draftreview.application.review.exception;

public class ReviewSessionNotFoundException extends RuntimeException {

    public ReviewSessionNotFoundException(String reviewId) {
        super("Review not found or expired: " + reviewId);
    }
}
