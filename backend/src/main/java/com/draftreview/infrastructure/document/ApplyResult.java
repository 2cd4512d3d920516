package com.draftreview.infrastructure.document;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of one apply attempt.
 *
 * @param error detail for failures, null on success
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApplyResult(boolean success, String suggestionId, String message, String error, ApplyOutcome outcome) {

    static ApplyResult applied(String suggestionId) {
        return new ApplyResult(true, suggestionId, "Suggestion applied successfully", null, ApplyOutcome.APPLIED);
    }

    /**
     * Refusal for a suggestion that already reached a terminal state; nothing is touched.
     */
    public static ApplyResult alreadyResolved(String suggestionId, SuggestionState current) {
        return new ApplyResult(false, suggestionId, "Suggestion already resolved",
                "Suggestion is " + current + "; request a new review to retry", ApplyOutcome.ALREADY_RESOLVED);
    }

    static ApplyResult failed(String suggestionId, ApplyOutcome outcome, String message, String error) {
        return new ApplyResult(false, suggestionId, message, error, outcome);
    }
}
