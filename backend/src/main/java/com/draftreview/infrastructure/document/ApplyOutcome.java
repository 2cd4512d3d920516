package com.draftreview.infrastructure.document;

public enum ApplyOutcome {
    APPLIED(SuggestionState.APPLIED),
    NOT_APPLIABLE(SuggestionState.PROPOSED),
    ALREADY_RESOLVED(null),
    NO_ACTIVE_EDITOR(SuggestionState.PROPOSED),
    WRONG_FILE(SuggestionState.PROPOSED),
    ACCESS_ERROR(SuggestionState.PROPOSED),
    OUT_OF_BOUNDS(SuggestionState.OUT_OF_BOUNDS),
    STALE(SuggestionState.STALE),
    INVALID_RANGE(SuggestionState.OUT_OF_BOUNDS),
    EDIT_REJECTED(SuggestionState.EDIT_REJECTED),
    EDIT_ERROR(SuggestionState.EDIT_REJECTED);

    private final SuggestionState state;

    ApplyOutcome(SuggestionState state) {
        this.state = state;
    }

    /**
     * State the suggestion is in after an apply attempt with this outcome, or null for
     * {@link #ALREADY_RESOLVED}, which leaves the recorded state as it was.
     */
    public SuggestionState state() {
        return state;
    }
}
