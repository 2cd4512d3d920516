package com.draftreview.infrastructure.document;

/**
 * Lifecycle of a single suggestion.
 * <pre>
 * PROPOSED -> STALE | OUT_OF_BOUNDS | VALID
 * VALID    -> APPLIED | EDIT_REJECTED
 * </pre>
 * STALE, OUT_OF_BOUNDS, APPLIED and EDIT_REJECTED are terminal; retrying needs a fresh review.
 */
public enum SuggestionState {
    PROPOSED(false),
    STALE(true),
    OUT_OF_BOUNDS(true),
    VALID(false),
    APPLIED(true),
    EDIT_REJECTED(true);

    private final boolean terminal;

    SuggestionState(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
