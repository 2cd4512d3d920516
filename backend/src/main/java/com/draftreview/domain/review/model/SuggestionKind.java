package com.draftreview.domain.review.model;

import java.util.Locale;

/**
 * Classification of a suggestion. Informational only: application logic never branches on it.
 */
public enum SuggestionKind {
    GRAMMAR,
    STYLE,
    STRUCTURE,
    CONTENT;

    /**
     * Maps a backend-provided kind string into the closed set.
     * "clarity" and anything unrecognised become {@link #STYLE}.
     */
    public static SuggestionKind fromBackendValue(String value) {
        if (value == null) {
            return STYLE;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "grammar" -> GRAMMAR;
            case "structure" -> STRUCTURE;
            case "content" -> CONTENT;
            default -> STYLE;
        };
    }
}
