package com.draftreview.domain.review.model;

import java.util.List;

/**
 * Consistency score (0-100) with its issue and suggestion lists.
 */
public record ConsistencyReport(int score, List<String> issues, List<String> suggestions) {

    public static final int DEFAULT_SCORE = 80;

    public ConsistencyReport {
        score = Math.max(0, Math.min(100, score));
        issues = issues != null ? List.copyOf(issues) : List.of();
        suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
    }

    public static ConsistencyReport defaultReport() {
        return new ConsistencyReport(DEFAULT_SCORE, List.of(), List.of());
    }
}
