package com.draftreview.domain.review.model;

import java.util.List;
import java.util.Optional;

/**
 * Canonical review result.
 *
 * @param overallAssessment freeform summary, never blank
 * @param strengths         never empty
 * @param improvements      never empty
 * @param suggestions       in generation order
 * @param rating            integer in [0, 10]
 * @param sourcePath        file the review was generated for (nullable)
 * @param documentVersion   document version the review was generated against (nullable)
 */
public record Critique(
        String overallAssessment,
        List<String> strengths,
        List<String> improvements,
        List<Suggestion> suggestions,
        int rating,
        String sourcePath,
        Integer documentVersion
) {

    public static final int MIN_RATING = 0;
    public static final int MAX_RATING = 10;

    public Critique {
        if (overallAssessment == null || overallAssessment.isBlank()) {
            throw new IllegalArgumentException("Overall assessment must not be blank");
        }
        if (strengths == null || strengths.isEmpty()) {
            throw new IllegalArgumentException("Strengths must not be empty");
        }
        if (improvements == null || improvements.isEmpty()) {
            throw new IllegalArgumentException("Improvements must not be empty");
        }
        strengths = List.copyOf(strengths);
        improvements = List.copyOf(improvements);
        suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
        rating = clampRating(rating);
    }

    public static int clampRating(long value) {
        return (int) Math.max(MIN_RATING, Math.min(MAX_RATING, value));
    }

    public Optional<Suggestion> findSuggestion(String suggestionId) {
        return suggestions.stream()
                .filter(s -> s.id().equals(suggestionId))
                .findFirst();
    }

    /**
     * Stamps the critique and each of its suggestions with the document it was produced for.
     */
    public Critique withProvenance(String path, Integer version) {
        List<Suggestion> stamped = suggestions.stream()
                .map(s -> s.withProvenance(path, version))
                .toList();
        return new Critique(overallAssessment, strengths, improvements, stamped, rating, path, version);
    }
}
