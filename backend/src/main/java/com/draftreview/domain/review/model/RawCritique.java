package com.draftreview.domain.review.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Loosely-typed critique as returned by a backend. Every field may be missing;
 * normalisation into a {@link Critique} happens in the review layer.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawCritique(
        String overall,
        List<String> strengths,
        List<String> improvements,
        List<RawSuggestion> suggestions,
        Double rating
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RawSuggestion(
            String id,
            String type,
            Integer line,
            Integer startLine,
            Integer startColumn,
            Integer endLine,
            Integer endColumn,
            String original,
            String suggested,
            String reason,
            Double confidence
    ) {
    }
}
