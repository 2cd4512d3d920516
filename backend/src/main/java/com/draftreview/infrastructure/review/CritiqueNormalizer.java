package com.draftreview.infrastructure.review;

import com.draftreview.domain.review.model.Critique;
import com.draftreview.domain.review.model.RawCritique;
import com.draftreview.domain.review.model.RawCritique.RawSuggestion;
import com.draftreview.domain.review.model.Suggestion;
import com.draftreview.domain.review.model.SuggestionKind;
import com.draftreview.domain.review.model.TextAnchor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Turns a loosely-typed backend critique into a {@link Critique} that satisfies every invariant,
 * whatever the backend left out.
 */
@Slf4j
@Component
public class CritiqueNormalizer {

    public Critique normalize(RawCritique raw) {
        if (raw == null) {
            raw = new RawCritique(null, null, null, null, null);
        }

        String overall = raw.overall() == null || raw.overall().isBlank()
                ? ReviewPlaceholders.OVERALL
                : raw.overall().trim();

        List<String> strengths = nonBlank(raw.strengths());
        if (strengths.isEmpty()) {
            strengths.add(ReviewPlaceholders.STRENGTH);
        }
        List<String> improvements = nonBlank(raw.improvements());
        if (improvements.isEmpty()) {
            improvements.add(ReviewPlaceholders.IMPROVEMENT);
        }

        int rating = raw.rating() == null || raw.rating().isNaN()
                ? ReviewPlaceholders.DEFAULT_RATING
                : Critique.clampRating(Math.round(raw.rating()));

        List<Suggestion> suggestions = new ArrayList<>();
        if (raw.suggestions() != null) {
            for (RawSuggestion candidate : raw.suggestions()) {
                if (candidate == null) {
                    continue;
                }
                Suggestion suggestion = toSuggestion(candidate);
                if (suggestion != null) {
                    suggestions.add(suggestion);
                }
            }
        }

        return new Critique(overall, strengths, improvements, suggestions, rating, null, null);
    }

    private Suggestion toSuggestion(RawSuggestion raw) {
        TextAnchor anchor;
        try {
            anchor = new TextAnchor(
                    orZero(raw.startLine()),
                    orZero(raw.startColumn()),
                    orZero(raw.endLine()),
                    orZero(raw.endColumn()));
        } catch (IllegalArgumentException e) {
            log.warn("[CritiqueNormalizer] Dropping suggestion {} with invalid anchor: {}", raw.id(), e.getMessage());
            return null;
        }

        String id = raw.id() == null || raw.id().isBlank() ? UUID.randomUUID().toString() : raw.id();
        String rationale = raw.reason() == null || raw.reason().isBlank() ? ReviewPlaceholders.RATIONALE : raw.reason();
        int displayLine = raw.line() != null && raw.line() > 0 ? raw.line() : 0;

        return new Suggestion(id, SuggestionKind.fromBackendValue(raw.type()), displayLine, anchor,
                raw.original(), raw.suggested(), rationale, null, null);
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }

    private static List<String> nonBlank(List<String> values) {
        List<String> result = new ArrayList<>();
        if (values != null) {
            for (String value : values) {
                if (value != null && !value.isBlank()) {
                    result.add(value);
                }
            }
        }
        return result;
    }
}
