package com.draftreview.interfaces.api.dto;

import com.draftreview.application.review.ReviewSession;
import com.draftreview.domain.review.model.Critique;
import com.draftreview.infrastructure.document.SuggestionState;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReviewResponse(
        String reviewId,
        Critique critique,
        Set<String> appliedSuggestionIds,
        Map<String, SuggestionState> suggestionStates,
        Instant createdAt,
        Instant expiresAt
) {
    public static ReviewResponse from(ReviewSession session) {
        return new ReviewResponse(session.getId(), session.getCritique(), session.getAppliedIds(),
                session.getSuggestionStates(), session.getCreatedAt(), session.getExpiresAt());
    }
}
