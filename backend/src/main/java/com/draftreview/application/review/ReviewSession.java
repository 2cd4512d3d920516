package com.draftreview.application.review;

import com.draftreview.domain.review.model.Critique;
import com.draftreview.infrastructure.document.SuggestionState;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A critique together with the lifecycle state of each of its suggestions.
 * Suggestions without a recorded state are {@link SuggestionState#PROPOSED}.
 */
@Getter
public class ReviewSession {

    private final String id;
    private final Critique critique;
    private final Instant createdAt;
    private final Instant expiresAt;
    @Getter(AccessLevel.NONE)
    private final Map<String, SuggestionState> states = new LinkedHashMap<>();

    public ReviewSession(String id, Critique critique, Instant createdAt, Instant expiresAt) {
        this.id = id;
        this.critique = critique;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
    }

    /**
     * Records the state reached by an apply attempt. Terminal states are final: later writes for the
     * same suggestion are ignored, as is a null state.
     */
    public synchronized void recordState(String suggestionId, SuggestionState state) {
        if (state == null || stateOf(suggestionId).isTerminal()) {
            return;
        }
        states.put(suggestionId, state);
    }

    public synchronized SuggestionState stateOf(String suggestionId) {
        return states.getOrDefault(suggestionId, SuggestionState.PROPOSED);
    }

    public synchronized Set<String> getAppliedIds() {
        return states.entrySet().stream()
                .filter(e -> e.getValue() == SuggestionState.APPLIED)
                .map(Map.Entry::getKey)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public synchronized Map<String, SuggestionState> getSuggestionStates() {
        return Map.copyOf(states);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
