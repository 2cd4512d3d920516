package com.draftreview.domain.review.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A single positioned edit proposal. Immutable; applied status is tracked by the review session.
 *
 * @param id                        globally unique id, the only cross-reference key
 * @param kind                      informational classification
 * @param displayLine               1-based line for presentation, 0 when not positioned
 * @param anchor                    span the replacement targets
 * @param originalText              text the proposer saw at {@code anchor}
 * @param replacementText           text to substitute, may be empty for a deletion
 * @param rationale                 human-readable justification
 * @param filePath                  document the suggestion was generated for (nullable)
 * @param documentVersionAtProposal document version when proposed (nullable)
 */
public record Suggestion(
        String id,
        SuggestionKind kind,
        int displayLine,
        TextAnchor anchor,
        String originalText,
        String replacementText,
        String rationale,
        String filePath,
        Integer documentVersionAtProposal
) {

    public Suggestion {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Suggestion id is required");
        }
        if (rationale == null || rationale.isBlank()) {
            throw new IllegalArgumentException("Suggestion rationale is required");
        }
        kind = kind != null ? kind : SuggestionKind.STYLE;
        anchor = anchor != null ? anchor : TextAnchor.NONE;
        originalText = originalText != null ? originalText : "";
        replacementText = replacementText != null ? replacementText : "";
    }

    /**
     * A blank replacement marks an informational suggestion that cannot be applied directly.
     */
    @JsonIgnore
    public boolean isAppliable() {
        return !replacementText.trim().isEmpty();
    }

    public Suggestion withProvenance(String path, Integer version) {
        return new Suggestion(id, kind, displayLine, anchor, originalText, replacementText, rationale,
                path, version);
    }
}
