package com.draftreview.domain.review.model;

/**
 * One semantic change reported by a diff analysis.
 *
 * @param type        kind of change
 * @param description literal changed text (or a description of it)
 * @param lineNumber  approximate zero-based line in the new revision
 * @param confidence  0..1, informational
 */
public record SemanticChange(ChangeType type, String description, int lineNumber, double confidence) {

    public enum ChangeType {
        ADDITION,
        DELETION,
        MODIFICATION
    }

    public SemanticChange {
        description = description != null ? description : "";
    }
}
