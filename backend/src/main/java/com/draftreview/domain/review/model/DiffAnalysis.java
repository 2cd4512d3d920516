package com.draftreview.domain.review.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Pre-computed diff and consistency report for one revision.
 */
public record DiffAnalysis(
        String summary,
        int additions,
        int deletions,
        int modifications,
        List<SemanticChange> semanticChanges,
        ConsistencyReport consistencyReport
) {

    public DiffAnalysis {
        summary = summary != null ? summary : "";
        semanticChanges = semanticChanges != null ? List.copyOf(semanticChanges) : List.of();
        consistencyReport = consistencyReport != null ? consistencyReport : ConsistencyReport.defaultReport();
    }

    @JsonIgnore
    public boolean isPureAddition() {
        return additions > 0 && deletions == 0;
    }

    @JsonIgnore
    public boolean isDeletionDominant() {
        return deletions > additions;
    }
}
