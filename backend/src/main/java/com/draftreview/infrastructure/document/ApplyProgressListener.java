package com.draftreview.infrastructure.document;

import com.draftreview.domain.review.model.Suggestion;

@FunctionalInterface
public interface ApplyProgressListener {

    /**
     * Called before each attempt.
     *
     * @param current 1-based position in the batch
     * @param total   number of suggestions in the batch
     */
    void beforeApply(int current, int total, Suggestion suggestion);
}
