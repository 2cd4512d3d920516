package com.draftreview.domain.review.service;

import com.draftreview.domain.review.model.BackendResponse;
import com.draftreview.domain.review.model.DiffAnalysis;
import com.draftreview.domain.review.model.RawCritique;
import com.draftreview.domain.review.model.ReviewContext;

/**
 * A remote text-analysis backend. Implementations retry transient failures internally
 * and surface everything else as {@code ReviewBackendException}.
 */
public interface ReviewBackend {

    /**
     * Stable provider key, used to select the rate limiter and credential.
     */
    String providerKey();

    String modelId();

    BackendResponse<RawCritique> reviewText(String text, ReviewContext context);

    BackendResponse<DiffAnalysis> analyzeDiff(String diff, ReviewContext context);
}
