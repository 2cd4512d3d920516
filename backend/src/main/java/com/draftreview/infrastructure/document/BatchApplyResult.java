package com.draftreview.infrastructure.document;

import java.util.List;

/**
 * Results in application order, preceded by {@link ApplyOutcome#ALREADY_RESOLVED} refusals for requested
 * suggestions that were skipped. Refusals count as neither success nor failure. A batch stops at its
 * first failed attempt, so at most the last result failed.
 */
public record BatchApplyResult(List<ApplyResult> results, int successCount, int failureCount) {

    public BatchApplyResult {
        results = List.copyOf(results);
    }
}
