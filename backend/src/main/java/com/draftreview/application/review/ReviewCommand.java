package com.draftreview.application.review;

import com.draftreview.domain.review.model.DiffAnalysis;

/**
 * Input of a review. Either {@code analysis} or {@code diff} must be present; when both are,
 * the given analysis wins.
 *
 * @param filePath workspace-relative path of the reviewed document (nullable)
 * @param fullText current document text; read from the workspace when null
 */
public record ReviewCommand(String filePath, String diff, String fullText, DiffAnalysis analysis) {
}
