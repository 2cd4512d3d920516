package com.draftreview.infrastructure.review;

/**
 * Fixed texts used wherever a critique field would otherwise be empty.
 */
final class ReviewPlaceholders {

    static final String OVERALL = "整体质量良好";
    static final String STRENGTH = "继续保持细致的写作态度";
    static final String IMPROVEMENT = "暂无明显问题";
    static final String RATIONALE = "建议修改此处表述";
    static final int DEFAULT_RATING = 7;

    private ReviewPlaceholders() {
    }
}
