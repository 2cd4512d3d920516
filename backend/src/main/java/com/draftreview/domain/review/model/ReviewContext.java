package com.draftreview.domain.review.model;

import java.util.Locale;

/**
 * Context sent along with a review or diff-analysis request.
 */
public record ReviewContext(String filePath, DocumentType documentType, WritingStyle writingStyle) {

    public enum DocumentType {
        MARKDOWN,
        LATEX
    }

    public enum WritingStyle {
        FORMAL,
        CASUAL,
        ACADEMIC,
        TECHNICAL
    }

    public ReviewContext {
        documentType = documentType != null ? documentType : DocumentType.MARKDOWN;
        writingStyle = writingStyle != null ? writingStyle : WritingStyle.FORMAL;
    }

    /**
     * Derives the document type from the file extension: {@code .tex} is LaTeX, everything else Markdown.
     */
    public static ReviewContext forPath(String filePath) {
        DocumentType type = filePath != null && filePath.toLowerCase(Locale.ROOT).endsWith(".tex")
                ? DocumentType.LATEX
                : DocumentType.MARKDOWN;
        return new ReviewContext(filePath, type, WritingStyle.FORMAL);
    }
}
