package com.draftreview.domain.review.model;

/**
 * Zero-based line/column range identifying the span a suggestion replaces.
 * The end position is exclusive. Columns are UTF-16 code unit offsets within a line.
 */
public record TextAnchor(int startLine, int startColumn, int endLine, int endColumn) {

    public static final TextAnchor NONE = new TextAnchor(0, 0, 0, 0);

    public TextAnchor {
        if (startLine < 0 || startColumn < 0 || endLine < 0 || endColumn < 0) {
            throw new IllegalArgumentException(
                    "Anchor positions must be non-negative: " + describe(startLine, startColumn, endLine, endColumn));
        }
        if (startLine > endLine || (startLine == endLine && startColumn > endColumn)) {
            throw new IllegalArgumentException(
                    "Anchor start must not be after its end: " + describe(startLine, startColumn, endLine, endColumn));
        }
    }

    public static TextAnchor singleLine(int line, int startColumn, int endColumn) {
        return new TextAnchor(line, startColumn, line, endColumn);
    }

    @Override
    public String toString() {
        return describe(startLine, startColumn, endLine, endColumn);
    }

    private static String describe(int startLine, int startColumn, int endLine, int endColumn) {
        return "(" + startLine + ":" + startColumn + ")-(" + endLine + ":" + endColumn + ")";
    }
}
