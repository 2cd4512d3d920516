package com.draftreview.infrastructure.review;

import com.draftreview.domain.review.model.TextAnchor;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Best-effort relocation of changed text near the line a diff reported for it.
 *
 * Only lines {@code [approximateLine - 2, approximateLine + 3)} are searched. When the text is not
 * found the anchor covers the whole approximate line, clamped into the document. Line breaks are
 * {@code \n}, {@code \r\n} and {@code \r}, as in {@link com.draftreview.infrastructure.document.TextDocument}.
 */
@Component
public class TextLocator {

    static final int LINES_BEFORE = 2;
    static final int LINES_AFTER = 3;

    private static final Pattern LINE_BREAK = Pattern.compile("\r\n|\r|\n");

    public TextAnchor locate(String content, String searchText, int approximateLine) {
        String[] lines = LINE_BREAK.split(content != null ? content : "", -1);
        String trimmed = searchText.strip();

        int searchStart = Math.max(0, approximateLine - LINES_BEFORE);
        int searchEnd = Math.min(lines.length, approximateLine + LINES_AFTER);

        for (int i = searchStart; i < searchEnd; i++) {
            int index = lines[i].indexOf(trimmed);
            if (index != -1) {
                int leadingWhitespace = searchText.length() - searchText.stripLeading().length();
                int startColumn = Math.max(0, index - leadingWhitespace);
                return TextAnchor.singleLine(i, startColumn, startColumn + searchText.length());
            }
        }

        int clampedLine = Math.min(Math.max(0, approximateLine), lines.length - 1);
        return TextAnchor.singleLine(clampedLine, 0, lines[clampedLine].length());
    }
}
