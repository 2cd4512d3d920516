package com.draftreview.infrastructure.document;

import com.draftreview.domain.document.EditableDocument;
import com.draftreview.domain.review.model.TextAnchor;

import java.util.ArrayList;
import java.util.List;

/**
 * In-memory document. Columns are UTF-16 code unit offsets; {@code \n}, {@code \r\n} and {@code \r}
 * all end a line and are preserved as they are. Not thread-safe.
 */
public class TextDocument implements EditableDocument {

    private final String path;
    private final boolean writable;
    private String text;
    private int[] lineStarts;
    private int[] lineEnds;
    private int version;

    public TextDocument(String path, String text) {
        this(path, text, true);
    }

    public TextDocument(String path, String text, boolean writable) {
        this.path = path;
        this.writable = writable;
        this.version = 1;
        setText(text != null ? text : "");
    }

    @Override
    public String getText(TextAnchor anchor) {
        return text.substring(offsetOf(anchor.startLine(), anchor.startColumn()),
                offsetOf(anchor.endLine(), anchor.endColumn()));
    }

    @Override
    public String getText() {
        return text;
    }

    @Override
    public boolean replace(TextAnchor anchor, String replacement) {
        if (!writable) {
            return false;
        }
        setText(previewReplace(anchor, replacement));
        version++;
        return true;
    }

    /**
     * Full text as it would read after {@link #replace}, without changing the document.
     */
    String previewReplace(TextAnchor anchor, String replacement) {
        int start = offsetOf(anchor.startLine(), anchor.startColumn());
        int end = offsetOf(anchor.endLine(), anchor.endColumn());
        return text.substring(0, start) + (replacement != null ? replacement : "") + text.substring(end);
    }

    @Override
    public int lineCount() {
        return lineStarts.length;
    }

    @Override
    public String path() {
        return path;
    }

    @Override
    public int version() {
        return version;
    }

    @Override
    public boolean isWritable() {
        return writable;
    }

    private int offsetOf(int line, int column) {
        checkLine(line);
        int length = lineEnds[line] - lineStarts[line];
        if (column < 0 || column > length) {
            throw new IllegalArgumentException("Column " + column + " is outside line " + line
                    + " (length " + length + ")");
        }
        return lineStarts[line] + column;
    }

    private void checkLine(int line) {
        if (line < 0 || line >= lineStarts.length) {
            throw new IllegalArgumentException("Line " + line + " is outside the document (" + lineStarts.length
                    + " lines)");
        }
    }

    private void setText(String newText) {
        List<int[]> lines = new ArrayList<>();
        int start = 0;
        int i = 0;
        while (i < newText.length()) {
            char c = newText.charAt(i);
            if (c == '\n' || c == '\r') {
                lines.add(new int[]{start, i});
                i += c == '\r' && i + 1 < newText.length() && newText.charAt(i + 1) == '\n' ? 2 : 1;
                start = i;
            } else {
                i++;
            }
        }
        lines.add(new int[]{start, newText.length()});

        this.text = newText;
        this.lineStarts = lines.stream().mapToInt(l -> l[0]).toArray();
        this.lineEnds = lines.stream().mapToInt(l -> l[1]).toArray();
    }
}
