package com.draftreview.domain.document;

import com.draftreview.domain.review.model.TextAnchor;

/**
 * An open, editable text document addressed by zero-based line/column anchors.
 */
public interface EditableDocument {

    /**
     * Text covered by the anchor.
     *
     * @throws IllegalArgumentException when the anchor does not resolve inside the document
     */
    String getText(TextAnchor anchor);

    /**
     * The whole document.
     */
    String getText();

    /**
     * Replaces the anchored span as a single atomic edit.
     *
     * @return false when the edit was rejected by the document
     */
    boolean replace(TextAnchor anchor, String text);

    int lineCount();

    String path();

    int version();

    boolean isWritable();
}
