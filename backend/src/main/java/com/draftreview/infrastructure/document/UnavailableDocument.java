package com.draftreview.infrastructure.document;

import com.draftreview.domain.document.EditableDocument;
import com.draftreview.domain.review.model.TextAnchor;

/**
 * Stands in for a document that was addressed by path but could not be opened. It is never
 * writable, so every apply attempt against it ends in an access error.
 */
public class UnavailableDocument implements EditableDocument {

    private final String path;

    public UnavailableDocument(String path) {
        this.path = path;
    }

    @Override
    public String getText(TextAnchor anchor) {
        throw new IllegalArgumentException("Document " + path + " is not available");
    }

    @Override
    public String getText() {
        return "";
    }

    @Override
    public boolean replace(TextAnchor anchor, String text) {
        return false;
    }

    @Override
    public int lineCount() {
        return 0;
    }

    @Override
    public String path() {
        return path;
    }

    @Override
    public int version() {
        return 0;
    }

    @Override
    public boolean isWritable() {
        return false;
    }
}
