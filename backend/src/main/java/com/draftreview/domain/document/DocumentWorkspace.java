package com.draftreview.domain.document;

import java.util.Optional;
import java.util.function.Function;

/**
 * Locates editable documents by path.
 */
public interface DocumentWorkspace {

    /**
     * Opens the document at the given workspace-relative path.
     *
     * @return empty when no such document exists
     * @throws DocumentAccessException when the path is rejected or cannot be read
     */
    Optional<EditableDocument> open(String path);

    /**
     * Opens the document at {@code path} and runs {@code action} on it while holding that document's
     * exclusive lock. Callers editing the same document through this method never overwrite each
     * other's changes.
     *
     * @throws DocumentAccessException when the path is rejected or cannot be read
     */
    <T> T withDocument(String path, Function<Optional<EditableDocument>, T> action);
}
