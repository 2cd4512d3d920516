package com.draftreview.infrastructure.document;

import com.draftreview.domain.document.DocumentAccessException;
import com.draftreview.domain.document.EditableDocument;
import com.draftreview.domain.review.model.TextAnchor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A UTF-8 file loaded into a {@link TextDocument}. Every successful replace is written back to disk
 * before the in-memory text changes, so a failed write leaves both untouched.
 */
@Slf4j
public class FileDocument implements EditableDocument {

    private final Path file;
    private final TextDocument content;

    private FileDocument(Path file, TextDocument content) {
        this.file = file;
        this.content = content;
    }

    public static FileDocument open(Path file) {
        try {
            String text = Files.readString(file, StandardCharsets.UTF_8);
            return new FileDocument(file, new TextDocument(normalize(file), text, Files.isWritable(file)));
        } catch (IOException e) {
            throw new DocumentAccessException("Cannot read " + file.getFileName(), e);
        }
    }

    @Override
    public String getText(TextAnchor anchor) {
        return content.getText(anchor);
    }

    @Override
    public String getText() {
        return content.getText();
    }

    @Override
    public boolean replace(TextAnchor anchor, String text) {
        if (!isWritable()) {
            return false;
        }
        String updated = content.previewReplace(anchor, text);
        try {
            Files.writeString(file, updated, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("[FileDocument] Write to {} failed: {}", file, e.getMessage());
            throw new DocumentAccessException("Cannot write " + file.getFileName() + ": " + e.getMessage(), e);
        }
        return content.replace(anchor, text);
    }

    @Override
    public int lineCount() {
        return content.lineCount();
    }

    @Override
    public String path() {
        return content.path();
    }

    @Override
    public int version() {
        return content.version();
    }

    @Override
    public boolean isWritable() {
        return content.isWritable() && Files.isWritable(file);
    }

    private static String normalize(Path file) {
        return file.toAbsolutePath().normalize().toString().replace('\\', '/');
    }
}
