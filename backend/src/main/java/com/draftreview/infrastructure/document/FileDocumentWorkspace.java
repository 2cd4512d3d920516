package com.draftreview.infrastructure.document;

import com.draftreview.domain.document.DocumentAccessException;
import com.draftreview.domain.document.DocumentWorkspace;
import com.draftreview.domain.document.EditableDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Opens documents below a configured root directory. Paths that resolve outside the root are rejected.
 */
@Slf4j
@Component
public class FileDocumentWorkspace implements DocumentWorkspace {

    private final Path root;
    private final ConcurrentMap<Path, Object> locks = new ConcurrentHashMap<>();

    public FileDocumentWorkspace(@Value("${review.workspace.root:.}") Path root) {
        this.root = root.toAbsolutePath().normalize();
        log.info("[FileDocumentWorkspace] Workspace root: {}", this.root);
    }

    @Override
    public Optional<EditableDocument> open(String path) {
        return open(resolve(path));
    }

    @Override
    public <T> T withDocument(String path, Function<Optional<EditableDocument>, T> action) {
        Path file = resolve(path);
        synchronized (locks.computeIfAbsent(file, key -> new Object())) {
            return action.apply(open(file));
        }
    }

    private Optional<EditableDocument> open(Path file) {
        if (!Files.isRegularFile(file)) {
            log.debug("[FileDocumentWorkspace] No document at {}", file);
            return Optional.empty();
        }
        return Optional.of(FileDocument.open(file));
    }

    /**
     * Resolves a workspace-relative (or absolute, inside the root) path.
     *
     * @throws DocumentAccessException for null bytes, malformed paths, or paths escaping the root
     */
    Path resolve(String path) {
        if (path == null || path.isBlank()) {
            throw new DocumentAccessException("Document path is required");
        }
        if (path.indexOf('\0') >= 0) {
            throw new DocumentAccessException("Document path contains a null byte");
        }
        Path resolved;
        try {
            resolved = root.resolve(path.replace('\\', '/')).normalize();
        } catch (InvalidPathException e) {
            throw new DocumentAccessException("Invalid document path: " + path, e);
        }
        if (!resolved.startsWith(root)) {
            log.warn("[FileDocumentWorkspace] Rejected path outside workspace: {}", path);
            throw new DocumentAccessException("Document path escapes the workspace: " + path);
        }
        return resolved;
    }
}
