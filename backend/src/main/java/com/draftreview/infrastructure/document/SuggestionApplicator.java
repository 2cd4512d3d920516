package com.draftreview.infrastructure.document;

import com.draftreview.domain.document.EditableDocument;
import com.draftreview.domain.review.model.Suggestion;
import com.draftreview.domain.review.model.SuggestionKind;
import com.draftreview.domain.review.model.TextAnchor;
import com.draftreview.infrastructure.ratelimit.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Applies suggestions to an open document, refusing any edit whose anchored text no longer
 * matches what the suggestion was generated against. Never throws; every failure is a result.
 */
@Slf4j
@Component
public class SuggestionApplicator {

    static final String STALE_REASON = "The text at this location has changed since the review was generated.";
    static final String OUT_OF_BOUNDS_REASON =
            "Line numbers are out of document bounds. The document may have been modified.";
    static final String INVALID_RANGE_REASON = "Invalid range or position in document.";
    static final String NOT_APPLICABLE = "Suggestion no longer applicable";

    /**
     * Bottom to top, then right to left, so that applying one edit never moves the anchor of a later one.
     */
    static final Comparator<Suggestion> APPLY_ORDER = Comparator
            .comparingInt((Suggestion s) -> s.anchor().startLine()).reversed()
            .thenComparing(Comparator.comparingInt((Suggestion s) -> s.anchor().startColumn()).reversed());

    private final Duration settleDelay;
    private final Sleeper sleeper;

    @Autowired
    public SuggestionApplicator(@Value("${review.apply.settle-delay:50ms}") Duration settleDelay) {
        this(settleDelay, Sleeper.THREAD);
    }

    SuggestionApplicator(Duration settleDelay, Sleeper sleeper) {
        this.settleDelay = settleDelay;
        this.sleeper = sleeper;
    }

    /**
     * @param document the open document, null when none is available
     */
    public ApplyResult applySuggestion(Suggestion suggestion, EditableDocument document) {
        String id = suggestion.id();

        if (!suggestion.isAppliable()) {
            return ApplyResult.failed(id, ApplyOutcome.NOT_APPLIABLE, "Nothing to apply",
                    "This suggestion is advice only and has no replacement text");
        }

        if (document == null) {
            return ApplyResult.failed(id, ApplyOutcome.NO_ACTIVE_EDITOR,
                    "No active editor", "Please open the file in the editor");
        }

        if (!isSameFile(document.path(), suggestion.filePath())) {
            return ApplyResult.failed(id, ApplyOutcome.WRONG_FILE, "Wrong file",
                    "This suggestion is for " + suggestion.filePath() + ", but you have " + document.path() + " open");
        }

        if (!document.isWritable()) {
            return ApplyResult.failed(id, ApplyOutcome.ACCESS_ERROR, "File access error", "Cannot access the file");
        }

        ApplyResult conflict = checkConflict(suggestion, document);
        if (conflict != null) {
            log.info("[SuggestionApplicator] Rejected {} - outcome: {}, anchor: {}", id, conflict.outcome(),
                    suggestion.anchor());
            return conflict;
        }

        try {
            if (document.replace(suggestion.anchor(), suggestion.replacementText())) {
                log.debug("[SuggestionApplicator] Applied {} at {} in {}", id, suggestion.anchor(), document.path());
                return ApplyResult.applied(id);
            }
            return ApplyResult.failed(id, ApplyOutcome.EDIT_REJECTED,
                    "Failed to apply suggestion", "Edit operation was rejected");
        } catch (RuntimeException e) {
            log.warn("[SuggestionApplicator] Edit for {} failed: {}", id, e.getMessage());
            return ApplyResult.failed(id, ApplyOutcome.EDIT_ERROR, "Error applying suggestion",
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private ApplyResult checkConflict(Suggestion suggestion, EditableDocument document) {
        TextAnchor anchor = suggestion.anchor();
        if (anchor.startLine() >= document.lineCount() || anchor.endLine() >= document.lineCount()) {
            return ApplyResult.failed(suggestion.id(), ApplyOutcome.OUT_OF_BOUNDS, NOT_APPLICABLE, OUT_OF_BOUNDS_REASON);
        }
        String current;
        try {
            current = document.getText(anchor);
        } catch (IllegalArgumentException e) {
            return ApplyResult.failed(suggestion.id(), ApplyOutcome.INVALID_RANGE, NOT_APPLICABLE, INVALID_RANGE_REASON);
        }
        if (!current.equals(suggestion.originalText())) {
            return ApplyResult.failed(suggestion.id(), ApplyOutcome.STALE, NOT_APPLICABLE, STALE_REASON);
        }
        return null;
    }

    /**
     * Applies every appliable suggestion in {@link #APPLY_ORDER}, stopping at the first failure.
     * Suggestions with a blank replacement are skipped without a result.
     */
    public BatchApplyResult applyAll(List<Suggestion> suggestions, EditableDocument document,
                                     ApplyProgressListener listener) {
        List<Suggestion> ordered = suggestions.stream()
                .filter(Suggestion::isAppliable)
                .sorted(APPLY_ORDER)
                .toList();

        List<ApplyResult> results = new ArrayList<>();
        int successCount = 0;
        int failureCount = 0;

        for (int i = 0; i < ordered.size(); i++) {
            Suggestion suggestion = ordered.get(i);
            if (listener != null) {
                listener.beforeApply(i + 1, ordered.size(), suggestion);
            }

            ApplyResult result = applySuggestion(suggestion, document);
            results.add(result);

            if (!result.success()) {
                failureCount++;
                log.info("[SuggestionApplicator] Batch stopped at {}/{} - {}", i + 1, ordered.size(), result.outcome());
                break;
            }
            successCount++;

            if (i < ordered.size() - 1 && !settle()) {
                break;
            }
        }

        return new BatchApplyResult(results, successCount, failureCount);
    }

    public BatchApplyResult applyAll(List<Suggestion> suggestions, EditableDocument document) {
        return applyAll(suggestions, document, null);
    }

    public Suggestion createSuggestion(SuggestionKind kind, String filePath, TextAnchor anchor, String originalText,
                                       String replacementText, String rationale, Integer documentVersion) {
        return new Suggestion(UUID.randomUUID().toString(), kind, anchor.startLine() + 1, anchor, originalText,
                replacementText, rationale, filePath, documentVersion);
    }

    /**
     * Suggestions without a path belong to whatever document is open.
     */
    static boolean isSameFile(String documentPath, String suggestionPath) {
        if (suggestionPath == null || suggestionPath.isBlank()) {
            return true;
        }
        if (documentPath == null) {
            return false;
        }
        String doc = documentPath.replace('\\', '/');
        String target = suggestionPath.replace('\\', '/');
        return doc.equals(target) || doc.endsWith(target.startsWith("/") ? target : "/" + target);
    }

    private boolean settle() {
        if (settleDelay.isZero() || settleDelay.isNegative()) {
            return true;
        }
        try {
            sleeper.sleep(settleDelay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[SuggestionApplicator] Interrupted between edits, stopping batch");
            return false;
        }
    }
}
