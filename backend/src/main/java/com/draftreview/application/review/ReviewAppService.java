package com.draftreview.application.review;

import com.draftreview.application.review.exception.SuggestionNotFoundException;
import com.draftreview.domain.document.DocumentAccessException;
import com.draftreview.domain.document.DocumentWorkspace;
import com.draftreview.domain.document.EditableDocument;
import com.draftreview.domain.review.model.Critique;
import com.draftreview.domain.review.model.DiffAnalysis;
import com.draftreview.domain.review.model.Suggestion;
import com.draftreview.infrastructure.document.ApplyResult;
import com.draftreview.infrastructure.document.BatchApplyResult;
import com.draftreview.infrastructure.document.SuggestionApplicator;
import com.draftreview.infrastructure.document.SuggestionState;
import com.draftreview.infrastructure.document.UnavailableDocument;
import com.draftreview.infrastructure.review.DiffAnalysisService;
import com.draftreview.infrastructure.review.ReviewSynthesizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

@Slf4j
@Service
@RequiredArgsConstructor
public class ReviewAppService {

    private final ReviewSynthesizer reviewSynthesizer;
    private final DiffAnalysisService diffAnalysisService;
    private final SuggestionApplicator suggestionApplicator;
    private final DocumentWorkspace documentWorkspace;
    private final ReviewSessionStore reviewSessionStore;

    /**
     * Reviews a revision and opens a session for applying its suggestions.
     */
    public ReviewSession review(ReviewCommand command) {
        if (command.analysis() == null && (command.diff() == null || command.diff().isBlank())) {
            throw new IllegalArgumentException("Either a diff or a diff analysis is required");
        }

        Optional<EditableDocument> document = command.filePath() != null
                ? documentWorkspace.open(command.filePath())
                : Optional.empty();
        String fullText = command.fullText() != null
                ? command.fullText()
                : document.map(EditableDocument::getText).orElse(null);

        DiffAnalysis analysis = command.analysis() != null
                ? command.analysis()
                : diffAnalysisService.analyze(command.diff(), fullText, command.filePath());

        Critique critique = reviewSynthesizer.generateReview(analysis, command.filePath(), fullText)
                .withProvenance(command.filePath(), document.map(EditableDocument::version).orElse(null));

        ReviewSession session = reviewSessionStore.save(critique);
        log.info("Review created - id: {}, file: {}, rating: {}, suggestions: {}",
                session.getId(), command.filePath(), critique.rating(), critique.suggestions().size());
        return session;
    }

    public DiffAnalysis analyze(String diff, String fullText, String filePath) {
        return diffAnalysisService.analyze(diff, fullText, filePath);
    }

    public ReviewSession getSession(String reviewId) {
        return reviewSessionStore.get(reviewId);
    }

    /**
     * Applies one suggestion. A suggestion already in a terminal state is refused without touching
     * the document.
     */
    public ApplyResult applySuggestion(String reviewId, String suggestionId) {
        ReviewSession session = reviewSessionStore.get(reviewId);
        Suggestion suggestion = session.getCritique().findSuggestion(suggestionId)
                .orElseThrow(() -> new SuggestionNotFoundException(reviewId, suggestionId));

        ApplyResult result = onDocument(targetPath(session, suggestion), document -> {
            SuggestionState current = session.stateOf(suggestionId);
            if (current.isTerminal()) {
                return ApplyResult.alreadyResolved(suggestionId, current);
            }
            ApplyResult attempt = suggestionApplicator.applySuggestion(suggestion, document);
            session.recordState(suggestionId, attempt.outcome().state());
            return attempt;
        });
        log.info("Apply - review: {}, suggestion: {}, outcome: {}", reviewId, suggestionId, result.outcome());
        return result;
    }

    /**
     * Applies the given suggestions, or every appliable suggestion not yet in a terminal state when
     * {@code suggestionIds} is empty. Requested suggestions already in a terminal state are reported
     * as {@link com.draftreview.infrastructure.document.ApplyOutcome#ALREADY_RESOLVED} and skipped.
     */
    public BatchApplyResult applySuggestions(String reviewId, List<String> suggestionIds) {
        ReviewSession session = reviewSessionStore.get(reviewId);
        Critique critique = session.getCritique();

        List<Suggestion> requested = new ArrayList<>();
        if (suggestionIds == null || suggestionIds.isEmpty()) {
            critique.suggestions().stream()
                    .filter(Suggestion::isAppliable)
                    .forEach(requested::add);
        } else {
            for (String id : new LinkedHashSet<>(suggestionIds)) {
                requested.add(critique.findSuggestion(id)
                        .orElseThrow(() -> new SuggestionNotFoundException(reviewId, id)));
            }
        }
        boolean explicit = suggestionIds != null && !suggestionIds.isEmpty();

        BatchApplyResult batch = onDocument(critique.sourcePath(), document -> {
            List<Suggestion> selected = new ArrayList<>();
            List<ApplyResult> refused = new ArrayList<>();
            for (Suggestion suggestion : requested) {
                SuggestionState current = session.stateOf(suggestion.id());
                if (!current.isTerminal()) {
                    selected.add(suggestion);
                } else if (explicit) {
                    refused.add(ApplyResult.alreadyResolved(suggestion.id(), current));
                }
            }

            BatchApplyResult applied = suggestionApplicator.applyAll(selected, document,
                    (current, total, suggestion) -> log.debug("Applying {}/{} - suggestion: {}, line: {}",
                            current, total, suggestion.id(), suggestion.displayLine()));
            applied.results().forEach(r -> session.recordState(r.suggestionId(), r.outcome().state()));

            if (refused.isEmpty()) {
                return applied;
            }
            List<ApplyResult> results = new ArrayList<>(refused);
            results.addAll(applied.results());
            return new BatchApplyResult(results, applied.successCount(), applied.failureCount());
        });

        log.info("Batch apply - review: {}, requested: {}, succeeded: {}, failed: {}",
                reviewId, requested.size(), batch.successCount(), batch.failureCount());
        return batch;
    }

    private static String targetPath(ReviewSession session, Suggestion suggestion) {
        return suggestion.filePath() != null ? suggestion.filePath() : session.getCritique().sourcePath();
    }

    /**
     * Runs {@code action} under the document's lock. The action receives null when no path is known and
     * a never-writable placeholder when the file cannot be opened.
     */
    private <T> T onDocument(String path, Function<EditableDocument, T> action) {
        if (path == null) {
            return action.apply(null);
        }
        try {
            return documentWorkspace.withDocument(path,
                    document -> action.apply(document.orElseGet(() -> new UnavailableDocument(path))));
        } catch (DocumentAccessException e) {
            log.warn("Cannot open {} for apply: {}", path, e.getMessage());
            return action.apply(new UnavailableDocument(path));
        }
    }
}
