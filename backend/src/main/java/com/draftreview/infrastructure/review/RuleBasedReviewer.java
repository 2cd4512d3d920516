package com.draftreview.infrastructure.review;

import com.draftreview.domain.review.model.ConsistencyReport;
import com.draftreview.domain.review.model.Critique;
import com.draftreview.domain.review.model.DiffAnalysis;
import com.draftreview.domain.review.model.SemanticChange;
import com.draftreview.domain.review.model.Suggestion;
import com.draftreview.domain.review.model.SuggestionKind;
import com.draftreview.domain.review.model.TextAnchor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Derives a critique from a diff analysis alone, without a backend.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RuleBasedReviewer {

    static final String STRENGTH_STRUCTURE = "文本结构清晰，逻辑连贯";
    static final String STRENGTH_RICH_CONTENT = "内容扩充充分，信息量丰富";
    static final String STRENGTH_ATTENTIVE = "修改细致，注重细节打磨";

    static final String OVERALL_EXCELLENT = "本次修改整体质量优秀，文本逻辑清晰，表达流畅。";
    static final String OVERALL_GOOD = "本次修改整体质量良好，有一些小问题需要注意。";
    static final String OVERALL_NEEDS_WORK = "本次修改存在一些需要改进的地方，建议仔细审查。";
    static final String CLAUSE_PURE_ADDITION = "主要是内容扩充，注意保持与现有内容的一致性。";
    static final String CLAUSE_DELETION_DOMINANT = "进行了内容精简，注意不要删除关键信息。";

    static final int MAX_SCANNED_CHANGES = 5;

    private final TextLocator textLocator;
    private final IntensifierRewriter intensifierRewriter;

    public Critique review(DiffAnalysis analysis, String fullText) {
        ConsistencyReport report = analysis.consistencyReport();
        List<String> strengths = new ArrayList<>();
        List<Suggestion> suggestions = new ArrayList<>();

        if (report.score() >= 80) {
            strengths.add(STRENGTH_STRUCTURE);
        }
        if (analysis.additions() > analysis.deletions() * 2) {
            strengths.add(STRENGTH_RICH_CONTENT);
        }
        if (analysis.semanticChanges().size() > 5) {
            strengths.add(STRENGTH_ATTENTIVE);
        }

        List<String> improvements = new ArrayList<>(report.issues());

        for (String advice : report.suggestions()) {
            suggestions.add(new Suggestion(UUID.randomUUID().toString(), SuggestionKind.STYLE, 0, TextAnchor.NONE,
                    "", "", advice, null, null));
        }

        analysis.semanticChanges().stream()
                .limit(MAX_SCANNED_CHANGES)
                .filter(change -> change.type() == SemanticChange.ChangeType.ADDITION)
                .filter(change -> intensifierRewriter.containsIntensifier(change.description()))
                .forEach(change -> intensifierSuggestion(change, fullText).ifPresent(suggestions::add));

        int rating = Critique.clampRating(Math.round(report.score() / 10.0
                + strengths.size() * 0.5
                - improvements.size() * 0.3));

        if (strengths.isEmpty()) {
            strengths.add(ReviewPlaceholders.STRENGTH);
        }
        if (improvements.isEmpty()) {
            improvements.add(ReviewPlaceholders.IMPROVEMENT);
        }

        log.debug("[RuleBasedReviewer] score: {}, strengths: {}, improvements: {}, suggestions: {}, rating: {}",
                report.score(), strengths.size(), improvements.size(), suggestions.size(), rating);

        return new Critique(overallFor(analysis), strengths, improvements, suggestions, rating, null, null);
    }

    private Optional<Suggestion> intensifierSuggestion(SemanticChange change, String fullText) {
        String original = change.description();
        String replacement = intensifierRewriter.strip(original);
        if (replacement.equals(original) || replacement.isEmpty()) {
            return Optional.empty();
        }
        TextAnchor anchor = textLocator.locate(fullText, original, change.lineNumber());
        return Optional.of(new Suggestion(UUID.randomUUID().toString(), SuggestionKind.STYLE,
                change.lineNumber() + 1, anchor, original, replacement,
                intensifierRewriter.rationaleFor(original), null, null));
    }

    static String overallFor(DiffAnalysis analysis) {
        int score = analysis.consistencyReport().score();
        StringBuilder overall = new StringBuilder();
        if (score >= 85) {
            overall.append(OVERALL_EXCELLENT);
        } else if (score >= 70) {
            overall.append(OVERALL_GOOD);
        } else {
            overall.append(OVERALL_NEEDS_WORK);
        }

        if (analysis.isPureAddition()) {
            overall.append(CLAUSE_PURE_ADDITION);
        } else if (analysis.isDeletionDominant()) {
            overall.append(CLAUSE_DELETION_DOMINANT);
        }
        return overall.toString();
    }
}
