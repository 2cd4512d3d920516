package com.draftreview.infrastructure.review;

import com.draftreview.domain.review.model.BackendResponse;
import com.draftreview.domain.review.model.DiffAnalysis;
import com.draftreview.domain.review.model.ReviewContext;
import com.draftreview.domain.review.service.ReviewBackend;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Builds the diff analysis a review is based on, preferring the backend and falling back to
 * {@link RuleBasedDiffAnalyzer}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DiffAnalysisService {

    private final ReviewSynthesizer reviewSynthesizer;
    private final RuleBasedDiffAnalyzer ruleBasedDiffAnalyzer;

    public DiffAnalysis analyze(String diff, String fullText, String filePath) {
        Optional<ReviewBackend> backend = reviewSynthesizer.activeBackend();
        if (backend.isPresent()) {
            try {
                BackendResponse<DiffAnalysis> response = backend.get().analyzeDiff(diff, ReviewContext.forPath(filePath));
                log.info("[DiffAnalysisService] Backend analysis completed - model: {}, changes: {}",
                        response.modelId(), response.data().semanticChanges().size());
                return response.data();
            } catch (RuntimeException e) {
                log.warn("[DiffAnalysisService] Backend analysis failed, using rule-based analysis: {}", e.getMessage());
            }
        }
        return ruleBasedDiffAnalyzer.analyze(diff, fullText);
    }
}
