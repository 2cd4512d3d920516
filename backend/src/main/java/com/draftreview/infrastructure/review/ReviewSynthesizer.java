package com.draftreview.infrastructure.review;

import com.draftreview.domain.review.model.BackendResponse;
import com.draftreview.domain.review.model.Critique;
import com.draftreview.domain.review.model.DiffAnalysis;
import com.draftreview.domain.review.model.RawCritique;
import com.draftreview.domain.review.model.ReviewContext;
import com.draftreview.domain.review.service.ReviewBackend;
import com.draftreview.infrastructure.ai.BackendErrorCode;
import com.draftreview.infrastructure.ai.ProviderResolution;
import com.draftreview.infrastructure.ai.ProviderResolver;
import com.draftreview.infrastructure.ai.ReviewBackendException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Optional;

/**
 * Produces a critique for a revision: from the backend when one is available, otherwise (or when
 * the backend fails in any way) from the rule-based reviewer. Never throws.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReviewSynthesizer {

    private final ProviderResolver providerResolver;
    private final CritiqueNormalizer critiqueNormalizer;
    private final RuleBasedReviewer ruleBasedReviewer;

    private ProviderResolution resolution;

    public Critique generateReview(DiffAnalysis analysis, String filePath, String fullText) {
        Optional<ReviewBackend> backend = activeBackend();

        if (backend.isPresent() && StringUtils.hasText(fullText)) {
            try {
                BackendResponse<RawCritique> response =
                        backend.get().reviewText(fullText, ReviewContext.forPath(filePath));
                log.info("[ReviewSynthesizer] Backend review completed - model: {}, cached: {}, tokens: {}",
                        response.modelId(), response.cached(), response.tokenUsage().totalTokens());
                return critiqueNormalizer.normalize(response.data()).withProvenance(filePath, null);
            } catch (RuntimeException e) {
                log.warn("[ReviewSynthesizer] Backend review failed, falling back to rule-based review: {}",
                        e.getMessage());
            }
        } else {
            log.info("[ReviewSynthesizer] Using rule-based review ({})",
                    backend.isEmpty() ? "no backend available" : "no document text provided");
        }

        return ruleBasedReviewer.review(analysis, fullText).withProvenance(filePath, null);
    }

    /**
     * Backend from the cached resolution, resolving on first use.
     */
    public synchronized Optional<ReviewBackend> activeBackend() {
        if (resolution == null) {
            try {
                resolution = providerResolver.resolve();
            } catch (RuntimeException e) {
                resolution = new ProviderResolution.Failed(new ReviewBackendException(
                        BackendErrorCode.INVALID_CONFIGURATION, "Provider resolution failed: " + e.getMessage(), e));
            }
            report(resolution);
        }
        return resolution.readyBackend();
    }

    /**
     * Drops the cached resolution; the next review resolves the provider again.
     */
    public synchronized void reloadProvider() {
        resolution = null;
        log.info("[ReviewSynthesizer] Provider resolution cleared");
    }

    private void report(ProviderResolution outcome) {
        if (outcome instanceof ProviderResolution.Ready ready) {
            log.info("[ReviewSynthesizer] Backend ready - provider: {}, model: {}",
                    ready.backend().providerKey(), ready.backend().modelId());
        } else if (outcome instanceof ProviderResolution.CredentialMissing missing) {
            log.info("[ReviewSynthesizer] No credential stored for provider {}, using rule-based reviews",
                    missing.providerKey());
        } else if (outcome instanceof ProviderResolution.Disabled) {
            log.info("[ReviewSynthesizer] No review backend configured, using rule-based reviews");
        } else if (outcome instanceof ProviderResolution.Failed failed) {
            log.warn("[ReviewSynthesizer] Backend initialization failed - code: {}, message: {}",
                    failed.error().getCode(), failed.error().getMessage());
        }
    }
}
