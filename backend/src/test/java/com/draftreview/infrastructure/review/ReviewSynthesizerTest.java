package com.draftreview.infrastructure.review;

import com.draftreview.domain.review.model.BackendResponse;
import com.draftreview.domain.review.model.ConsistencyReport;
import com.draftreview.domain.review.model.Critique;
import com.draftreview.domain.review.model.DiffAnalysis;
import com.draftreview.domain.review.model.RawCritique;
import com.draftreview.domain.review.model.ReviewContext;
import com.draftreview.domain.review.model.TokenUsage;
import com.draftreview.domain.review.service.ReviewBackend;
import com.draftreview.infrastructure.ai.BackendErrorCode;
import com.draftreview.infrastructure.ai.ProviderResolution;
import com.draftreview.infrastructure.ai.ProviderResolver;
import com.draftreview.infrastructure.ai.ReviewBackendException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReviewSynthesizerTest {

    private static final DiffAnalysis ANALYSIS = new DiffAnalysis("添加了 3 行", 3, 0, 0, List.of(),
            new ConsistencyReport(90, List.of(), List.of()));

    @Mock
    private ProviderResolver providerResolver;

    @Mock
    private ReviewBackend backend;

    private ReviewSynthesizer synthesizer;

    @BeforeEach
    void setUp() {
        synthesizer = new ReviewSynthesizer(providerResolver, new CritiqueNormalizer(),
                new RuleBasedReviewer(new TextLocator(), new IntensifierRewriter()));
    }

    @Test
    @DisplayName("백엔드 미설정 → 규칙 기반 리뷰, 파일 경로 기록")
    void generateReview_disabled_uses_rules() {
        when(providerResolver.resolve()).thenReturn(new ProviderResolution.Disabled());

        Critique critique = synthesizer.generateReview(ANALYSIS, "docs/a.md", "text");

        assertThat(critique.overallAssessment()).startsWith(RuleBasedReviewer.OVERALL_EXCELLENT);
        assertThat(critique.sourcePath()).isEqualTo("docs/a.md");
    }

    @Test
    @DisplayName("프로바이더 해석 결과는 reloadProvider 전까지 캐시")
    void activeBackend_resolves_once() {
        when(providerResolver.resolve()).thenReturn(new ProviderResolution.CredentialMissing("openai"));

        synthesizer.generateReview(ANALYSIS, null, "text");
        synthesizer.generateReview(ANALYSIS, null, "text");
        verify(providerResolver, times(1)).resolve();

        synthesizer.reloadProvider();
        synthesizer.generateReview(ANALYSIS, null, "text");
        verify(providerResolver, times(2)).resolve();
    }

    @Test
    @DisplayName("백엔드 리뷰 → 정규화")
    void generateReview_backend_success() {
        when(providerResolver.resolve()).thenReturn(new ProviderResolution.Ready(backend));
        when(backend.reviewText(eq("full text"), any(ReviewContext.class))).thenReturn(new BackendResponse<>(
                new RawCritique("很好的修改", List.of("清晰"), List.of(), List.of(), 8.0),
                "gpt-4", new TokenUsage(100, 50), false));

        Critique critique = synthesizer.generateReview(ANALYSIS, "docs/a.md", "full text");

        assertThat(critique.overallAssessment()).isEqualTo("很好的修改");
        assertThat(critique.strengths()).containsExactly("清晰");
        assertThat(critique.improvements()).containsExactly(ReviewPlaceholders.IMPROVEMENT);
        assertThat(critique.rating()).isEqualTo(8);
    }

    @Test
    @DisplayName("백엔드 실패 → 예외 없이 규칙 기반 리뷰로 대체")
    void generateReview_backend_failure_falls_back() {
        when(providerResolver.resolve()).thenReturn(new ProviderResolution.Ready(backend));
        when(backend.reviewText(anyString(), any(ReviewContext.class)))
                .thenThrow(new ReviewBackendException(BackendErrorCode.MAX_RETRIES_EXCEEDED, "Failed after 3 attempts"));

        Critique critique = synthesizer.generateReview(ANALYSIS, null, "text");

        assertThat(critique.overallAssessment()).startsWith(RuleBasedReviewer.OVERALL_EXCELLENT);
        assertThat(critique.rating()).isBetween(Critique.MIN_RATING, Critique.MAX_RATING);
    }

    @Test
    @DisplayName("문서 텍스트 없음 → 백엔드 호출 없음")
    void generateReview_without_text_skips_backend() {
        when(providerResolver.resolve()).thenReturn(new ProviderResolution.Ready(backend));

        synthesizer.generateReview(ANALYSIS, null, null);

        verify(backend, never()).reviewText(any(), any());
    }

    @Test
    @DisplayName("프로바이더 해석 중 예외 → 규칙 기반 리뷰로 대체")
    void generateReview_resolver_throws() {
        when(providerResolver.resolve()).thenThrow(new IllegalStateException("credential store unavailable"));

        Critique critique = synthesizer.generateReview(ANALYSIS, "docs/a.md", "text");

        assertThat(critique.overallAssessment()).startsWith(RuleBasedReviewer.OVERALL_EXCELLENT);
        assertThat(synthesizer.activeBackend()).isEmpty();
        verify(providerResolver, times(1)).resolve();
    }

    @Test
    @DisplayName("빈 문서 텍스트 → 백엔드 호출 없음")
    void generateReview_empty_text_skips_backend() {
        when(providerResolver.resolve()).thenReturn(new ProviderResolution.Ready(backend));

        synthesizer.generateReview(ANALYSIS, null, "");

        verify(backend, never()).reviewText(any(), any());
    }

    @Test
    @DisplayName("해석 실패 → 백엔드 없음과 동일하게 동작")
    void generateReview_failed_resolution() {
        when(providerResolver.resolve()).thenReturn(new ProviderResolution.Failed(
                new ReviewBackendException(BackendErrorCode.INVALID_CONFIGURATION, "bad base url")));

        assertThat(synthesizer.activeBackend()).isEmpty();
        assertThat(synthesizer.generateReview(ANALYSIS, null, "text").strengths()).isNotEmpty();
    }
}
