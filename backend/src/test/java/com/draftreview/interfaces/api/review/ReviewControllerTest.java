package com.draftreview.interfaces.api.review;

import com.draftreview.application.review.ReviewAppService;
import com.draftreview.application.review.ReviewCommand;
import com.draftreview.application.review.ReviewSession;
import com.draftreview.application.review.exception.ReviewSessionNotFoundException;
import com.draftreview.domain.document.DocumentAccessException;
import com.draftreview.domain.review.model.Critique;
import com.draftreview.domain.review.model.DiffAnalysis;
import com.draftreview.domain.review.model.Suggestion;
import com.draftreview.domain.review.model.SuggestionKind;
import com.draftreview.domain.review.model.TextAnchor;
import com.draftreview.infrastructure.document.ApplyOutcome;
import com.draftreview.infrastructure.document.ApplyResult;
import com.draftreview.infrastructure.document.BatchApplyResult;
import com.draftreview.infrastructure.document.SuggestionState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = {ReviewController.class, AnalysisController.class})
class ReviewControllerTest {

    private static final Suggestion SUGGESTION = new Suggestion("s1", SuggestionKind.STYLE, 2,
            TextAnchor.singleLine(1, 0, 5), "结尾很感人", "结尾感人", "精简表达", "docs/story.md", 1);

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ReviewAppService reviewAppService;

    private static ReviewSession session() {
        Critique critique = new Critique("整体质量良好", List.of("清晰"), List.of("暂无明显问题"),
                List.of(SUGGESTION), 8, "docs/story.md", 1);
        return new ReviewSession("r1", critique, Instant.parse("2024-03-01T10:00:00Z"),
                Instant.parse("2024-03-01T12:00:00Z"));
    }

    @Nested
    @DisplayName("POST /api/v1/reviews")
    class CreateReview {

        @Test
        @DisplayName("리뷰 id와 앵커 포함 리뷰 반환")
        void create_review() throws Exception {
            when(reviewAppService.review(any(ReviewCommand.class))).thenReturn(session());

            mockMvc.perform(post("/api/v1/reviews")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"filePath\":\"docs/story.md\",\"diff\":\"+结尾很感人\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.reviewId").value("r1"))
                    .andExpect(jsonPath("$.critique.rating").value(8))
                    .andExpect(jsonPath("$.critique.suggestions[0].anchor.startLine").value(1))
                    .andExpect(jsonPath("$.critique.suggestions[0].anchor.endColumn").value(5))
                    .andExpect(jsonPath("$.critique.suggestions[0].replacementText").value("结尾感人"))
                    .andExpect(jsonPath("$.appliedSuggestionIds").isEmpty());

            ArgumentCaptor<ReviewCommand> command = ArgumentCaptor.forClass(ReviewCommand.class);
            verify(reviewAppService).review(command.capture());
            assertThat(command.getValue().filePath()).isEqualTo("docs/story.md");
            assertThat(command.getValue().diff()).isEqualTo("+结尾很感人");
            assertThat(command.getValue().analysis()).isNull();
        }

        @Test
        @DisplayName("미리 계산된 분석 결과 그대로 전달")
        void create_review_with_analysis() throws Exception {
            when(reviewAppService.review(any(ReviewCommand.class))).thenReturn(session());

            mockMvc.perform(post("/api/v1/reviews")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                    {"analysis": {"summary": "添加了 1 行", "additions": 1, "deletions": 0,
                                      "modifications": 0, "semanticChanges": [],
                                      "consistencyReport": {"score": 90, "issues": [], "suggestions": []}}}
                                    """))
                    .andExpect(status().isOk());

            ArgumentCaptor<ReviewCommand> command = ArgumentCaptor.forClass(ReviewCommand.class);
            verify(reviewAppService).review(command.capture());
            DiffAnalysis analysis = command.getValue().analysis();
            assertThat(analysis.additions()).isEqualTo(1);
            assertThat(analysis.consistencyReport().score()).isEqualTo(90);
        }

        @Test
        @DisplayName("입력 누락 → 400")
        void create_review_invalid_argument() throws Exception {
            when(reviewAppService.review(any(ReviewCommand.class)))
                    .thenThrow(new IllegalArgumentException("Either a diff or a diff analysis is required"));

            mockMvc.perform(post("/api/v1/reviews")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
        }

        @Test
        @DisplayName("워크스페이스 밖 경로 → DOCUMENT_ACCESS_ERROR")
        void create_review_bad_path() throws Exception {
            when(reviewAppService.review(any(ReviewCommand.class)))
                    .thenThrow(new DocumentAccessException("Document path escapes the workspace: ../x.md"));

            mockMvc.perform(post("/api/v1/reviews")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"filePath\":\"../x.md\",\"diff\":\"+x\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("DOCUMENT_ACCESS_ERROR"));
        }
    }

    @Test
    @DisplayName("GET → 제안 상태 포함 세션 반환")
    void get_review() throws Exception {
        ReviewSession session = session();
        session.recordState("s1", SuggestionState.APPLIED);
        when(reviewAppService.getSession("r1")).thenReturn(session);

        mockMvc.perform(get("/api/v1/reviews/r1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.appliedSuggestionIds[0]").value("s1"))
                .andExpect(jsonPath("$.suggestionStates.s1").value("APPLIED"))
                .andExpect(jsonPath("$.expiresAt").exists());
    }

    @Test
    @DisplayName("없거나 만료된 리뷰 → 404")
    void get_review_not_found() throws Exception {
        when(reviewAppService.getSession(anyString())).thenThrow(new ReviewSessionNotFoundException("gone"));

        mockMvc.perform(get("/api/v1/reviews/gone"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("REVIEW_NOT_FOUND"));
    }

    @Test
    @DisplayName("적용 결과 반환, null error 필드 생략")
    void apply_suggestion() throws Exception {
        when(reviewAppService.applySuggestion("r1", "s1")).thenReturn(
                new ApplyResult(true, "s1", "Suggestion applied successfully", null, ApplyOutcome.APPLIED));

        mockMvc.perform(post("/api/v1/reviews/r1/suggestions/s1/apply"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.outcome").value("APPLIED"))
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    @DisplayName("본문 없는 일괄 적용 → 남은 제안 전부 적용")
    void apply_all_without_body() throws Exception {
        when(reviewAppService.applySuggestions(eq("r1"), isNull())).thenReturn(new BatchApplyResult(List.of(), 0, 0));

        mockMvc.perform(post("/api/v1/reviews/r1/apply"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.successCount").value(0));
    }

    @Test
    @DisplayName("일괄 적용 → 요청한 id 전달")
    void apply_selected() throws Exception {
        when(reviewAppService.applySuggestions("r1", List.of("s1"))).thenReturn(new BatchApplyResult(
                List.of(new ApplyResult(false, "s1", "Suggestion no longer applicable", "changed", ApplyOutcome.STALE)),
                0, 1));

        mockMvc.perform(post("/api/v1/reviews/r1/apply")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"suggestionIds\":[\"s1\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.failureCount").value(1))
                .andExpect(jsonPath("$.results[0].outcome").value("STALE"));
    }

    @Nested
    @DisplayName("POST /api/v1/analysis")
    class Analysis {

        @Test
        @DisplayName("빈 diff → 검증 실패")
        void blank_diff() throws Exception {
            mockMvc.perform(post("/api/v1/analysis")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"diff\":\"  \"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                    .andExpect(jsonPath("$.message").value("Diff is required"));
        }

        @Test
        @DisplayName("분석 결과 반환")
        void analyze() throws Exception {
            when(reviewAppService.analyze("+新内容", null, "a.md"))
                    .thenReturn(new DiffAnalysis("添加了 1 行", 1, 0, 0, List.of(), null));

            mockMvc.perform(post("/api/v1/analysis")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"diff\":\"+新内容\",\"filePath\":\"a.md\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.summary").value("添加了 1 行"))
                    .andExpect(jsonPath("$.consistencyReport.score").value(80));
        }
    }
}
