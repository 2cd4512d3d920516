package com.draftreview.interfaces.api.review;

import com.draftreview.application.review.ReviewAppService;
import com.draftreview.application.review.ReviewCommand;
import com.draftreview.application.review.ReviewSession;
import com.draftreview.infrastructure.document.ApplyResult;
import com.draftreview.infrastructure.document.BatchApplyResult;
import com.draftreview.interfaces.api.dto.ApplyBatchRequest;
import com.draftreview.interfaces.api.dto.ReviewRequest;
import com.draftreview.interfaces.api.dto.ReviewResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/reviews")
@RequiredArgsConstructor
public class ReviewController {

    private final ReviewAppService reviewAppService;

    @PostMapping
    public ResponseEntity<ReviewResponse> review(@Valid @RequestBody ReviewRequest request) {
        ReviewSession session = reviewAppService.review(new ReviewCommand(
                request.filePath(),
                request.diff(),
                request.fullText(),
                request.analysis()));

        return ResponseEntity.ok(ReviewResponse.from(session));
    }

    @GetMapping("/{reviewId}")
    public ResponseEntity<ReviewResponse> getReview(@PathVariable String reviewId) {
        return ResponseEntity.ok(ReviewResponse.from(reviewAppService.getSession(reviewId)));
    }

    @PostMapping("/{reviewId}/suggestions/{suggestionId}/apply")
    public ResponseEntity<ApplyResult> applySuggestion(@PathVariable String reviewId,
                                                       @PathVariable String suggestionId) {
        return ResponseEntity.ok(reviewAppService.applySuggestion(reviewId, suggestionId));
    }

    @PostMapping("/{reviewId}/apply")
    public ResponseEntity<BatchApplyResult> applySuggestions(@PathVariable String reviewId,
                                                             @Valid @RequestBody(required = false) ApplyBatchRequest request) {
        BatchApplyResult result = reviewAppService.applySuggestions(reviewId,
                request != null ? request.suggestionIds() : null);
        return ResponseEntity.ok(result);
    }
}
