package com.draftreview.interfaces.api.review;

import com.draftreview.application.review.ReviewAppService;
import com.draftreview.domain.review.model.DiffAnalysis;
import com.draftreview.interfaces.api.dto.AnalysisRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/analysis")
@RequiredArgsConstructor
public class AnalysisController {

    private final ReviewAppService reviewAppService;

    @PostMapping
    public ResponseEntity<DiffAnalysis> analyze(@Valid @RequestBody AnalysisRequest request) {
        return ResponseEntity.ok(reviewAppService.analyze(request.diff(), request.fullText(), request.filePath()));
    }
}
