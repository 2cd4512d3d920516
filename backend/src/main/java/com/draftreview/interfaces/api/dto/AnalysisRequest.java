package com.draftreview.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record AnalysisRequest(
        @NotBlank(message = "Diff is required")
        @Size(max = 2_000_000, message = "Diff must not exceed 2,000,000 characters")
        String diff,

        @Size(max = 5_000_000, message = "Full text must not exceed 5,000,000 characters")
        String fullText,

        @Size(max = 1024, message = "File path must not exceed 1024 characters")
        String filePath
) {}
