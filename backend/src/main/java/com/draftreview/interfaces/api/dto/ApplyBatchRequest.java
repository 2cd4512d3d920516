package com.draftreview.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * @param suggestionIds suggestions to apply; null or empty applies all remaining appliable suggestions
 */
public record ApplyBatchRequest(
        @Size(max = 500, message = "At most 500 suggestions can be applied at once")
        List<@NotBlank(message = "Suggestion id must not be blank") String> suggestionIds
) {}
