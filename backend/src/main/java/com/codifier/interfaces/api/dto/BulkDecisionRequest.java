package com.codifier.interfaces.api.dto;

import com.codifier.domain.review.model.Decision;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

public record BulkDecisionRequest(
        @NotEmpty(message = "At least one change id is required")
        List<String> changeIds,

        @NotNull(message = "Decision is required")
        Decision decision,

        @NotBlank(message = "Reviewer id is required")
        String reviewerId,

        @Size(max = 2000, message = "Comment must not exceed 2000 characters")
        String comment
) {}
