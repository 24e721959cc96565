package com.codifier.interfaces.api.dto;

import com.codifier.domain.review.model.Decision;
import com.codifier.domain.review.model.ReviewState;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record DecisionRequest(
        @NotNull(message = "Decision is required")
        Decision decision,

        @NotBlank(message = "Reviewer id is required")
        String reviewerId,

        @NotNull(message = "Expected state is required")
        ReviewState expectedState,

        @Size(max = 2000, message = "Comment must not exceed 2000 characters")
        String comment
) {}
