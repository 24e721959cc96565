package com.codifier.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;

public record ExtractRequest(
        @NotBlank(message = "Document id is required")
        String documentId
) {}
