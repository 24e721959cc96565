package com.codifier.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * Instructions come either as explicit {@code paragraphs} or as raw {@code text} to be segmented.
 */
public record RegisterAmendmentRequest(
        @NotBlank(message = "Title is required")
        String title,

        String amendmentNumber,

        String targetAct,

        List<String> paragraphs,

        String text
) {}
