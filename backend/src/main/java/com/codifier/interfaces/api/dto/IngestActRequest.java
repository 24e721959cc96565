package com.codifier.interfaces.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Either {@code lines} (as delivered by the text extractor) or plain {@code text}.
 */
public record IngestActRequest(
        @Size(max = 100, message = "Document id must not exceed 100 characters")
        String documentId,

        @NotBlank(message = "Title is required")
        String title,

        @Valid
        List<Line> lines,

        String text
) {
    public record Line(
            @NotNull(message = "Line text is required")
            String text,

            int page,

            String sectionPathHint
    ) {}
}
