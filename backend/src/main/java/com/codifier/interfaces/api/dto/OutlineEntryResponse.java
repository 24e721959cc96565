package com.codifier.interfaces.api.dto;

import com.codifier.domain.act.model.ActOutlineEntry;

public record OutlineEntryResponse(
        String sectionPath,
        String heading,
        String contentPreview,
        long startLineId,
        long endLineId,
        int lineCount
) {
    public static OutlineEntryResponse from(ActOutlineEntry entry) {
        return new OutlineEntryResponse(entry.sectionPath().toString(), entry.heading(), entry.contentPreview(),
                entry.range().startLineId(), entry.range().endLineId(), entry.lineCount());
    }
}
