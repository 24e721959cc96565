package com.codifier.interfaces.api.dto;

import com.codifier.domain.amendment.model.Amendment;

import java.time.Instant;
import java.util.List;

public record AmendmentResponse(
        String amendmentId,
        String title,
        String amendmentNumber,
        String targetAct,
        List<Span> spans,
        Instant receivedAt
) {
    public record Span(int index, String text, int page, int paragraph) {}

    public static AmendmentResponse from(Amendment amendment) {
        List<Span> spans = amendment.spans().stream()
                .map(s -> new Span(s.index(), s.text(), s.location().page(), s.location().paragraph()))
                .toList();
        return new AmendmentResponse(amendment.amendmentId(), amendment.title(), amendment.amendmentNumber(),
                amendment.targetAct(), spans, amendment.receivedAt());
    }
}
