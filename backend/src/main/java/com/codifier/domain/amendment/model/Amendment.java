package com.codifier.domain.amendment.model;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An amendment document reduced to its ordered instruction spans.
 *
 * @param amendmentId     identifier
 * @param title           document title
 * @param amendmentNumber amendment number/year, if known
 * @param targetAct       name of the Act being amended, if stated
 * @param spans           ordered instruction spans
 * @param receivedAt      registration time
 */
public record Amendment(
        String amendmentId,
        String title,
        String amendmentNumber,
        String targetAct,
        List<InstructionSpan> spans,
        Instant receivedAt
) {
    public Amendment {
        spans = List.copyOf(spans);
    }

    public InstructionSpan span(int index) {
        return spans.get(index);
    }

    /**
     * Full instruction text, spans separated by newlines.
     */
    public String fullText() {
        return spans.stream().map(InstructionSpan::text).collect(Collectors.joining("\n"));
    }
}
