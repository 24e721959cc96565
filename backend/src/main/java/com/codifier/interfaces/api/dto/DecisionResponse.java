package com.codifier.interfaces.api.dto;

import com.codifier.domain.review.model.Decision;
import com.codifier.domain.review.model.ReviewDecision;
import com.codifier.domain.review.model.ReviewState;

import java.time.Instant;

public record DecisionResponse(
        String decisionId,
        String changeId,
        Decision decision,
        ReviewState resultingState,
        String reviewerId,
        String comment,
        Instant decidedAt,
        String batchId,
        boolean active
) {
    public static DecisionResponse from(ReviewDecision d) {
        return new DecisionResponse(d.decisionId(), d.changeId(), d.decision(), d.decision().targetState(),
                d.reviewerId(), d.comment(), d.decidedAt(), d.batchId(), d.active());
    }
}
