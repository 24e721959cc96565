package com.codifier.domain.review.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Review state of a change record, derived from its latest active decision.
 *
 * <pre>
 *   PENDING  → ACCEPTED | REJECTED | FLAGGED
 *   FLAGGED  → ACCEPTED | REJECTED | PENDING (reopen)
 *   ACCEPTED → REJECTED | FLAGGED
 *   REJECTED → ACCEPTED | FLAGGED
 * </pre>
 */
public enum ReviewState {
    PENDING,
    ACCEPTED,
    REJECTED,
    FLAGGED;

    public Set<Decision> allowedDecisions() {
        return switch (this) {
            case PENDING -> EnumSet.of(Decision.ACCEPTED, Decision.REJECTED, Decision.FLAGGED);
            case FLAGGED -> EnumSet.of(Decision.ACCEPTED, Decision.REJECTED, Decision.REOPENED);
            case ACCEPTED -> EnumSet.of(Decision.REJECTED, Decision.FLAGGED);
            case REJECTED -> EnumSet.of(Decision.ACCEPTED, Decision.FLAGGED);
        };
    }

    public boolean allows(Decision decision) {
        return allowedDecisions().contains(decision);
    }

    /**
     * Records still awaiting a reviewer: pending ones and flagged ones.
     */
    public boolean isOpen() {
        return this == PENDING || this == FLAGGED;
    }
}
