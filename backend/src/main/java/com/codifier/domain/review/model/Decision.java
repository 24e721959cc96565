package com.codifier.domain.review.model;

/**
 * A reviewer's verdict on one change record. {@code REOPENED} moves a flagged record back to pending.
 */
public enum Decision {
    ACCEPTED,
    REJECTED,
    FLAGGED,
    REOPENED;

    public ReviewState targetState() {
        return switch (this) {
            case ACCEPTED -> ReviewState.ACCEPTED;
            case REJECTED -> ReviewState.REJECTED;
            case FLAGGED -> ReviewState.FLAGGED;
            case REOPENED -> ReviewState.PENDING;
        };
    }
}
