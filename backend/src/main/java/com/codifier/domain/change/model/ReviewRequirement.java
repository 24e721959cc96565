package com.codifier.domain.change.model;

/**
 * Review gate a record must pass before it can be applied. The engine records the
 * requirement; checking a reviewer's role is up to the caller.
 */
public enum ReviewRequirement {
    /** HIGH confidence, no discrepancy: may be pre-selected for acceptance (still logged). */
    AUTO_ACCEPT_ELIGIBLE,
    /** Needs one explicit reviewer decision. */
    REVIEWER,
    /** Needs an explicit decision by a supervisor-level reviewer. */
    SUPERVISOR;

    public static ReviewRequirement of(Confidence confidence, ValidationStatus validation) {
        if (confidence.level() == ConfidenceLevel.LOW) {
            return SUPERVISOR;
        }
        if (confidence.level() == ConfidenceLevel.MEDIUM || validation.hasDiscrepancy()) {
            return REVIEWER;
        }
        return AUTO_ACCEPT_ELIGIBLE;
    }
}
