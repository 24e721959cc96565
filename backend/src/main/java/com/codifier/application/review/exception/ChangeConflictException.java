package com.codifier.application.review.exception;

import lombok.Getter;

/**
 * Accepting the change would overlap a range that is already accepted.
 */
@Getter
public class ChangeConflictException extends RuntimeException {

    private final String changeId;
    private final String conflictingChangeId;

    public ChangeConflictException(String changeId, String conflictingChangeId) {
        super(String.format("Change %s overlaps accepted change %s", changeId, conflictingChangeId));
        this.changeId = changeId;
        this.conflictingChangeId = conflictingChangeId;
    }
}
