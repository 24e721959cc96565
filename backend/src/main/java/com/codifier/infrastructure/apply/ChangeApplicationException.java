package com.codifier.infrastructure.apply;

import lombok.Getter;

/**
 * An accepted change cannot be applied to the base version. The whole apply is aborted.
 */
@Getter
public class ChangeApplicationException extends RuntimeException {

    private final String changeId;
    private final String code;

    public ChangeApplicationException(String changeId, String message) {
        this(changeId, "UNAPPLICABLE_CHANGE", message);
    }

    protected ChangeApplicationException(String changeId, String code, String message) {
        super(message);
        this.changeId = changeId;
        this.code = code;
    }
}
