package com.codifier.application.apply.exception;

import lombok.Getter;

/**
 * The document or ChangeSet is not in a state the requested apply operation can start from.
 */
@Getter
public class ApplyPreconditionException extends RuntimeException {

    public static final String NOTHING_ACCEPTED = "NOTHING_ACCEPTED";
    public static final String NOTHING_TO_REVERT = "NOTHING_TO_REVERT";
    public static final String NOT_APPLIED = "NOT_APPLIED";

    private final String code;

    public ApplyPreconditionException(String code, String message) {
        super(message);
        this.code = code;
    }
}
