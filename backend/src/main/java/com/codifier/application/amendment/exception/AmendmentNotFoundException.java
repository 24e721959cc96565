package com.codifier.application.amendment.exception;

public class AmendmentNotFoundException extends RuntimeException {
    public AmendmentNotFoundException(String amendmentId) {
        super("Amendment not found: " + amendmentId);
    }
}
