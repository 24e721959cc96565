package com.codifier.application.review.exception;

public class ChangeNotFoundException extends RuntimeException {
    public ChangeNotFoundException(String changeId) {
        super("Change not found: " + changeId);
    }
}
