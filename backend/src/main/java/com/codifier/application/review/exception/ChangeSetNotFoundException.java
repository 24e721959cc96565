package com.codifier.application.review.exception;

public class ChangeSetNotFoundException extends RuntimeException {
    public ChangeSetNotFoundException(String changeSetId) {
        super("ChangeSet not found: " + changeSetId);
    }
}
