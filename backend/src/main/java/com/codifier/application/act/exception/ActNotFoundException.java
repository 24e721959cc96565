package com.codifier.application.act.exception;

public class ActNotFoundException extends RuntimeException {

    public ActNotFoundException(String documentId) {
        super("Act not found: " + documentId);
    }

    public ActNotFoundException(String documentId, int version) {
        super("Act " + documentId + " has no version " + version);
    }
}
