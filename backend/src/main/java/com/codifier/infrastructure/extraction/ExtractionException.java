package com.codifier.infrastructure.extraction;

/**
 * An extraction pass could not produce a ChangeSet.
 */
public class ExtractionException extends RuntimeException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
