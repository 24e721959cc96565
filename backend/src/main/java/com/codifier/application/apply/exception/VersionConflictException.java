package com.codifier.application.apply.exception;

import lombok.Getter;

/**
 * The ChangeSet was extracted against a version that is no longer the head of the document.
 */
@Getter
public class VersionConflictException extends RuntimeException {

    private final String documentId;
    private final int expectedVersion;
    private final int headVersion;

    public VersionConflictException(String documentId, int expectedVersion, int headVersion) {
        super(String.format("Act %s is at version %d, but the ChangeSet targets version %d",
                documentId, headVersion, expectedVersion));
        this.documentId = documentId;
        this.expectedVersion = expectedVersion;
        this.headVersion = headVersion;
    }
}
