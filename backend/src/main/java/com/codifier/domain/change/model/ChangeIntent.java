package com.codifier.domain.change.model;

import com.codifier.domain.amendment.model.SourceLocation;

/**
 * A classified, not yet located edit extracted from one instruction span.
 *
 * <p>A closed variant over {@link ChangeKind}: the per-kind field rules are enforced here, so an
 * intent that exists is well formed. {@code sourceCitation} is mandatory for every kind; it is
 * the verbatim instruction the edit was read from.
 *
 * @param kind            edit kind
 * @param targetReference reference as written, e.g. "Section 15(2)" (nullable only for UNCLASSIFIED)
 * @param originalText    text to replace or remove; old reference for renumbering
 * @param newText         replacement or inserted text; new reference for renumbering
 * @param sourceCitation  verbatim instruction text
 * @param spanIndex       index of the originating span in the amendment
 * @param location        page/paragraph of the originating span
 */
public record ChangeIntent(
        ChangeKind kind,
        String targetReference,
        String originalText,
        String newText,
        String sourceCitation,
        int spanIndex,
        SourceLocation location
) {
    public ChangeIntent {
        if (kind == null) {
            throw new IllegalArgumentException("Change kind is required");
        }
        if (sourceCitation == null || sourceCitation.isBlank()) {
            throw new IllegalArgumentException("Source citation is required for " + kind);
        }
        targetReference = blankToNull(targetReference);
        originalText = blankToNull(originalText);
        newText = blankToNull(newText);
        if (kind != ChangeKind.UNCLASSIFIED && targetReference == null) {
            throw new IllegalArgumentException("Target reference is required for " + kind);
        }
        check(kind, "originalText", kind.originalText(), originalText);
        check(kind, "newText", kind.newText(), newText);
    }

    public static ChangeIntent substitution(String reference, String originalText, String newText,
                                            String citation, int spanIndex, SourceLocation location) {
        return new ChangeIntent(ChangeKind.SUBSTITUTION, reference, originalText, newText, citation, spanIndex, location);
    }

    public static ChangeIntent insertion(String reference, String newText,
                                         String citation, int spanIndex, SourceLocation location) {
        return new ChangeIntent(ChangeKind.INSERTION, reference, null, newText, citation, spanIndex, location);
    }

    public static ChangeIntent deletion(String reference, String originalText,
                                        String citation, int spanIndex, SourceLocation location) {
        return new ChangeIntent(ChangeKind.DELETION, reference, originalText, null, citation, spanIndex, location);
    }

    public static ChangeIntent renumbering(String reference, String newReference,
                                           String citation, int spanIndex, SourceLocation location) {
        return new ChangeIntent(ChangeKind.RENUMBERING, reference, reference, newReference, citation, spanIndex, location);
    }

    public static ChangeIntent globalReplace(String scope, String originalText, String newText,
                                             String citation, int spanIndex, SourceLocation location) {
        return new ChangeIntent(ChangeKind.GLOBAL_REPLACE, scope, originalText, newText, citation, spanIndex, location);
    }

    public static ChangeIntent unclassified(String reference, String citation, int spanIndex, SourceLocation location) {
        return new ChangeIntent(ChangeKind.UNCLASSIFIED, reference, null, null, citation, spanIndex, location);
    }

    private static void check(ChangeKind kind, String name, ChangeKind.Field rule, String value) {
        if (rule == ChangeKind.Field.REQUIRED && value == null) {
            throw new IllegalArgumentException(name + " is required for " + kind);
        }
        if (rule == ChangeKind.Field.ABSENT && value != null) {
            throw new IllegalArgumentException(name + " must be empty for " + kind);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }
}
