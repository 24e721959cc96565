package com.codifier.domain.change.model;

/**
 * Kind of edit an amendment instruction asks for.
 *
 * <p>Each kind fixes which text fields an intent must carry:
 * <pre>
 *   kind            originalText    newText
 *   SUBSTITUTION    optional(*)     required
 *   INSERTION       absent          required
 *   DELETION        optional(*)     absent
 *   RENUMBERING     required        required     (old and new reference)
 *   GLOBAL_REPLACE  required        required
 *   UNCLASSIFIED    absent          absent
 * </pre>
 * (*) absent means the whole addressed unit.
 */
public enum ChangeKind {
    SUBSTITUTION(Field.OPTIONAL, Field.REQUIRED),
    INSERTION(Field.ABSENT, Field.REQUIRED),
    DELETION(Field.OPTIONAL, Field.ABSENT),
    RENUMBERING(Field.REQUIRED, Field.REQUIRED),
    GLOBAL_REPLACE(Field.REQUIRED, Field.REQUIRED),
    UNCLASSIFIED(Field.ABSENT, Field.ABSENT);

    enum Field { REQUIRED, OPTIONAL, ABSENT }

    private final Field originalText;
    private final Field newText;

    ChangeKind(Field originalText, Field newText) {
        this.originalText = originalText;
        this.newText = newText;
    }

    Field originalText() {
        return originalText;
    }

    Field newText() {
        return newText;
    }

    /**
     * Kinds whose edits change lines (everything but renumbering, which only relabels).
     */
    public boolean isStructural() {
        return this != RENUMBERING && this != UNCLASSIFIED;
    }
}
