package com.codifier.domain.amendment.model;

/**
 * One paragraph-level instruction of an amendment.
 *
 * @param index    zero-based position within the amendment
 * @param text     verbatim instruction text
 * @param location page and paragraph in the source document
 */
public record InstructionSpan(int index, String text, SourceLocation location) {

    public InstructionSpan {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Instruction span " + index + " has no text");
        }
    }
}
