package com.codifier.domain.amendment.model;

/**
 * Where an instruction sits in the amendment document. Used for citation only, never to
 * locate anything in the target Act.
 */
public record SourceLocation(int page, int paragraph) {

    @Override
    public String toString() {
        return "p." + page + " para " + paragraph;
    }
}
