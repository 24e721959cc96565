package com.codifier.domain.act.model;

/**
 * Inclusive interval of lines, addressed by line id rather than by index so that it survives
 * edits elsewhere in the document. {@code startLineId} is the first line in document order,
 * {@code endLineId} the last.
 */
public record LineRange(long startLineId, long endLineId) {

    public static LineRange single(long lineId) {
        return new LineRange(lineId, lineId);
    }

    public boolean isSingleLine() {
        return startLineId == endLineId;
    }

    @Override
    public String toString() {
        return isSingleLine() ? "L" + startLineId : "L" + startLineId + "..L" + endLineId;
    }
}
