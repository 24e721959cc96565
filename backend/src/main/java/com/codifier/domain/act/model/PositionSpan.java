package com.codifier.domain.act.model;

/**
 * Inclusive index interval of a {@link LineRange} inside one specific Act version.
 */
public record PositionSpan(int start, int end) {

    public boolean overlaps(PositionSpan other) {
        return start <= other.end && other.start <= end;
    }

    public int size() {
        return end - start + 1;
    }
}
