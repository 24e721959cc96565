package com.codifier.domain.apply.model;

import com.codifier.domain.act.model.ActLine;

import java.util.List;

/**
 * One edit recorded while applying: at {@code position} of the version it was applied to,
 * {@code removed} lines were replaced by {@code inserted} lines. Undoing it puts {@code removed} back.
 */
public record PatchHunk(int position, List<ActLine> removed, List<ActLine> inserted) {

    public PatchHunk {
        removed = List.copyOf(removed);
        inserted = List.copyOf(inserted);
    }
}
