package com.codifier.domain.apply.model;

import java.util.List;

/**
 * Edits that turned {@code fromVersion} into {@code toVersion}, in application order.
 * Undoing them last-first restores {@code fromVersion} line for line, ids included.
 */
public record ReversePatch(
        String documentId,
        int fromVersion,
        int toVersion,
        List<PatchHunk> hunks
) {
    public ReversePatch {
        hunks = List.copyOf(hunks);
    }
}
