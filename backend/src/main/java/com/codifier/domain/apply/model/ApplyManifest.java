package com.codifier.domain.apply.model;

import com.codifier.domain.change.model.ChangeKind;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Audit record of one apply: which accepted changes produced which version, and who accepted them.
 */
public record ApplyManifest(
        String changeSetId,
        String documentId,
        int baseVersion,
        int newVersion,
        List<ManifestEntry> entries,
        Map<ChangeKind, Integer> countsByKind,
        Instant appliedAt
) {
    public ApplyManifest {
        entries = List.copyOf(entries);
        countsByKind = Map.copyOf(countsByKind);
    }

    public int appliedCount() {
        return entries.size();
    }
}
