package com.codifier.domain.change.model;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Counts over a ChangeSet, for reviewers and reports.
 */
public record ChangeSetSummary(
        int totalChanges,
        Map<ChangeKind, Integer> countsByKind,
        double averageConfidence,
        int highConfidenceChanges,
        int requiresReview,
        int unresolvedChanges
) {
    public static ChangeSetSummary of(List<ChangeRecord> records) {
        Map<ChangeKind, Integer> byKind = new EnumMap<>(ChangeKind.class);
        int high = 0;
        int review = 0;
        int unresolved = 0;
        long scoreSum = 0;
        for (ChangeRecord record : records) {
            byKind.merge(record.kind(), 1, Integer::sum);
            scoreSum += record.confidence().score();
            if (record.confidence().level() == ConfidenceLevel.HIGH) high++;
            if (record.reviewRequirement() != ReviewRequirement.AUTO_ACCEPT_ELIGIBLE) review++;
            if (!record.isResolved()) unresolved++;
        }
        double average = records.isEmpty() ? 0.0 : (double) scoreSum / records.size();
        return new ChangeSetSummary(records.size(), Map.copyOf(byKind), average, high, review, unresolved);
    }
}
