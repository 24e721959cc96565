package com.codifier.domain.change.model;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * All change records derived from one amendment against one Act version.
 *
 * @param changeSetId   identifier
 * @param amendmentId   source amendment
 * @param documentId    target document
 * @param actVersion    target Act version the records were resolved against
 * @param records       records in extraction order
 * @param coverage      fraction of instruction spans with at least one resolved, classified record
 * @param incomplete    coverage fell below the configured threshold (a warning, never blocking)
 * @param summary       statistics over {@code records}
 * @param notes         processing notes (degraded passes, coverage warnings, ...)
 * @param unparsedSpans indexes of spans that produced only unclassified records
 * @param createdAt     creation time
 */
public record ChangeSet(
        String changeSetId,
        String amendmentId,
        String documentId,
        int actVersion,
        List<ChangeRecord> records,
        double coverage,
        boolean incomplete,
        ChangeSetSummary summary,
        List<String> notes,
        List<Integer> unparsedSpans,
        Instant createdAt
) {
    public ChangeSet {
        records = List.copyOf(records);
        notes = List.copyOf(notes);
        unparsedSpans = List.copyOf(unparsedSpans);
    }

    /**
     * Builds a ChangeSet, deriving coverage, unparsed spans and the summary from the records.
     *
     * @param spanCount         number of instruction spans in the amendment
     * @param coverageThreshold coverage below which the set is marked incomplete
     */
    public static ChangeSet of(String changeSetId, String amendmentId, String documentId, int actVersion,
                               List<ChangeRecord> records, int spanCount, double coverageThreshold,
                               List<String> notes) {
        Set<Integer> covered = new HashSet<>();
        Set<Integer> classified = new HashSet<>();
        Set<Integer> seen = new HashSet<>();
        for (ChangeRecord record : records) {
            int span = record.intent().spanIndex();
            seen.add(span);
            if (record.kind() != ChangeKind.UNCLASSIFIED) {
                classified.add(span);
            }
            if (record.isApplicable()) {
                covered.add(span);
            }
        }
        List<Integer> unparsed = seen.stream().filter(span -> !classified.contains(span)).sorted().toList();
        double coverage = spanCount == 0 ? 0.0 : (double) covered.size() / spanCount;
        return new ChangeSet(changeSetId, amendmentId, documentId, actVersion, records, coverage,
                coverage < coverageThreshold, ChangeSetSummary.of(records), notes, unparsed, Instant.now());
    }

    public Optional<ChangeRecord> find(String changeId) {
        return records.stream().filter(r -> r.changeId().equals(changeId)).findFirst();
    }
}
