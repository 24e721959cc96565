package com.codifier.domain.act.model;

import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable snapshot of one version of an Act.
 *
 * <p>Versions form an append-only chain per document: version 1 is ingested, every later
 * version is produced by applying a ChangeSet (or reverting one) to its parent. A snapshot
 * is never modified after construction.
 *
 * <p>Invariants checked on construction:
 * <ul>
 *   <li>line ids are unique and below {@link #getNextLineId()}</li>
 *   <li>section paths never decrease along the document</li>
 * </ul>
 */
@Getter
public final class Act {

    private static final int PREVIEW_LENGTH = 100;

    private final String documentId;
    private final String title;
    private final int version;
    private final Integer parentVersion;
    private final String sourceChangeSetId;
    private final List<ActLine> lines;
    private final long nextLineId;
    private final Set<Long> retiredLineIds;
    private final Instant createdAt;

    @Getter(AccessLevel.NONE)
    private final Map<Long, Integer> positionById;

    public Act(String documentId,
               String title,
               int version,
               Integer parentVersion,
               String sourceChangeSetId,
               List<ActLine> lines,
               long nextLineId,
               Set<Long> retiredLineIds,
               Instant createdAt) {
        if (documentId == null || documentId.isBlank()) {
            throw new IllegalArgumentException("documentId is required");
        }
        if (version < 1) {
            throw new IllegalArgumentException("version must be >= 1, got " + version);
        }
        this.documentId = documentId;
        this.title = title;
        this.version = version;
        this.parentVersion = parentVersion;
        this.sourceChangeSetId = sourceChangeSetId;
        this.lines = List.copyOf(lines);
        this.nextLineId = nextLineId;
        this.retiredLineIds = Collections.unmodifiableSet(new LinkedHashSet<>(retiredLineIds));
        this.createdAt = createdAt != null ? createdAt : Instant.now();
        this.positionById = indexLines(this.lines, nextLineId);
        checkSectionOrder(this.lines);
    }

    /**
     * Creates version 1 of a document.
     */
    public static Act initial(String documentId, String title, List<ActLine> lines) {
        long next = lines.stream().mapToLong(ActLine::lineId).max().orElse(0L) + 1;
        return new Act(documentId, title, 1, null, null, lines, next, Set.of(), Instant.now());
    }

    /**
     * Creates the next version in the chain with this version as its parent.
     *
     * @param newLines          full line list of the new version
     * @param nextLineId        next id to issue; never lower than this version's
     * @param newlyRetired      ids retired by the edit
     * @param sourceChangeSetId ChangeSet that produced the version (null for a revert)
     */
    public Act successor(List<ActLine> newLines, long nextLineId, Set<Long> newlyRetired, String sourceChangeSetId) {
        Set<Long> retired = new LinkedHashSet<>(retiredLineIds);
        retired.addAll(newlyRetired);
        newLines.forEach(line -> retired.remove(line.lineId()));
        return new Act(documentId, title, version + 1, version, sourceChangeSetId,
                newLines, Math.max(nextLineId, this.nextLineId), retired, Instant.now());
    }

    public int size() {
        return lines.size();
    }

    /**
     * Index of the line in this version, or -1 when the id is absent (never issued or retired).
     */
    public int positionOf(long lineId) {
        Integer position = positionById.get(lineId);
        return position == null ? -1 : position;
    }

    public Optional<ActLine> line(long lineId) {
        int position = positionOf(lineId);
        return position < 0 ? Optional.empty() : Optional.of(lines.get(position));
    }

    /**
     * Index span of the range in this version, or empty when either end is missing or the
     * ends are out of document order.
     */
    public Optional<PositionSpan> positionsOf(LineRange range) {
        int start = positionOf(range.startLineId());
        int end = positionOf(range.endLineId());
        if (start < 0 || end < 0 || end < start) {
            return Optional.empty();
        }
        return Optional.of(new PositionSpan(start, end));
    }

    public List<ActLine> linesIn(LineRange range) {
        return positionsOf(range)
                .map(span -> lines.subList(span.start(), span.end() + 1))
                .orElse(List.of());
    }

    public String textOf(LineRange range) {
        return joinText(linesIn(range));
    }

    /**
     * Range covering a unit and all of its descendants. Units are contiguous because
     * section paths are ordered along the document.
     */
    public Optional<LineRange> rangeOf(SectionPath unit) {
        int first = -1;
        int last = -1;
        for (int i = 0; i < lines.size(); i++) {
            if (unit.contains(lines.get(i).sectionPath())) {
                if (first < 0) first = i;
                last = i;
            }
        }
        if (first < 0) {
            return Optional.empty();
        }
        return Optional.of(new LineRange(lines.get(first).lineId(), lines.get(last).lineId()));
    }

    /**
     * Distinct section paths in document order.
     */
    public List<SectionPath> sectionPaths() {
        return lines.stream()
                .map(ActLine::sectionPath)
                .distinct()
                .toList();
    }

    /**
     * Section-level outline: heading (first line) and a short preview of each section.
     */
    public List<ActOutlineEntry> outline() {
        Map<String, List<ActLine>> bySection = lines.stream()
                .filter(line -> !line.sectionPath().isRoot())
                .collect(Collectors.groupingBy(line -> line.sectionPath().section(),
                        LinkedHashMap::new, Collectors.toList()));

        List<ActOutlineEntry> outline = new ArrayList<>();
        for (var entry : bySection.entrySet()) {
            List<ActLine> sectionLines = entry.getValue();
            String body = joinText(sectionLines.subList(Math.min(1, sectionLines.size() - 1), sectionLines.size()));
            String preview = body.length() > PREVIEW_LENGTH ? body.substring(0, PREVIEW_LENGTH) : body;
            outline.add(new ActOutlineEntry(
                    SectionPath.ofSection(entry.getKey()),
                    sectionLines.get(0).text(),
                    preview.replace('\n', ' '),
                    new LineRange(sectionLines.get(0).lineId(), sectionLines.get(sectionLines.size() - 1).lineId()),
                    sectionLines.size()));
        }
        return outline;
    }

    public String text() {
        return joinText(lines);
    }

    public static String joinText(List<ActLine> lines) {
        return lines.stream().map(ActLine::text).collect(Collectors.joining("\n"));
    }

    private static Map<Long, Integer> indexLines(List<ActLine> lines, long nextLineId) {
        Map<Long, Integer> index = new HashMap<>(lines.size() * 2);
        for (int i = 0; i < lines.size(); i++) {
            long id = lines.get(i).lineId();
            if (id >= nextLineId) {
                throw new IllegalArgumentException("Line id " + id + " is not below next line id " + nextLineId);
            }
            if (index.put(id, i) != null) {
                throw new IllegalArgumentException("Duplicate line id " + id);
            }
        }
        return Collections.unmodifiableMap(index);
    }

    private static void checkSectionOrder(List<ActLine> lines) {
        for (int i = 1; i < lines.size(); i++) {
            SectionPath previous = lines.get(i - 1).sectionPath();
            SectionPath current = lines.get(i).sectionPath();
            if (previous.compareTo(current) > 0) {
                throw new IllegalArgumentException(String.format(
                        "Section order violated at line L%d: %s follows %s",
                        lines.get(i).lineId(), current, previous));
            }
        }
    }

    @Override
    public String toString() {
        return "Act[" + documentId + " v" + version + ", " + lines.size() + " lines]";
    }
}
