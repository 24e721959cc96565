package com.codifier.infrastructure.apply;

import com.codifier.domain.act.model.Act;
import com.codifier.domain.act.model.ActLine;
import com.codifier.domain.act.model.PositionSpan;
import com.codifier.domain.act.model.SectionLevel;
import com.codifier.domain.act.model.SectionPath;
import com.codifier.domain.apply.model.AcceptedChange;
import com.codifier.domain.apply.model.ApplyManifest;
import com.codifier.domain.apply.model.ApplyResult;
import com.codifier.domain.apply.model.ManifestEntry;
import com.codifier.domain.apply.model.PatchHunk;
import com.codifier.domain.apply.model.ReversePatch;
import com.codifier.domain.change.model.ChangeIntent;
import com.codifier.domain.change.model.ChangeKind;
import com.codifier.domain.change.model.ChangeRecord;
import com.codifier.infrastructure.ingest.SectionLabelDetector;
import com.codifier.infrastructure.resolution.SectionReferenceParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies accepted change records to a base Act version, producing the next version, a
 * reverse patch and a manifest. Pure: the base Act is never modified.
 *
 * <p>Structural edits run in descending order of their start position so that earlier
 * positions stay valid; renumbering runs last and only relabels section paths (and the
 * leading label of the unit's first line). Any stale range snapshot aborts the whole apply.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApplyEngine {

    private final SectionReferenceParser referenceParser;
    private final SectionLabelDetector labelDetector;

    public ApplyResult apply(Act base, List<AcceptedChange> accepted, String changeSetId) {
        for (AcceptedChange change : accepted) {
            verifySnapshot(base, change.record());
        }

        Comparator<AcceptedChange> byStartDescending = Comparator.comparingInt(
                (AcceptedChange c) -> base.positionOf(c.record().range().startLineId())).reversed();
        List<AcceptedChange> structural = accepted.stream()
                .filter(c -> c.record().kind().isStructural())
                .sorted(byStartDescending)
                .toList();
        List<AcceptedChange> renumberings = accepted.stream()
                .filter(c -> c.record().kind() == ChangeKind.RENUMBERING)
                .sorted(byStartDescending)
                .toList();

        Working working = new Working(base);
        Map<String, ManifestEntry> entries = new HashMap<>();
        for (AcceptedChange change : structural) {
            entries.put(change.record().changeId(), applyStructural(working, change));
        }
        for (AcceptedChange change : renumberings) {
            entries.put(change.record().changeId(), applyRenumbering(working, change));
        }

        checkOrder(working);

        Act next = base.successor(working.lines, working.nextLineId, working.retired, changeSetId);
        ReversePatch reversePatch = new ReversePatch(base.getDocumentId(), base.getVersion(), next.getVersion(), working.hunks);

        List<ManifestEntry> ordered = accepted.stream()
                .sorted(Comparator.comparingInt(c -> base.positionOf(c.record().range().startLineId())))
                .map(c -> entries.get(c.record().changeId()))
                .toList();
        Map<ChangeKind, Integer> counts = new EnumMap<>(ChangeKind.class);
        ordered.forEach(entry -> counts.merge(entry.kind(), 1, Integer::sum));
        ApplyManifest manifest = new ApplyManifest(changeSetId, base.getDocumentId(), base.getVersion(),
                next.getVersion(), ordered, counts, Instant.now());

        log.info("[Apply] {} v{} -> v{}: {} changes applied ({} hunks), counts {}",
                base.getDocumentId(), base.getVersion(), next.getVersion(), ordered.size(), working.hunks.size(), counts);
        return new ApplyResult(next, reversePatch, manifest);
    }

    private void verifySnapshot(Act base, ChangeRecord record) {
        if (!record.isApplicable()) {
            throw new ChangeApplicationException(record.changeId(),
                    "Change " + record.changeId() + " is not resolved and cannot be applied");
        }
        if (base.positionsOf(record.range()).isEmpty()) {
            throw new StaleResolutionException(record.changeId(), String.format(
                    "Change %s: range %s no longer exists in %s", record.changeId(), record.range(), base));
        }
        if (!base.textOf(record.range()).equals(record.resolution().snapshot())) {
            throw new StaleResolutionException(record.changeId(), String.format(
                    "Change %s: text of %s differs from the text it was resolved against", record.changeId(), record.range()));
        }
    }

    private ManifestEntry applyStructural(Working working, AcceptedChange change) {
        ChangeRecord record = change.record();
        ChangeIntent intent = record.intent();
        int start = working.indexOf(record.range().startLineId());
        int end = working.indexOf(record.range().endLineId());
        List<ActLine> current = new ArrayList<>(working.lines.subList(start, end + 1));
        String before = Act.joinText(current);

        List<ActLine> replacement = switch (intent.kind()) {
            case SUBSTITUTION -> intent.originalText() != null
                    ? replaceWords(record, current, intent.originalText(), intent.newText())
                    : replaceUnit(working, record, current, intent.newText());
            case GLOBAL_REPLACE -> replaceWords(record, current, intent.originalText(), intent.newText());
            case DELETION -> intent.originalText() != null
                    ? replaceWords(record, current, intent.originalText(), "")
                    : List.of();
            case INSERTION -> null;
            default -> throw new IllegalStateException("Not a structural change: " + intent.kind());
        };

        if (replacement == null) {
            List<ActLine> inserted = newLines(working, intent.newText(), current.get(current.size() - 1).sectionPath(), null);
            working.replace(end + 1, List.of(), inserted, record.changeId());
            return entry(change, "", Act.joinText(inserted));
        }

        Set<Long> kept = new LinkedHashSet<>();
        replacement.forEach(line -> kept.add(line.lineId()));
        current.stream().map(ActLine::lineId).filter(id -> !kept.contains(id)).forEach(working.retired::add);
        working.replace(start, current, replacement, record.changeId());
        return entry(change, before, Act.joinText(replacement));
    }

    private List<ActLine> replaceWords(ChangeRecord record, List<ActLine> lines, String original, String replacement) {
        List<ActLine> result = new ArrayList<>();
        boolean found = false;
        for (ActLine line : lines) {
            if (line.text().contains(original)) {
                found = true;
                result.add(line.withText(tidy(line.text().replace(original, replacement))));
            } else {
                result.add(line);
            }
        }
        if (!found) {
            throw new StaleResolutionException(record.changeId(), String.format(
                    "Change %s: '%s' no longer occurs in %s", record.changeId(), original, record.range()));
        }
        return result;
    }

    private List<ActLine> replaceUnit(Working working, ChangeRecord record, List<ActLine> current, String newText) {
        List<String> texts = splitLines(newText);
        if (texts.size() == current.size()) {
            List<ActLine> result = new ArrayList<>();
            for (int i = 0; i < texts.size(); i++) {
                result.add(current.get(i).withText(texts.get(i)));
            }
            return result;
        }
        return newLines(working, newText, current.get(0).sectionPath(), record.resolution().sectionPath());
    }

    /**
     * Fresh lines for inserted or substituted text. Section paths follow the leading labels of
     * the new lines; unlabelled lines continue the previous line's unit. With a {@code unit},
     * the first line takes {@code start} and no line may leave the unit.
     */
    private List<ActLine> newLines(Working working, String text, SectionPath start, SectionPath unit) {
        List<ActLine> lines = new ArrayList<>();
        SectionPath previous = start;
        boolean first = true;
        for (String lineText : splitLines(text)) {
            SectionPath path;
            if (first && unit != null) {
                path = start;
            } else {
                path = labelDetector.detect(lineText, previous).orElse(previous);
                if (unit != null && !unit.contains(path)) {
                    path = previous;
                }
            }
            lines.add(new ActLine(working.nextLineId++, path, lineText, 0));
            previous = path;
            first = false;
        }
        return lines;
    }

    private ManifestEntry applyRenumbering(Working working, AcceptedChange change) {
        ChangeRecord record = change.record();
        SectionPath from = record.resolution().sectionPath();
        SectionPath to = referenceParser.parseRelative(record.intent().newText(), from)
                .orElseThrow(() -> new ChangeApplicationException(record.changeId(),
                        "Change " + record.changeId() + ": cannot read new number '" + record.intent().newText() + "'"));
        if (to.deepestLevel() != from.deepestLevel()) {
            throw new ChangeApplicationException(record.changeId(), String.format(
                    "Change %s: %s and %s are not the same kind of unit", record.changeId(), from, to));
        }

        int start = working.indexOf(record.range().startLineId());
        int end = working.indexOf(record.range().endLineId());
        List<ActLine> before = new ArrayList<>(working.lines.subList(start, end + 1));
        List<ActLine> after = new ArrayList<>();
        for (int i = 0; i < before.size(); i++) {
            ActLine line = before.get(i);
            ActLine moved = line.withSectionPath(from.rebase(line.sectionPath(), to));
            if (i == 0 && line.sectionPath().equals(from)) {
                moved = moved.withText(relabel(line.text(), from, to));
            }
            after.add(moved);
            working.replace(start + i, List.of(line), List.of(moved), record.changeId());
        }
        return entry(change, Act.joinText(before), Act.joinText(after));
    }

    private static String relabel(String text, SectionPath from, SectionPath to) {
        SectionLevel level = from.deepestLevel();
        String oldLabel = Pattern.quote(from.deepestLabel());
        Pattern leading = level == SectionLevel.SECTION
                ? Pattern.compile("^(\\s*(?:section\\s+)?)" + oldLabel + "(?=[.\\s(]|$)", Pattern.CASE_INSENSITIVE)
                : Pattern.compile("^(\\s*\\()" + oldLabel + "(?=\\))", Pattern.CASE_INSENSITIVE);
        Matcher m = leading.matcher(text);
        return m.find() ? m.group(1) + to.deepestLabel() + text.substring(m.end()) : text;
    }

    private static void checkOrder(Working working) {
        List<ActLine> lines = working.lines;
        for (int i = 1; i < lines.size(); i++) {
            SectionPath previous = lines.get(i - 1).sectionPath();
            SectionPath current = lines.get(i).sectionPath();
            if (previous.compareTo(current) > 0) {
                String blamed = working.owner.getOrDefault(lines.get(i).lineId(),
                        working.owner.get(lines.get(i - 1).lineId()));
                throw new SectionOrderViolationException(blamed, String.format(
                        "Change %s would place %s after %s", blamed, current, previous));
            }
        }
    }

    private static ManifestEntry entry(AcceptedChange change, String before, String after) {
        ChangeRecord record = change.record();
        return new ManifestEntry(record.changeId(), record.kind(), record.range(), record.sourceCitation(),
                change.decision().reviewerId(), change.decision().decidedAt(), before, after);
    }

    private static List<String> splitLines(String text) {
        return Arrays.stream(text.split("\\R"))
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .toList();
    }

    private static String tidy(String text) {
        return text.replaceAll("[ \\t]{2,}", " ")
                .replaceAll("\\s+([,.;:)])", "$1")
                .replace("( ", "(")
                .strip();
    }

    /**
     * Mutable line list of the version being built, with the hunks that produced it.
     */
    private static final class Working {
        private final List<ActLine> lines;
        private final Set<Long> retired = new LinkedHashSet<>();
        private final List<PatchHunk> hunks = new ArrayList<>();
        private final Map<Long, String> owner = new HashMap<>();
        private long nextLineId;

        Working(Act base) {
            this.lines = new ArrayList<>(base.getLines());
            this.nextLineId = base.getNextLineId();
        }

        int indexOf(long lineId) {
            for (int i = 0; i < lines.size(); i++) {
                if (lines.get(i).lineId() == lineId) {
                    return i;
                }
            }
            throw new IllegalStateException("Line L" + lineId + " vanished while applying");
        }

        void replace(int position, List<ActLine> removed, List<ActLine> inserted, String changeId) {
            lines.subList(position, position + removed.size()).clear();
            lines.addAll(position, inserted);
            inserted.forEach(line -> owner.put(line.lineId(), changeId));
            hunks.add(new PatchHunk(position, removed, inserted));
        }
    }
}
