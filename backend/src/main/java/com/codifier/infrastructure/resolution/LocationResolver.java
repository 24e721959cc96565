package com.codifier.infrastructure.resolution;

import com.codifier.domain.act.model.Act;
import com.codifier.domain.act.model.ActLine;
import com.codifier.domain.act.model.LineRange;
import com.codifier.domain.act.model.SectionLevel;
import com.codifier.domain.act.model.SectionPath;
import com.codifier.domain.change.model.ChangeIntent;
import com.codifier.domain.change.model.ChangeKind;
import com.codifier.domain.change.model.Resolution;
import com.codifier.domain.change.model.ResolutionFailure;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Maps a change intent's textual reference to line ranges of one Act version.
 *
 * <p>Exact section-path match first; otherwise the nearest unit with the same section and
 * level (marked fuzzy), or a failure. Substitutions and deletions that name words are
 * narrowed to the single line containing them. Global replacements resolve to every line
 * containing the text.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LocationResolver {

    private static final int PARENT_MISMATCH_COST = 1000;

    private final SectionReferenceParser referenceParser;

    /**
     * @return one resolution per located range; a single unresolved entry on failure
     */
    public List<Resolution> resolve(ChangeIntent intent, Act act) {
        if (intent.kind() == ChangeKind.UNCLASSIFIED) {
            return List.of(Resolution.unresolved(ResolutionFailure.REFERENCE_NOT_FOUND,
                    "Instruction could not be classified"));
        }
        if (intent.kind() == ChangeKind.GLOBAL_REPLACE) {
            return resolveEverywhere(intent.originalText(), act);
        }

        Optional<SectionReference> parsed = referenceParser.parse(intent.targetReference());
        if (parsed.isEmpty()) {
            return List.of(Resolution.unresolved(ResolutionFailure.REFERENCE_NOT_FOUND,
                    "No section could be read from '" + intent.targetReference() + "'"));
        }
        if (parsed.get().outsideScope()) {
            return List.of(Resolution.unresolved(ResolutionFailure.REFERENCE_OUTSIDE_SCOPE,
                    "'" + intent.targetReference() + "' is not addressed by the section model"));
        }

        Resolution unit = resolveUnit(parsed.get().path(), act);
        if (!unit.isResolved()) {
            log.debug("[Resolver] {} '{}' -> {}", intent.kind(), intent.targetReference(), unit.failure());
            return List.of(unit);
        }

        boolean narrows = intent.originalText() != null
                && (intent.kind() == ChangeKind.SUBSTITUTION || intent.kind() == ChangeKind.DELETION);
        Resolution result = narrows ? narrowToText(unit, intent.originalText(), act) : unit;
        log.debug("[Resolver] {} '{}' -> {}{}", intent.kind(), intent.targetReference(),
                result.isResolved() ? result.range() : result.failure(), result.fuzzy() ? " (fuzzy)" : "");
        return List.of(result);
    }

    /**
     * Range of a unit: exact path, else nearest sibling label within the same section.
     */
    Resolution resolveUnit(SectionPath target, Act act) {
        Optional<LineRange> exact = act.rangeOf(target);
        if (exact.isPresent()) {
            return Resolution.resolved(exact.get(), act.textOf(exact.get()), target, false);
        }

        SectionLevel level = target.deepestLevel();
        if (level == SectionLevel.SECTION) {
            return Resolution.unresolved(ResolutionFailure.REFERENCE_NOT_FOUND, target + " does not exist in the Act");
        }

        Set<SectionPath> candidates = new LinkedHashSet<>();
        for (SectionPath path : act.sectionPaths()) {
            if (target.section().equals(path.section()) && path.label(level) != null) {
                candidates.add(truncate(path, level));
            }
        }
        if (candidates.isEmpty()) {
            return Resolution.unresolved(ResolutionFailure.REFERENCE_NOT_FOUND, target + " does not exist in the Act");
        }

        int best = Integer.MAX_VALUE;
        List<SectionPath> nearest = new ArrayList<>();
        for (SectionPath candidate : candidates) {
            int cost = cost(target, candidate, level);
            if (cost < best) {
                best = cost;
                nearest.clear();
                nearest.add(candidate);
            } else if (cost == best) {
                nearest.add(candidate);
            }
        }
        if (nearest.size() > 1) {
            return Resolution.ambiguous("Several units are equally close to " + target,
                    nearest.stream().map(SectionPath::toString).toList());
        }
        SectionPath match = nearest.get(0);
        LineRange range = act.rangeOf(match).orElseThrow();
        log.debug("[Resolver] {} not found, nearest is {}", target, match);
        return Resolution.resolved(range, act.textOf(range), match, true);
    }

    private Resolution narrowToText(Resolution unit, String text, Act act) {
        List<ActLine> hits = act.linesIn(unit.range()).stream()
                .filter(line -> line.text().contains(text))
                .toList();
        if (hits.isEmpty()) {
            return Resolution.unresolved(ResolutionFailure.REFERENCE_NOT_FOUND,
                    "'" + text + "' does not occur in " + unit.sectionPath());
        }
        if (hits.size() > 1) {
            return Resolution.ambiguous("'" + text + "' occurs on " + hits.size() + " lines of " + unit.sectionPath(),
                    hits.stream().map(line -> "L" + line.lineId() + " " + line.sectionPath()).toList());
        }
        ActLine line = hits.get(0);
        return Resolution.resolved(LineRange.single(line.lineId()), line.text(), line.sectionPath(), unit.fuzzy());
    }

    private List<Resolution> resolveEverywhere(String text, Act act) {
        List<Resolution> resolutions = new ArrayList<>();
        for (ActLine line : act.getLines()) {
            if (line.text().contains(text)) {
                resolutions.add(Resolution.resolved(LineRange.single(line.lineId()), line.text(), line.sectionPath(), false));
            }
        }
        if (resolutions.isEmpty()) {
            return List.of(Resolution.unresolved(ResolutionFailure.REFERENCE_NOT_FOUND,
                    "'" + text + "' does not occur in the Act"));
        }
        log.debug("[Resolver] '{}' occurs on {} lines", text, resolutions.size());
        return resolutions;
    }

    private static int cost(SectionPath target, SectionPath candidate, SectionLevel level) {
        int cost = 0;
        for (SectionLevel parent : SectionLevel.values()) {
            if (parent == level) {
                break;
            }
            if (!Objects.equals(target.label(parent), candidate.label(parent))) {
                cost += PARENT_MISMATCH_COST;
            }
        }
        return cost + SectionPath.labelDistance(target.label(level), candidate.label(level), level);
    }

    private static SectionPath truncate(SectionPath path, SectionLevel level) {
        return path.withLabel(level, path.label(level));
    }
}
