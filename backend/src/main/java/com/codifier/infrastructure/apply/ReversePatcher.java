package com.codifier.infrastructure.apply;

import com.codifier.domain.act.model.Act;
import com.codifier.domain.act.model.ActLine;
import com.codifier.domain.apply.model.PatchHunk;
import com.codifier.domain.apply.model.ReversePatch;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Undoes a reverse patch, last hunk first.
 */
@Component
public class ReversePatcher {

    /**
     * Result of undoing a patch: the restored lines, ids retired by the undo, and the edits the
     * undo performed, in order, so that the undo can itself be undone.
     */
    public record Undo(List<ActLine> lines, Set<Long> retiredLineIds, List<PatchHunk> appliedHunks) {}

    /**
     * @param act   the version the patch produced
     * @param patch reverse patch whose {@code toVersion} is {@code act}'s version
     * @throws IllegalStateException when the act's lines do not match the patch
     */
    public Undo undo(Act act, ReversePatch patch) {
        if (!act.getDocumentId().equals(patch.documentId()) || act.getVersion() != patch.toVersion()) {
            throw new IllegalStateException("Reverse patch " + patch.documentId() + " v" + patch.toVersion()
                    + " does not belong to " + act);
        }
        List<ActLine> lines = new ArrayList<>(act.getLines());
        List<PatchHunk> applied = new ArrayList<>();
        List<PatchHunk> hunks = patch.hunks();
        for (int i = hunks.size() - 1; i >= 0; i--) {
            PatchHunk hunk = hunks.get(i);
            int position = hunk.position();
            List<ActLine> current = lines.subList(position, position + hunk.inserted().size());
            if (!current.equals(hunk.inserted())) {
                throw new IllegalStateException("Lines at position " + position + " of " + act + " do not match the patch");
            }
            current.clear();
            lines.addAll(position, hunk.removed());
            applied.add(new PatchHunk(position, hunk.inserted(), hunk.removed()));
        }

        Set<Long> restoredIds = new HashSet<>();
        lines.forEach(line -> restoredIds.add(line.lineId()));
        Set<Long> retired = new HashSet<>();
        act.getLines().stream()
                .map(ActLine::lineId)
                .filter(id -> !restoredIds.contains(id))
                .forEach(retired::add);
        return new Undo(lines, retired, applied);
    }
}
