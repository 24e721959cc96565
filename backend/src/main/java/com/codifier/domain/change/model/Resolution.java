package com.codifier.domain.change.model;

import com.codifier.domain.act.model.LineRange;
import com.codifier.domain.act.model.SectionPath;

import java.util.List;

/**
 * Outcome of locating an intent in one Act version: either a line range or a failure reason.
 *
 * @param range       resolved inclusive line range (null when unresolved)
 * @param snapshot    text of the range at resolution time, checked again at apply time
 * @param sectionPath address of the resolved unit (null when unresolved)
 * @param fuzzy       true when the range came from nearest-label matching rather than an exact path
 * @param failure     failure reason (null when resolved)
 * @param detail      human-readable explanation of the failure
 * @param candidates  candidate addresses for an ambiguous reference
 */
public record Resolution(
        LineRange range,
        String snapshot,
        SectionPath sectionPath,
        boolean fuzzy,
        ResolutionFailure failure,
        String detail,
        List<String> candidates
) {
    public Resolution {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        if ((range == null) == (failure == null)) {
            throw new IllegalArgumentException("A resolution has either a range or a failure reason");
        }
    }

    public static Resolution resolved(LineRange range, String snapshot, SectionPath path, boolean fuzzy) {
        return new Resolution(range, snapshot, path, fuzzy, null, null, List.of());
    }

    public static Resolution unresolved(ResolutionFailure failure, String detail) {
        return new Resolution(null, null, null, false, failure, detail, List.of());
    }

    public static Resolution ambiguous(String detail, List<String> candidates) {
        return new Resolution(null, null, null, false, ResolutionFailure.AMBIGUOUS_REFERENCE, detail, candidates);
    }

    public boolean isResolved() {
        return range != null;
    }
}
