package com.codifier.infrastructure.resolution;

import com.codifier.domain.act.model.SectionPath;

/**
 * A parsed textual reference.
 *
 * @param path         addressed unit (null when the reference is outside the model's scope)
 * @param outsideScope the reference names a unit the line model does not address (Schedule, Chapter, ...)
 * @param raw          reference as written
 */
public record SectionReference(SectionPath path, boolean outsideScope, String raw) {

    public static SectionReference of(SectionPath path, String raw) {
        return new SectionReference(path, false, raw);
    }

    public static SectionReference outsideScope(String raw) {
        return new SectionReference(null, true, raw);
    }
}
