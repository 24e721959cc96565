package com.codifier.domain.change.model;

import com.codifier.domain.act.model.LineRange;

/**
 * A located, scored, citation-backed edit. Immutable; review decisions refer to it by id.
 *
 * @param changeId          identifier
 * @param intent            classified intent
 * @param resolution        location in the target Act version
 * @param confidence        trust score
 * @param validation        dual-pass validation outcome
 * @param reviewRequirement review gate derived from confidence and validation
 * @param contextBefore     text of the line preceding the range, for reviewers (nullable)
 * @param contextAfter      text of the line following the range, for reviewers (nullable)
 * @param extractedBy       name of the extraction pass that produced the record
 */
public record ChangeRecord(
        String changeId,
        ChangeIntent intent,
        Resolution resolution,
        Confidence confidence,
        ValidationStatus validation,
        ReviewRequirement reviewRequirement,
        String contextBefore,
        String contextAfter,
        String extractedBy
) {
    public ChangeKind kind() {
        return intent.kind();
    }

    public boolean isResolved() {
        return resolution.isResolved();
    }

    public LineRange range() {
        return resolution.range();
    }

    public String sourceCitation() {
        return intent.sourceCitation();
    }

    /**
     * Whether the record can ever be accepted: it must be located and classified.
     */
    public boolean isApplicable() {
        return isResolved() && kind() != ChangeKind.UNCLASSIFIED;
    }

    /**
     * Copy carrying a new assessment; used while a ChangeSet is being assembled.
     */
    public ChangeRecord withAssessment(Confidence newConfidence, ValidationStatus newValidation) {
        return new ChangeRecord(changeId, intent, resolution, newConfidence, newValidation,
                ReviewRequirement.of(newConfidence, newValidation), contextBefore, contextAfter, extractedBy);
    }
}
