package com.codifier.domain.review.model;

import java.time.Instant;

/**
 * One decision in a record's review history. Decisions are never deleted: a newer decision
 * supersedes the previous one, which stays in the history with {@code active = false}.
 *
 * @param decisionId  identifier
 * @param changeId    change record the decision is about
 * @param changeSetId ChangeSet owning the record
 * @param decision    verdict
 * @param reviewerId  who decided ("system:auto-accept" for pre-selection)
 * @param comment     free-text comment (nullable)
 * @param decidedAt   decision time
 * @param batchId     shared id of a bulk operation (nullable)
 * @param active      false once superseded
 */
public record ReviewDecision(
        String decisionId,
        String changeId,
        String changeSetId,
        Decision decision,
        String reviewerId,
        String comment,
        Instant decidedAt,
        String batchId,
        boolean active
) {
    public ReviewDecision superseded() {
        return new ReviewDecision(decisionId, changeId, changeSetId, decision, reviewerId, comment, decidedAt, batchId, false);
    }
}
