package com.codifier.domain.review.repository;

import com.codifier.domain.review.model.ReviewDecision;

import java.util.List;
import java.util.Optional;

/**
 * Decision store. Writers must hold the owning ChangeSet's review lock.
 */
public interface ReviewDecisionRepository {

    /**
     * Stores the decisions and marks the previously active decision of each record as superseded.
     */
    void appendAll(List<ReviewDecision> decisions);

    Optional<ReviewDecision> findActive(String changeId);

    List<ReviewDecision> findActiveByChangeSet(String changeSetId);

    /**
     * Full history of a record, oldest first.
     */
    List<ReviewDecision> findHistory(String changeId);
}
