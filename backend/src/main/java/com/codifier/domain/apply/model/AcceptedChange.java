package com.codifier.domain.apply.model;

import com.codifier.domain.change.model.ChangeRecord;
import com.codifier.domain.review.model.ReviewDecision;

/**
 * A change record together with the active decision that accepted it.
 */
public record AcceptedChange(ChangeRecord record, ReviewDecision decision) {}
