package com.codifier.application.review;

import com.codifier.domain.change.model.ChangeRecord;
import com.codifier.domain.review.model.ReviewDecision;
import com.codifier.domain.review.model.ReviewState;

/**
 * A change record with its current review state and the decision that set it (null while untouched).
 */
public record ReviewItem(ChangeRecord record, ReviewState state, ReviewDecision activeDecision) {}
