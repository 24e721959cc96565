package com.codifier.application.review.exception;

import com.codifier.domain.review.model.ReviewState;
import lombok.Getter;

/**
 * The reviewer decided on a state that another decision has already replaced.
 */
@Getter
public class StaleReviewException extends RuntimeException {

    private final String changeId;
    private final ReviewState currentState;

    public StaleReviewException(String changeId, ReviewState expected, ReviewState currentState) {
        super(String.format("Change %s is %s, not %s; reload and decide again", changeId, currentState, expected));
        this.changeId = changeId;
        this.currentState = currentState;
    }
}
