package com.codifier.domain.change.model;

/**
 * Why a change intent could not be located in the target Act.
 */
public enum ResolutionFailure {
    REFERENCE_NOT_FOUND,
    AMBIGUOUS_REFERENCE,
    REFERENCE_OUTSIDE_SCOPE
}
