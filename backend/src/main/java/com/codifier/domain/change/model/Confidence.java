package com.codifier.domain.change.model;

/**
 * Confidence score in [0, 100] with its band.
 */
public record Confidence(int score, ConfidenceLevel level) {

    public Confidence {
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("Confidence score must be within 0..100, got " + score);
        }
        if (level != ConfidenceLevel.of(score)) {
            throw new IllegalArgumentException("Score " + score + " is not in band " + level);
        }
    }

    public static Confidence of(int score) {
        int clamped = Math.max(0, Math.min(100, score));
        return new Confidence(clamped, ConfidenceLevel.of(clamped));
    }

    /**
     * Lowers the score so that it does not exceed the given band.
     */
    public Confidence capAt(ConfidenceLevel band) {
        return score <= band.ceiling() ? this : of(band.ceiling());
    }
}
