package com.codifier.domain.change.model;

/**
 * Confidence bands. HIGH ≥ 90, MEDIUM 70–89, LOW below 70.
 */
public enum ConfidenceLevel {
    HIGH(90),
    MEDIUM(70),
    LOW(0);

    private final int floor;

    ConfidenceLevel(int floor) {
        this.floor = floor;
    }

    public int floor() {
        return floor;
    }

    /**
     * Highest score still inside this band.
     */
    public int ceiling() {
        return switch (this) {
            case HIGH -> 100;
            case MEDIUM -> HIGH.floor - 1;
            case LOW -> MEDIUM.floor - 1;
        };
    }

    public static ConfidenceLevel of(int score) {
        if (score >= HIGH.floor) return HIGH;
        if (score >= MEDIUM.floor) return MEDIUM;
        return LOW;
    }
}
