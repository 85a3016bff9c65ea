package com.vidnyan.gae.domain.complexity;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Qualitative complexity bands.
 */
public enum ComplexityLevel {
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High"),
    VERY_HIGH("VeryHigh");

    private final String label;

    ComplexityLevel(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static ComplexityLevel fromScore(double score) {
        if (score < 0.3) {
            return LOW;
        } else if (score < 0.6) {
            return MEDIUM;
        } else if (score < 0.8) {
            return HIGH;
        }
        return VERY_HIGH;
    }
}
