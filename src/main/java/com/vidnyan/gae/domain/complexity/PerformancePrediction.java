package com.vidnyan.gae.domain.complexity;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Predicted parsing performance for a complexity score.
 */
public enum PerformancePrediction {
    EXCELLENT("Excellent"),
    GOOD("Good"),
    FAIR("Fair"),
    POOR("Poor");

    private final String label;

    PerformancePrediction(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static PerformancePrediction fromScore(double score) {
        if (score < 0.3) {
            return EXCELLENT;
        } else if (score < 0.5) {
            return GOOD;
        } else if (score < 0.7) {
            return FAIR;
        }
        return POOR;
    }

    public boolean needsOptimization() {
        return switch (this) {
            case EXCELLENT, GOOD -> false;
            case FAIR, POOR -> true;
        };
    }
}
