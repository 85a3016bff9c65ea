package com.vidnyan.gae.domain.pattern;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Analysis depth levels.
 */
public enum AnalysisDepth {
    BASIC,
    DETAILED,
    COMPREHENSIVE;

    /**
     * Weight below which basic patterns are suppressed at basic depth.
     */
    static final double BASIC_WEIGHT_THRESHOLD = 0.5;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Whether a pattern of this kind is computed at this depth.
     */
    public boolean includes(PatternKind kind) {
        return switch (this) {
            case BASIC -> !kind.advanced() && kind.weight() >= BASIC_WEIGHT_THRESHOLD;
            case DETAILED, COMPREHENSIVE -> true;
        };
    }

    public static AnalysisDepth fromString(String value) {
        for (AnalysisDepth depth : values()) {
            if (depth.value().equalsIgnoreCase(value == null ? "" : value.strip())) {
                return depth;
            }
        }
        throw new IllegalArgumentException("Unknown analysis depth: " + value);
    }
}
