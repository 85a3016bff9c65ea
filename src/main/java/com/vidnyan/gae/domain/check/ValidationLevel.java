package com.vidnyan.gae.domain.check;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Validation strictness levels.
 */
public enum ValidationLevel {
    STRICT,     // Undefined symbols and left recursion are errors, style issues are warned
    MODERATE,   // Undefined symbols and left recursion are warnings
    LENIENT;    // Only left recursion is warned

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse "strict", "moderate" or "lenient", ignoring case.
     */
    public static ValidationLevel fromString(String value) {
        for (ValidationLevel level : values()) {
            if (level.value().equalsIgnoreCase(value == null ? "" : value.strip())) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown validation level: " + value);
    }
}
