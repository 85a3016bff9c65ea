package com.vidnyan.gae.domain.pattern;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Structural motifs the detector recognizes, with their optimization weight.
 * Advanced kinds are only computed at detailed depth and above.
 */
public enum PatternKind {
    LEFT_RECURSION("LeftRecursion", 0.8, false),
    RIGHT_RECURSION("RightRecursion", 0.3, false),
    OPTIONAL_GROUP("OptionalGroup", 0.2, false),
    REPETITION_GROUP("RepetitionGroup", 0.4, false),
    ALTERNATION("Alternation", 0.3, false),
    NESTED_GROUP("NestedGroup", 0.6, false),
    COMMON_SUBEXPRESSION("CommonSubexpression", 0.7, true),
    DEEP_NESTING("DeepNesting", 0.6, true),
    POTENTIAL_AMBIGUITY("PotentialAmbiguity", 0.9, true);

    private final String label;
    private final double weight;
    private final boolean advanced;

    PatternKind(String label, double weight, boolean advanced) {
        this.label = label;
        this.weight = weight;
        this.advanced = advanced;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public double weight() {
        return weight;
    }

    public boolean advanced() {
        return advanced;
    }
}
