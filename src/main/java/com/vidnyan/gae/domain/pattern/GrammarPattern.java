package com.vidnyan.gae.domain.pattern;

import java.util.List;

/**
 * A detected grammar pattern. Produced fresh per analysis.
 *
 * @param examples at most {@link #MAX_EXAMPLES} sample matches
 */
public record GrammarPattern(
    PatternKind kind,
    String description,
    int occurrences,
    List<String> examples,
    double optimizationPotential
) {

    public static final int MAX_EXAMPLES = 5;

    public GrammarPattern {
        examples = List.copyOf(examples.size() > MAX_EXAMPLES ? examples.subList(0, MAX_EXAMPLES) : examples);
    }

    /**
     * Create a pattern weighted by its kind.
     */
    public static GrammarPattern of(PatternKind kind, String description, int occurrences, List<String> examples) {
        return new GrammarPattern(kind, description, occurrences, examples, kind.weight());
    }
}
