package com.vidnyan.gae.domain.suggestion;

import com.vidnyan.gae.domain.complexity.ComplexityAnalysis;
import com.vidnyan.gae.domain.model.StructureMetrics;
import com.vidnyan.gae.domain.pattern.GrammarPattern;
import com.vidnyan.gae.domain.pattern.PatternKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns findings into human-readable suggestions.
 * Every condition is evaluated independently and in a fixed order.
 */
@Component
public class SuggestionGenerator {

    public static final String FIX_ERRORS = "fix syntax errors before optimization";
    public static final String ADDRESS_WARNINGS = "address warnings for grammar quality";
    public static final String MODULARIZE = "modularize the grammar";
    public static final String TOKEN_CLASSES = "use token classes for similar terminals";
    public static final String ELIMINATE_LEFT_RECURSION = "eliminate left recursion";
    public static final String FACTOR_SUBEXPRESSIONS = "factor out repeated sub-expressions";
    public static final String REDUCE_NESTING = "reduce nesting depth";
    public static final String RESOLVE_AMBIGUITY = "resolve ambiguity";
    public static final String BREAK_DOWN_RULES = "break down complex rules into simpler components";
    public static final String OPTIMIZE_PERFORMANCE = "optimize structure for parsing performance";

    static final int VALIDATION_RULE_LIMIT = 50;
    static final int ANALYSIS_RULE_LIMIT = 100;
    static final int TERMINAL_LIMIT = 100;
    static final double PATTERN_POTENTIAL_THRESHOLD = 0.6;
    static final double COMPLEX_SCORE_THRESHOLD = 0.7;

    public List<String> forValidation(List<String> errors, List<String> warnings, StructureMetrics metrics) {
        List<String> suggestions = new ArrayList<>();
        if (!errors.isEmpty()) {
            suggestions.add(FIX_ERRORS);
        }
        if (!warnings.isEmpty()) {
            suggestions.add(ADDRESS_WARNINGS);
        }
        if (metrics.ruleCount() > VALIDATION_RULE_LIMIT) {
            suggestions.add(MODULARIZE);
        }
        if (metrics.terminalCount() > TERMINAL_LIMIT) {
            suggestions.add(TOKEN_CLASSES);
        }
        return suggestions;
    }

    public List<String> forAnalysis(StructureMetrics metrics, List<GrammarPattern> patterns, ComplexityAnalysis complexity) {
        List<String> suggestions = new ArrayList<>();
        if (complexity.score() > COMPLEX_SCORE_THRESHOLD) {
            suggestions.add(BREAK_DOWN_RULES);
        }
        for (GrammarPattern pattern : patterns) {
            if (pattern.optimizationPotential() > PATTERN_POTENTIAL_THRESHOLD) {
                forPattern(pattern.kind()).ifPresent(suggestions::add);
            }
        }
        if (metrics.ruleCount() > ANALYSIS_RULE_LIMIT) {
            suggestions.add(MODULARIZE);
        }
        if (metrics.terminalCount() > TERMINAL_LIMIT) {
            suggestions.add(TOKEN_CLASSES);
        }
        if (complexity.performancePrediction().needsOptimization()) {
            suggestions.add(OPTIMIZE_PERFORMANCE);
        }
        return suggestions;
    }

    static Optional<String> forPattern(PatternKind kind) {
        return switch (kind) {
            case LEFT_RECURSION -> Optional.of(ELIMINATE_LEFT_RECURSION);
            case COMMON_SUBEXPRESSION -> Optional.of(FACTOR_SUBEXPRESSIONS);
            case DEEP_NESTING -> Optional.of(REDUCE_NESTING);
            case POTENTIAL_AMBIGUITY -> Optional.of(RESOLVE_AMBIGUITY);
            case RIGHT_RECURSION, OPTIONAL_GROUP, REPETITION_GROUP, ALTERNATION, NESTED_GROUP -> Optional.empty();
        };
    }
}
