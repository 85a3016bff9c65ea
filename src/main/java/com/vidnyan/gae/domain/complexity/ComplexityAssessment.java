package com.vidnyan.gae.domain.complexity;

/**
 * Validation-path complexity report.
 */
public record ComplexityAssessment(
    int ruleCount,
    int terminalCount,
    int nonTerminalCount,
    double averageRuleLength,
    int maxNestingDepth,
    double score,
    ComplexityLevel level
) {
}
