package com.vidnyan.gae.domain.complexity;

/**
 * Analysis-path complexity, including the parts the score is made of.
 */
public record ComplexityAnalysis(
    double score,
    ComplexityLevel level,
    PerformancePrediction performancePrediction,
    double maintainabilityScore,
    double ruleComplexity,
    double structuralComplexity,
    double patternComplexity
) {
}
