package com.vidnyan.gae.domain.complexity;

import com.vidnyan.gae.domain.model.StructureMetrics;
import com.vidnyan.gae.domain.pattern.GrammarPattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Two independent scoring functions over the same structure metrics.
 * The validation path weighs symbol counts; the analysis path weighs detected patterns.
 */
@Slf4j
@Component
public class ComplexityScorer {

    /**
     * Validation-path score:
     * 0.01·rules + 0.005·terminals + 0.01·nonTerminals + 0.001·avgRuleLength + 0.1·maxNesting.
     */
    public ComplexityAssessment assess(StructureMetrics metrics) {
        double score = clamp(
                metrics.ruleCount() * 0.01
                + metrics.terminalCount() * 0.005
                + metrics.nonTerminalCount() * 0.01
                + metrics.averageRuleLength() * 0.001
                + metrics.maxNestingDepth() * 0.1);

        return new ComplexityAssessment(
                metrics.ruleCount(),
                metrics.terminalCount(),
                metrics.nonTerminalCount(),
                metrics.averageRuleLength(),
                metrics.maxNestingDepth(),
                score,
                ComplexityLevel.fromScore(score));
    }

    /**
     * Analysis-path score:
     * 0.01·rules + 0.001·avgRuleLength + 0.1·maxNesting + 0.2·patternComplexity.
     */
    public ComplexityAnalysis analyze(StructureMetrics metrics, List<GrammarPattern> patterns) {
        double patternComplexity = patternComplexity(patterns);
        double ruleComplexity = metrics.ruleCount() * 0.01;
        double structuralComplexity = metrics.maxNestingDepth() * 0.1;

        double score = clamp(
                ruleComplexity
                + metrics.averageRuleLength() * 0.001
                + structuralComplexity
                + patternComplexity * 0.2);

        log.debug("Complexity score {} (pattern complexity {})", score, patternComplexity);
        return new ComplexityAnalysis(
                score,
                ComplexityLevel.fromScore(score),
                PerformancePrediction.fromScore(score),
                Math.max(0.0, 1.0 - score),
                ruleComplexity,
                structuralComplexity,
                patternComplexity);
    }

    /**
     * Mean of occurrences × optimization potential over the detected patterns.
     */
    static double patternComplexity(List<GrammarPattern> patterns) {
        double total = 0.0;
        for (GrammarPattern pattern : patterns) {
            total += pattern.occurrences() * pattern.optimizationPotential();
        }
        return total / Math.max(1, patterns.size());
    }

    private static double clamp(double score) {
        return Math.max(0.0, Math.min(1.0, score));
    }
}
