package com.vidnyan.gae.domain.model;

import com.vidnyan.gae.domain.text.GrammarScanner;

import java.util.List;

/**
 * Structural measurements shared by both scoring paths.
 *
 * @param ruleDensity rules per 1000 characters of normalized text
 */
public record StructureMetrics(
    int ruleCount,
    int terminalCount,
    int nonTerminalCount,
    double averageRuleLength,
    int maxRuleLength,
    double averageBranchingFactor,
    int grammarSize,
    double ruleDensity,
    int maxNestingDepth
) {

    public static final StructureMetrics EMPTY = new StructureMetrics(0, 0, 0, 0.0, 0, 0.0, 0, 0.0, 0);

    /**
     * Compute metrics for an extracted grammar.
     */
    public static StructureMetrics of(GrammarModel model) {
        List<Rule> rules = model.rules();
        int ruleCount = rules.size();
        int divisor = Math.max(ruleCount, 1);

        int totalLength = 0;
        int maxLength = 0;
        int totalAlternatives = 0;
        for (Rule rule : rules) {
            int length = rule.body().length();
            totalLength += length;
            maxLength = Math.max(maxLength, length);
            totalAlternatives += rule.branchingFactor();
        }

        String text = model.normalizedText();
        return new StructureMetrics(
                ruleCount,
                model.terminals().size(),
                model.nonTerminals().size(),
                (double) totalLength / divisor,
                maxLength,
                (double) totalAlternatives / divisor,
                text.length(),
                ruleCount / (double) Math.max(text.length(), 1) * 1000,
                GrammarScanner.maxNestingDepth(text)
        );
    }
}
