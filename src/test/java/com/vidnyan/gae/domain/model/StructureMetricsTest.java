package com.vidnyan.gae.domain.model;

import org.junit.jupiter.api.Test;

import static com.vidnyan.gae.GrammarEngineFixtures.model;
import static org.junit.jupiter.api.Assertions.*;

class StructureMetricsTest {

    @Test
    void of_ShouldMeasureRulesAndBranching() {
        GrammarModel model = model("a = b | c ; b = \"xx\" ; c = ( b ) ;");

        StructureMetrics metrics = StructureMetrics.of(model);

        assertEquals(3, metrics.ruleCount());
        assertEquals(1, metrics.terminalCount());
        assertEquals(2, metrics.nonTerminalCount());
        // bodies: "b | c" (5), "\"xx\"" (4), "( b )" (5)
        assertEquals(14 / 3.0, metrics.averageRuleLength(), 1e-9);
        assertEquals(5, metrics.maxRuleLength());
        assertEquals(4 / 3.0, metrics.averageBranchingFactor(), 1e-9);
        assertEquals(1, metrics.maxNestingDepth());
        assertEquals(model.normalizedText().length(), metrics.grammarSize());
        assertEquals(3.0 / metrics.grammarSize() * 1000, metrics.ruleDensity(), 1e-9);
    }

    @Test
    void of_EmptyGrammar_ShouldBeAllZero() {
        assertEquals(StructureMetrics.EMPTY, StructureMetrics.of(model("")));
    }
}
