package com.vidnyan.gae.domain.check;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vidnyan.gae.GrammarEngineFixtures.model;
import static org.junit.jupiter.api.Assertions.*;

class StructuralCheckerTest {

    private final StructuralChecker checker = new StructuralChecker();

    private CheckResult check(String grammar, ValidationLevel level) {
        return checker.check(CheckContext.of(model(grammar), level));
    }

    @Test
    void check_NoRules_ShouldShortCircuit() {
        CheckResult result = check("", ValidationLevel.STRICT);

        assertEquals(List.of(StructuralChecker.NO_RULES), result.errors());
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void check_DuplicateDefinitions_ShouldBeAnError() {
        CheckResult result = check("a = b ; b = \"x\" ; a = \"y\" ;", ValidationLevel.LENIENT);

        assertEquals(List.of("duplicate rule definitions: [a]"), result.errors());
    }

    @Test
    void check_UndefinedNonTerminal_ShouldDependOnLevel() {
        String grammar = "A = B ;";

        CheckResult strict = check(grammar, ValidationLevel.STRICT);
        assertEquals(List.of("undefined non-terminals: [B]"), strict.errors());

        CheckResult moderate = check(grammar, ValidationLevel.MODERATE);
        assertTrue(moderate.errors().isEmpty());
        assertEquals(List.of("undefined non-terminals: [B]"), moderate.warnings());

        CheckResult lenient = check(grammar, ValidationLevel.LENIENT);
        assertTrue(lenient.isClean());
    }

    @Test
    void check_UnusedRule_ShouldOnlyWarnUnderStrict() {
        String grammar = "A = \"x\" ; B = \"y\" ;";

        CheckResult strict = check(grammar, ValidationLevel.STRICT);
        assertTrue(strict.errors().isEmpty());
        assertEquals(1, strict.warnings().size());
        assertTrue(strict.warnings().get(0).contains("B"));

        assertTrue(check(grammar, ValidationLevel.MODERATE).isClean());
    }

    @Test
    void check_FullyConnectedGrammar_ShouldBeClean() {
        CheckResult result = check("a = b | \"x\" a ; b = a ;", ValidationLevel.STRICT);

        assertTrue(result.isClean(), () -> "Unexpected findings: " + result);
    }
}
