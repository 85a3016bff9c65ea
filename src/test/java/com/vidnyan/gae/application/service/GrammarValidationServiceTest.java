package com.vidnyan.gae.application.service;

import com.vidnyan.gae.GrammarProperties;
import com.vidnyan.gae.application.port.in.ValidateGrammarUseCase.ValidationResult;
import com.vidnyan.gae.domain.check.CheckCategory;
import com.vidnyan.gae.domain.check.CheckContext;
import com.vidnyan.gae.domain.check.CheckResult;
import com.vidnyan.gae.domain.check.GrammarCheck;
import com.vidnyan.gae.domain.check.ValidationLevel;
import com.vidnyan.gae.domain.complexity.ComplexityAssessment;
import com.vidnyan.gae.domain.complexity.ComplexityLevel;
import com.vidnyan.gae.domain.complexity.ComplexityScorer;
import com.vidnyan.gae.domain.model.GrammarExtractor;
import com.vidnyan.gae.domain.suggestion.SuggestionGenerator;
import com.vidnyan.gae.domain.text.GrammarNormalizer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vidnyan.gae.GrammarEngineFixtures.validationService;
import static org.junit.jupiter.api.Assertions.*;

class GrammarValidationServiceTest {

    private final GrammarValidationService service = validationService();

    @Test
    void validate_LeftRecursion_ShouldFailStrictAndWarnLenient() {
        String grammar = "A = A \"x\" | \"y\" ;";

        ValidationResult strict = service.validate(grammar, ValidationLevel.STRICT);
        assertFalse(strict.valid());
        assertTrue(strict.errors().stream().anyMatch(e -> e.contains("left recursive") && e.contains("A")));

        ValidationResult lenient = service.validate(grammar, ValidationLevel.LENIENT);
        assertTrue(lenient.valid(), () -> "Unexpected errors: " + lenient.errors());
        assertTrue(lenient.warnings().stream().anyMatch(w -> w.contains("A")));
    }

    @Test
    void validate_UndefinedSymbol_ShouldOnlyMatterUnderStrict() {
        ValidationResult strict = service.validate("A = B ;", ValidationLevel.STRICT);
        assertFalse(strict.valid());
        assertTrue(strict.errors().stream().anyMatch(e -> e.contains("B")));

        ValidationResult lenient = service.validate("A = B ;", ValidationLevel.LENIENT);
        assertTrue(lenient.valid());
        assertTrue(lenient.errors().isEmpty());
        assertTrue(lenient.warnings().isEmpty());
    }

    @Test
    void validate_BareStatementReferencingUndefinedRule_ShouldFailStrict() {
        ValidationResult result = service.validate("A = \"x\" ; B ;", ValidationLevel.STRICT);

        assertFalse(result.valid());
        assertEquals(List.of("undefined non-terminals: [B]"), result.errors());
        assertEquals(List.of("unused rules: [A]"), result.warnings());
    }

    @Test
    void validate_UnusedRule_ShouldWarnButStayValid() {
        ValidationResult result = service.validate("A = \"x\" ; B = \"y\" ;", ValidationLevel.STRICT);

        assertTrue(result.valid());
        assertTrue(result.warnings().stream().anyMatch(w -> w.contains("B")));
        assertEquals(List.of(SuggestionGenerator.ADDRESS_WARNINGS), result.suggestions());
    }

    @Test
    void validate_EmptyGrammar_ShouldReportNoRules() {
        ValidationResult result = service.validate("", ValidationLevel.STRICT);

        assertFalse(result.valid());
        assertTrue(result.errors().stream().anyMatch(e -> e.contains("no valid rules found")));
        assertEquals(0, result.metadata().ruleCount());
        assertEquals(ValidationLevel.STRICT, result.metadata().validationLevel());
    }

    @Test
    void validate_NullText_ShouldBehaveLikeEmptyText() {
        assertEquals(service.validate("", ValidationLevel.MODERATE), service.validate(null, ValidationLevel.MODERATE));
    }

    @Test
    void validate_ShouldFillMetadataCounts() {
        ValidationResult result = service.validate(
                "expr = term { \"+\" term } ; term = \"x\" | \"y\" | group ; group = \"(\" expr \")\" ;");

        assertTrue(result.valid(), () -> "Unexpected errors: " + result.errors());
        assertEquals(3, result.metadata().ruleCount());
        assertEquals(5, result.metadata().terminalCount());
        assertEquals(3, result.metadata().nonTerminalCount());
        assertEquals("Grammar validation successful. 0 warnings found.", result.summary());
    }

    @Test
    void validate_ShouldBeIdempotent() {
        String grammar = "a = ( b | c ; b = \"x\" ; c = d ; a = \"z\" ;";

        for (ValidationLevel level : ValidationLevel.values()) {
            assertEquals(service.validate(grammar, level), service.validate(grammar, level));
        }
    }

    @Test
    void validate_ValidFlag_ShouldTrackErrorsForArbitraryInput() {
        List<String> inputs = List.of("", "garbage", "= = =", "a = ((( ;", "))) a = b", "\"\"\"",
                "a = \"x\" ; b = a | ;", "x = y ; y = x ;", "/* open", "a = [b] {c} (d) ; b=c; c=d; d=\"1\";");

        for (String input : inputs) {
            for (ValidationLevel level : ValidationLevel.values()) {
                ValidationResult result = service.validate(input, level);
                assertEquals(result.errors().isEmpty(), result.valid(), input);
            }
        }
    }

    @Test
    void validate_SyntaxErrors_ShouldSuggestFixingThemFirst() {
        ValidationResult result = service.validate("a = ( \"x\" ;", ValidationLevel.LENIENT);

        assertFalse(result.valid());
        assertEquals(SuggestionGenerator.FIX_ERRORS, result.suggestions().get(0));
        assertEquals("Grammar validation failed. 1 errors found.", result.summary());
    }

    @Test
    void validate_OversizedInput_ShouldBeRejectedWithDiagnostic() {
        GrammarProperties properties = new GrammarProperties();
        properties.setMaxGrammarLength(10);
        GrammarValidationService limited = validationService(properties);

        ValidationResult result = limited.validate("abcdefghijk = \"x\" ;", ValidationLevel.STRICT);

        assertFalse(result.valid());
        assertEquals(List.of("grammar text exceeds maximum length of 10 characters"), result.errors());
    }

    @Test
    void validate_FailingCheck_ShouldReportInternalError() {
        GrammarCheck broken = new GrammarCheck() {
            @Override
            public CheckCategory category() {
                return CheckCategory.SEMANTIC;
            }

            @Override
            public CheckResult check(CheckContext context) {
                throw new IllegalStateException("boom");
            }
        };
        GrammarValidationService failing = new GrammarValidationService(
                new GrammarNormalizer(), new GrammarExtractor(), List.of(broken),
                new SuggestionGenerator(), new ComplexityScorer(), new GrammarProperties());

        ValidationResult result = failing.validate("a = \"x\" ;", ValidationLevel.MODERATE);

        assertFalse(result.valid());
        assertEquals(List.of("internal error during validation: boom"), result.errors());
        assertEquals(ValidationLevel.MODERATE, result.metadata().validationLevel());
    }

    @Test
    void assessComplexity_ShouldUseSymbolCounts() {
        ComplexityAssessment assessment = service.assessComplexity("a = b \"x\" ; b = \"y\" ;");

        assertEquals(2, assessment.ruleCount());
        assertEquals(2, assessment.terminalCount());
        assertEquals(1, assessment.nonTerminalCount());
        assertEquals(0, assessment.maxNestingDepth());
        // 0.02 + 0.01 + 0.01 + 0.001 * avg(5, 3)
        assertEquals(0.044, assessment.score(), 1e-9);
        assertEquals(ComplexityLevel.LOW, assessment.level());
    }
}
