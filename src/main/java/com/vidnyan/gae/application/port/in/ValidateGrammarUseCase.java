package com.vidnyan.gae.application.port.in;

import com.vidnyan.gae.domain.check.ValidationLevel;
import com.vidnyan.gae.domain.complexity.ComplexityAssessment;

import java.util.List;

/**
 * Validate EBNF grammar text.
 * Total: never throws for any input; failures are reported inside the result.
 */
public interface ValidateGrammarUseCase {

    ValidationResult validate(ValidationRequest request);

    default ValidationResult validate(String grammarText, ValidationLevel level) {
        return validate(new ValidationRequest(grammarText, level));
    }

    default ValidationResult validate(String grammarText) {
        return validate(ValidationRequest.of(grammarText));
    }

    /**
     * Symbol-count based complexity of a grammar, without validating it.
     */
    ComplexityAssessment assessComplexity(String grammarText);

    /**
     * Validation request parameters.
     */
    record ValidationRequest(
        String grammarText,
        ValidationLevel level
    ) {
        public ValidationRequest {
            grammarText = grammarText == null ? "" : grammarText;
            level = level == null ? ValidationLevel.STRICT : level;
        }

        public static ValidationRequest of(String grammarText) {
            return new ValidationRequest(grammarText, ValidationLevel.STRICT);
        }
    }

    /**
     * Validation verdict. {@code valid} is true exactly when there are no errors.
     */
    record ValidationResult(
        boolean valid,
        List<String> errors,
        List<String> warnings,
        List<String> suggestions,
        ValidationMetadata metadata
    ) {
        public ValidationResult {
            errors = List.copyOf(errors);
            warnings = List.copyOf(warnings);
            suggestions = List.copyOf(suggestions);
            if (valid != errors.isEmpty()) {
                throw new IllegalArgumentException("valid must be true exactly when there are no errors");
            }
        }

        public static ValidationResult of(List<String> errors, List<String> warnings,
                                          List<String> suggestions, ValidationMetadata metadata) {
            return new ValidationResult(errors.isEmpty(), errors, warnings, suggestions, metadata);
        }

        public String summary() {
            return valid
                    ? String.format("Grammar validation successful. %d warnings found.", warnings.size())
                    : String.format("Grammar validation failed. %d errors found.", errors.size());
        }
    }

    record ValidationMetadata(
        ValidationLevel validationLevel,
        int ruleCount,
        int terminalCount,
        int nonTerminalCount
    ) {}
}
