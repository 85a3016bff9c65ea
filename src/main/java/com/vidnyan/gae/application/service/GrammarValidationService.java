package com.vidnyan.gae.application.service;

import com.vidnyan.gae.GrammarProperties;
import com.vidnyan.gae.application.port.in.ValidateGrammarUseCase;
import com.vidnyan.gae.domain.check.CheckContext;
import com.vidnyan.gae.domain.check.CheckResult;
import com.vidnyan.gae.domain.check.GrammarCheck;
import com.vidnyan.gae.domain.complexity.ComplexityAssessment;
import com.vidnyan.gae.domain.complexity.ComplexityScorer;
import com.vidnyan.gae.domain.model.GrammarExtractor;
import com.vidnyan.gae.domain.model.GrammarModel;
import com.vidnyan.gae.domain.model.StructureMetrics;
import com.vidnyan.gae.domain.suggestion.SuggestionGenerator;
import com.vidnyan.gae.domain.text.GrammarNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Validation workflow: normalize, extract, run every check, suggest.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GrammarValidationService implements ValidateGrammarUseCase {

    private final GrammarNormalizer normalizer;
    private final GrammarExtractor extractor;
    private final List<GrammarCheck> checks;
    private final SuggestionGenerator suggestionGenerator;
    private final ComplexityScorer complexityScorer;
    private final GrammarProperties properties;

    @Override
    public ValidationResult validate(ValidationRequest request) {
        String text = request.grammarText();
        ValidationMetadata emptyMetadata = new ValidationMetadata(request.level(), 0, 0, 0);

        if (properties.exceedsLimit(text)) {
            log.warn("Rejecting grammar of {} chars (limit {})", text.length(), properties.getMaxGrammarLength());
            return failure(properties.limitMessage(), emptyMetadata);
        }

        try {
            log.info("Validating grammar ({} chars, level {})", text.length(), request.level().value());
            GrammarModel model = extractor.extract(normalizer.normalize(text));
            CheckContext context = CheckContext.of(model, request.level());

            List<String> errors = new ArrayList<>();
            List<String> warnings = new ArrayList<>();
            for (GrammarCheck check : checks) {
                CheckResult result = check.check(context);
                errors.addAll(result.errors());
                warnings.addAll(result.warnings());
                if (!result.isClean()) {
                    log.debug("  {}: {} errors, {} warnings",
                            check.getName(), result.errors().size(), result.warnings().size());
                }
            }

            StructureMetrics metrics = StructureMetrics.of(model);
            List<String> suggestions = suggestionGenerator.forValidation(errors, warnings, metrics);
            ValidationMetadata metadata = new ValidationMetadata(
                    request.level(),
                    metrics.ruleCount(),
                    metrics.terminalCount(),
                    metrics.nonTerminalCount());

            ValidationResult result = ValidationResult.of(errors, warnings, suggestions, metadata);
            log.info("Validation complete: {}", result.summary());
            return result;
        } catch (RuntimeException e) {
            log.error("Error validating grammar: {}", e.getMessage(), e);
            return failure("internal error during validation: " + e.getMessage(), emptyMetadata);
        }
    }

    @Override
    public ComplexityAssessment assessComplexity(String grammarText) {
        String text = grammarText == null ? "" : grammarText;
        if (properties.exceedsLimit(text)) {
            log.warn("Not scoring grammar of {} chars (limit {})", text.length(), properties.getMaxGrammarLength());
            return complexityScorer.assess(StructureMetrics.EMPTY);
        }
        GrammarModel model = extractor.extract(normalizer.normalize(text));
        return complexityScorer.assess(StructureMetrics.of(model));
    }

    private ValidationResult failure(String error, ValidationMetadata metadata) {
        List<String> errors = List.of(error);
        return ValidationResult.of(errors, List.of(),
                suggestionGenerator.forValidation(errors, List.of(), StructureMetrics.EMPTY), metadata);
    }
}
