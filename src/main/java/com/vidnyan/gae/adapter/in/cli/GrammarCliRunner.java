package com.vidnyan.gae.adapter.in.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.gae.GrammarProperties;
import com.vidnyan.gae.application.port.in.AnalyzeGrammarUseCase;
import com.vidnyan.gae.application.port.in.AnalyzeGrammarUseCase.AnalysisRequest;
import com.vidnyan.gae.application.port.in.AnalyzeGrammarUseCase.AnalysisResult;
import com.vidnyan.gae.application.port.in.ValidateGrammarUseCase;
import com.vidnyan.gae.application.port.in.ValidateGrammarUseCase.ValidationResult;
import com.vidnyan.gae.domain.check.ValidationLevel;
import com.vidnyan.gae.domain.pattern.AnalysisDepth;
import com.vidnyan.gae.domain.pattern.GrammarPattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * CLI Runner for validating or analyzing a grammar file.
 * Runs when gae.validate.path or gae.analyze.path is set; prints the result as JSON.
 * gae.validate.level and gae.analyze.depth override the configured defaults.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GrammarCliRunner implements CommandLineRunner {

    private final ValidateGrammarUseCase validateGrammarUseCase;
    private final AnalyzeGrammarUseCase analyzeGrammarUseCase;
    private final ObjectMapper objectMapper;
    private final GrammarProperties properties;

    @Value("${gae.validate.path:}")
    private String validatePath;

    @Value("${gae.analyze.path:}")
    private String analyzePath;

    @Value("${gae.validate.level:}")
    private String validateLevel;

    @Value("${gae.analyze.depth:}")
    private String analyzeDepth;

    @Override
    public void run(String... args) throws Exception {
        boolean validate = !isBlank(validatePath);
        boolean analyze = !isBlank(analyzePath);
        if (!validate && !analyze) {
            log.info("No grammar specified. Set gae.validate.path or gae.analyze.path property.");
            return;
        }

        if (validate) {
            System.out.println(validateFile(Path.of(validatePath), validationLevel()));
        }
        if (analyze) {
            System.out.println(analyzeFile(Path.of(analyzePath), analysisDepth()));
        }
    }

    /**
     * Level from gae.validate.level, or the configured default when unset.
     */
    ValidationLevel validationLevel() {
        return isBlank(validateLevel)
                ? properties.getDefaultValidationLevel()
                : ValidationLevel.fromString(validateLevel);
    }

    /**
     * Depth from gae.analyze.depth, or the configured default when unset.
     */
    AnalysisDepth analysisDepth() {
        return isBlank(analyzeDepth)
                ? properties.getDefaultAnalysisDepth()
                : AnalysisDepth.fromString(analyzeDepth);
    }

    /**
     * Validate a grammar file, log a readable report and return the result as JSON.
     */
    public String validateFile(Path file, ValidationLevel level) throws IOException {
        String grammar = Files.readString(file, StandardCharsets.UTF_8);
        ValidationResult result = validateGrammarUseCase.validate(grammar, level);
        printValidation(file, result);
        return toJson(result);
    }

    /**
     * Analyze a grammar file, log a readable report and return the result as JSON.
     */
    public String analyzeFile(Path file, AnalysisDepth depth) throws IOException {
        String grammar = Files.readString(file, StandardCharsets.UTF_8);
        AnalysisResult result = analyzeGrammarUseCase.analyze(new AnalysisRequest(grammar, depth, null));
        printAnalysis(file, result);
        return toJson(result);
    }

    private void printValidation(Path file, ValidationResult result) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" VALIDATION: {}", file.getFileName());
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Level:         {}", result.metadata().validationLevel().value());
        log.info(" Rules:         {}", result.metadata().ruleCount());
        log.info(" Terminals:     {}", result.metadata().terminalCount());
        log.info(" Non-terminals: {}", result.metadata().nonTerminalCount());
        log.info("───────────────────────────────────────────────────────────────");
        result.errors().forEach(e -> log.info(" ERROR   {}", e));
        result.warnings().forEach(w -> log.info(" WARN    {}", w));
        result.suggestions().forEach(s -> log.info(" SUGGEST {}", s));
        log.info(" {}", result.summary());
    }

    private void printAnalysis(Path file, AnalysisResult result) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" ANALYSIS: {}", file.getFileName());
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Depth:       {}", result.metadata().analysisDepth().value());
        log.info(" Rules:       {}", result.structureMetrics().ruleCount());
        log.info(" Max nesting: {}", result.structureMetrics().maxNestingDepth());
        log.info(" Complexity:  {} ({}, performance {})",
                String.format("%.2f", result.complexityAnalysis().score()),
                result.complexityAnalysis().level().label(),
                result.complexityAnalysis().performancePrediction().label());
        log.info("───────────────────────────────────────────────────────────────");
        for (GrammarPattern pattern : result.patterns()) {
            log.info(" {} x{}: {}", pattern.kind().label(), pattern.occurrences(), pattern.description());
        }
        result.optimizationSuggestions().forEach(s -> log.info(" SUGGEST {}", s));
        result.metadata().diagnostics().forEach(d -> log.warn(" {}", d));
        log.info(" {}", result.summary());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private String toJson(Object result) throws JsonProcessingException {
        return objectMapper.writeValueAsString(result);
    }
}
