package com.vidnyan.gae.application.service;

import com.vidnyan.gae.GrammarProperties;
import com.vidnyan.gae.application.port.in.AnalyzeGrammarUseCase;
import com.vidnyan.gae.domain.complexity.ComplexityAnalysis;
import com.vidnyan.gae.domain.complexity.ComplexityScorer;
import com.vidnyan.gae.domain.model.GrammarExtractor;
import com.vidnyan.gae.domain.model.GrammarModel;
import com.vidnyan.gae.domain.model.StructureMetrics;
import com.vidnyan.gae.domain.pattern.AnalysisDepth;
import com.vidnyan.gae.domain.pattern.GrammarPattern;
import com.vidnyan.gae.domain.pattern.PatternDetectionService;
import com.vidnyan.gae.domain.suggestion.SuggestionGenerator;
import com.vidnyan.gae.domain.text.GrammarNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Analysis workflow: normalize, extract, detect patterns, score, suggest.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GrammarAnalysisService implements AnalyzeGrammarUseCase {

    static final double HIGH_IMPACT_POTENTIAL = 0.7;

    private final GrammarNormalizer normalizer;
    private final GrammarExtractor extractor;
    private final PatternDetectionService patternDetection;
    private final ComplexityScorer complexityScorer;
    private final SuggestionGenerator suggestionGenerator;
    private final GrammarProperties properties;

    @Override
    public AnalysisResult analyze(AnalysisRequest request) {
        String text = request.grammarText();

        if (properties.exceedsLimit(text)) {
            log.warn("Rejecting grammar of {} chars (limit {})", text.length(), properties.getMaxGrammarLength());
            return emptyResult(request, 0, properties.limitMessage());
        }

        String normalized = "";
        try {
            log.info("Analyzing grammar ({} chars, depth {})", text.length(), request.depth().value());

            // Step 1: Extract structure
            normalized = normalizer.normalize(text);
            GrammarModel model = extractor.extract(normalized);
            StructureMetrics metrics = StructureMetrics.of(model);

            // Step 2: Detect patterns
            List<GrammarPattern> patterns = patternDetection.detect(model, request.depth());

            // Step 3: Score and suggest
            ComplexityAnalysis complexity = complexityScorer.analyze(metrics, patterns);
            List<String> suggestions = suggestionGenerator.forAnalysis(metrics, patterns, complexity);

            AnalysisResult result = new AnalysisResult(
                    metrics,
                    patterns,
                    suggestions,
                    complexity,
                    new AnalysisMetadata(request.depth(), normalized.length(), request.requestedAt(), List.of()));
            log.info("Analysis complete: {}", result.summary());
            return result;
        } catch (RuntimeException e) {
            log.error("Error analyzing grammar: {}", e.getMessage(), e);
            return emptyResult(request, normalized.length(), "internal error during analysis: " + e.getMessage());
        }
    }

    @Override
    public OptimizationReport optimizationReport(String grammarText) {
        AnalysisResult analysis = analyze(new AnalysisRequest(grammarText, AnalysisDepth.COMPREHENSIVE, null));
        ComplexityAnalysis complexity = analysis.complexityAnalysis();

        ReportSummary summary = new ReportSummary(
                complexity.level(),
                complexity.performancePrediction(),
                priorityOf(analysis));

        return new OptimizationReport(
                summary,
                analysis.structureMetrics(),
                analysis.patterns().stream().map(PatternDigest::of).toList(),
                analysis.optimizationSuggestions(),
                complexity);
    }

    static OptimizationPriority priorityOf(AnalysisResult analysis) {
        double score = analysis.complexityAnalysis().score();
        long highImpact = analysis.patterns().stream()
                .filter(p -> p.optimizationPotential() > HIGH_IMPACT_POTENTIAL)
                .count();

        if (score > 0.8 || highImpact > 3) {
            return OptimizationPriority.HIGH;
        } else if (score > 0.5 || highImpact > 1) {
            return OptimizationPriority.MEDIUM;
        }
        return OptimizationPriority.LOW;
    }

    private AnalysisResult emptyResult(AnalysisRequest request, int grammarLength, String diagnostic) {
        List<GrammarPattern> none = List.of();
        ComplexityAnalysis complexity = complexityScorer.analyze(StructureMetrics.EMPTY, none);
        return new AnalysisResult(
                StructureMetrics.EMPTY,
                none,
                List.of(),
                complexity,
                new AnalysisMetadata(request.depth(), grammarLength, request.requestedAt(), List.of(diagnostic)));
    }
}
