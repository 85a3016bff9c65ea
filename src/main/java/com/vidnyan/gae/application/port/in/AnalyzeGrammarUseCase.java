package com.vidnyan.gae.application.port.in;

import com.vidnyan.gae.domain.complexity.ComplexityAnalysis;
import com.vidnyan.gae.domain.complexity.ComplexityLevel;
import com.vidnyan.gae.domain.complexity.PerformancePrediction;
import com.vidnyan.gae.domain.model.StructureMetrics;
import com.vidnyan.gae.domain.pattern.AnalysisDepth;
import com.vidnyan.gae.domain.pattern.GrammarPattern;
import com.vidnyan.gae.domain.pattern.PatternKind;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Analyze the structure of EBNF grammar text.
 * Total: never throws for any input; failures land in the metadata diagnostics.
 */
public interface AnalyzeGrammarUseCase {

    AnalysisResult analyze(AnalysisRequest request);

    default AnalysisResult analyze(String grammarText, AnalysisDepth depth) {
        return analyze(new AnalysisRequest(grammarText, depth, null));
    }

    default AnalysisResult analyze(String grammarText) {
        return analyze(AnalysisRequest.of(grammarText));
    }

    /**
     * Comprehensive analysis condensed into a prioritized report.
     */
    OptimizationReport optimizationReport(String grammarText);

    /**
     * Analysis request parameters.
     *
     * @param requestedAt caller-supplied timestamp echoed into the metadata, may be null
     */
    record AnalysisRequest(
        String grammarText,
        AnalysisDepth depth,
        Instant requestedAt
    ) {
        public AnalysisRequest {
            grammarText = grammarText == null ? "" : grammarText;
            depth = depth == null ? AnalysisDepth.COMPREHENSIVE : depth;
        }

        public static AnalysisRequest of(String grammarText) {
            return new AnalysisRequest(grammarText, AnalysisDepth.COMPREHENSIVE, null);
        }
    }

    /**
     * Structural report.
     */
    record AnalysisResult(
        StructureMetrics structureMetrics,
        List<GrammarPattern> patterns,
        List<String> optimizationSuggestions,
        ComplexityAnalysis complexityAnalysis,
        AnalysisMetadata metadata
    ) {
        public AnalysisResult {
            patterns = List.copyOf(patterns);
            optimizationSuggestions = List.copyOf(optimizationSuggestions);
        }

        public List<GrammarPattern> patternsOf(PatternKind kind) {
            return patterns.stream()
                    .filter(p -> p.kind() == kind)
                    .toList();
        }

        public String summary() {
            return String.format(Locale.ROOT,
                    "Grammar analysis completed. Complexity: %.2f, Patterns: %d, Suggestions: %d",
                    complexityAnalysis.score(), patterns.size(), optimizationSuggestions.size());
        }
    }

    /**
     * @param grammarLength length of the normalized grammar text
     * @param diagnostics   reasons the analysis was cut short, empty on success
     */
    record AnalysisMetadata(
        AnalysisDepth analysisDepth,
        int grammarLength,
        Instant analysisTimestamp,
        List<String> diagnostics
    ) {
        public AnalysisMetadata {
            diagnostics = List.copyOf(diagnostics);
        }
    }

    /**
     * Optimization report built from a comprehensive analysis.
     */
    record OptimizationReport(
        ReportSummary summary,
        StructureMetrics metrics,
        List<PatternDigest> patterns,
        List<String> suggestions,
        ComplexityAnalysis complexity
    ) {}

    record ReportSummary(
        ComplexityLevel complexityLevel,
        PerformancePrediction performancePrediction,
        OptimizationPriority optimizationPriority
    ) {}

    record PatternDigest(
        PatternKind type,
        String description,
        int count,
        double impact
    ) {
        public static PatternDigest of(GrammarPattern pattern) {
            return new PatternDigest(pattern.kind(), pattern.description(),
                    pattern.occurrences(), pattern.optimizationPotential());
        }
    }

    enum OptimizationPriority {
        LOW,
        MEDIUM,
        HIGH
    }
}
