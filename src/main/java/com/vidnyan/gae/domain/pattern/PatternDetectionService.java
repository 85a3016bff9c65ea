package com.vidnyan.gae.domain.pattern;

import com.vidnyan.gae.domain.model.GrammarModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Runs every registered detector the requested depth allows.
 * Patterns are returned in {@link PatternKind} order.
 */
@Slf4j
@Component
public class PatternDetectionService {

    private final List<PatternDetector> detectors;

    public PatternDetectionService(List<PatternDetector> detectors) {
        this.detectors = detectors.stream()
                .sorted(Comparator.comparing(PatternDetector::kind))
                .toList();
    }

    public List<GrammarPattern> detect(GrammarModel model, AnalysisDepth depth) {
        List<GrammarPattern> patterns = new ArrayList<>();
        for (PatternDetector detector : detectors) {
            if (!depth.includes(detector.kind())) {
                continue;
            }
            Optional<GrammarPattern> pattern = detector.detect(model);
            pattern.ifPresent(p -> {
                log.debug("  {} found {} occurrences", detector.getName(), p.occurrences());
                patterns.add(p);
            });
        }
        return patterns;
    }

    public List<PatternDetector> detectors() {
        return detectors;
    }
}
