package com.vidnyan.gae.domain.pattern.detector;

import com.vidnyan.gae.domain.model.GrammarModel;
import com.vidnyan.gae.domain.pattern.GrammarPattern;
import com.vidnyan.gae.domain.pattern.PatternDetector;
import com.vidnyan.gae.domain.pattern.PatternKind;
import com.vidnyan.gae.domain.text.GrammarScanner;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * One instance when the global bracket nesting depth exceeds {@value #MAX_COMFORTABLE_DEPTH}.
 */
@Component
public class DeepNestingDetector implements PatternDetector {

    static final int MAX_COMFORTABLE_DEPTH = 5;

    @Override
    public PatternKind kind() {
        return PatternKind.DEEP_NESTING;
    }

    @Override
    public Optional<GrammarPattern> detect(GrammarModel model) {
        int depth = GrammarScanner.maxNestingDepth(model.normalizedText());
        if (depth <= MAX_COMFORTABLE_DEPTH) {
            return Optional.empty();
        }
        return Optional.of(GrammarPattern.of(kind(),
                "Deep nesting detected (depth: " + depth + ")", 1,
                List.of("Maximum nesting depth: " + depth)));
    }
}
