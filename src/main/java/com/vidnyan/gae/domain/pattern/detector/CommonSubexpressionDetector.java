package com.vidnyan.gae.domain.pattern.detector;

import com.vidnyan.gae.domain.model.GrammarModel;
import com.vidnyan.gae.domain.pattern.GrammarPattern;
import com.vidnyan.gae.domain.pattern.PatternDetector;
import com.vidnyan.gae.domain.pattern.PatternKind;
import com.vidnyan.gae.domain.text.GrammarScanner;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bracketed spans repeated verbatim, candidates for a separate rule.
 */
@Component
public class CommonSubexpressionDetector implements PatternDetector {

    static final int MIN_SPAN_LENGTH = 5;

    private static final String PAIRS = "()[]{}";

    @Override
    public PatternKind kind() {
        return PatternKind.COMMON_SUBEXPRESSION;
    }

    @Override
    public Optional<GrammarPattern> detect(GrammarModel model) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (int p = 0; p < PAIRS.length(); p += 2) {
            for (String span : GrammarScanner.innermostGroups(model.normalizedText(), PAIRS.charAt(p), PAIRS.charAt(p + 1))) {
                if (span.length() > MIN_SPAN_LENGTH) {
                    counts.merge(span, 1, Integer::sum);
                }
            }
        }

        List<String> repeated = counts.entrySet().stream()
                .filter(e -> e.getValue() > 1)
                .map(Map.Entry::getKey)
                .toList();
        if (repeated.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(GrammarPattern.of(kind(),
                "Repeated sub-expressions that could be factored", repeated.size(), repeated));
    }
}
