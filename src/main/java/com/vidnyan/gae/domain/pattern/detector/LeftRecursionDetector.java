package com.vidnyan.gae.domain.pattern.detector;

import com.vidnyan.gae.domain.model.GrammarModel;
import com.vidnyan.gae.domain.model.Rule;
import com.vidnyan.gae.domain.pattern.GrammarPattern;
import com.vidnyan.gae.domain.pattern.PatternDetector;
import com.vidnyan.gae.domain.pattern.PatternKind;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Rules with an alternative that starts with the rule's own name.
 * Uses the same test as the semantic checker.
 */
@Component
public class LeftRecursionDetector implements PatternDetector {

    @Override
    public PatternKind kind() {
        return PatternKind.LEFT_RECURSION;
    }

    @Override
    public Optional<GrammarPattern> detect(GrammarModel model) {
        List<String> names = model.rules().stream()
                .filter(Rule::isLeftRecursive)
                .map(Rule::name)
                .toList();
        if (names.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(GrammarPattern.of(kind(), "Left recursive rule", names.size(), names));
    }
}
