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
 * Choice alternatives. Occurrences count every '|' in the grammar; examples name
 * the rules that branch.
 */
@Component
public class AlternationDetector implements PatternDetector {

    @Override
    public PatternKind kind() {
        return PatternKind.ALTERNATION;
    }

    @Override
    public Optional<GrammarPattern> detect(GrammarModel model) {
        int bars = GrammarScanner.countStructural(model.normalizedText(), '|');
        if (bars == 0) {
            return Optional.empty();
        }
        List<String> branching = model.rules().stream()
                .filter(rule -> rule.branchingFactor() > 1)
                .map(rule -> rule.name() + " (" + rule.branchingFactor() + " alternatives)")
                .toList();
        return Optional.of(GrammarPattern.of(kind(), "Choice alternatives", bars, branching));
    }
}
