package com.vidnyan.gae.domain.pattern.detector;

import com.vidnyan.gae.domain.model.GrammarModel;
import com.vidnyan.gae.domain.pattern.GrammarPattern;
import com.vidnyan.gae.domain.pattern.PatternDetector;
import com.vidnyan.gae.domain.text.GrammarScanner;

import java.util.List;
import java.util.Optional;

/**
 * Counts innermost groups of one bracket kind; examples are the group contents.
 */
abstract class InnermostGroupDetector implements PatternDetector {

    private final char open;
    private final char close;
    private final String description;

    protected InnermostGroupDetector(char open, char close, String description) {
        this.open = open;
        this.close = close;
        this.description = description;
    }

    @Override
    public Optional<GrammarPattern> detect(GrammarModel model) {
        List<String> groups = GrammarScanner.innermostGroups(model.normalizedText(), open, close);
        if (groups.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(GrammarPattern.of(kind(), description, groups.size(), groups));
    }
}
