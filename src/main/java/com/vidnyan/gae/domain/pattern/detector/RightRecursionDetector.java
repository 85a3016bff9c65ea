package com.vidnyan.gae.domain.pattern.detector;

import com.vidnyan.gae.domain.model.GrammarModel;
import com.vidnyan.gae.domain.model.Rule;
import com.vidnyan.gae.domain.pattern.GrammarPattern;
import com.vidnyan.gae.domain.pattern.PatternDetector;
import com.vidnyan.gae.domain.pattern.PatternKind;
import com.vidnyan.gae.domain.text.GrammarScanner;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rules whose body ends in a bare identifier.
 */
@Component
public class RightRecursionDetector implements PatternDetector {

    @Override
    public PatternKind kind() {
        return PatternKind.RIGHT_RECURSION;
    }

    @Override
    public Optional<GrammarPattern> detect(GrammarModel model) {
        List<String> examples = new ArrayList<>();
        for (Rule rule : model.rules()) {
            String body = rule.body();
            List<String> identifiers = GrammarScanner.identifiers(body, 0, body.length());
            if (identifiers.isEmpty()) {
                continue;
            }
            String last = identifiers.get(identifiers.size() - 1);
            if (endsWithIdentifier(body, last)) {
                examples.add(rule.name() + " -> " + last);
            }
        }
        if (examples.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(GrammarPattern.of(kind(), "Right recursive rule", examples.size(), examples));
    }

    private boolean endsWithIdentifier(String body, String identifier) {
        if (!body.endsWith(identifier)) {
            return false;
        }
        int start = body.length() - identifier.length();
        if (start > 0 && GrammarScanner.isIdentifierPart(body.charAt(start - 1))) {
            return false;
        }
        return !GrammarScanner.literalMask(body)[body.length() - 1];
    }
}
