package com.vidnyan.gae.domain.pattern.detector;

import com.vidnyan.gae.domain.model.GrammarModel;
import com.vidnyan.gae.domain.pattern.GrammarPattern;
import com.vidnyan.gae.domain.pattern.PatternDetector;
import com.vidnyan.gae.domain.pattern.PatternKind;
import com.vidnyan.gae.domain.text.GrammarScanner;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Parenthesized groups that directly contain another parenthesized group.
 */
@Component
public class NestedGroupDetector implements PatternDetector {

    @Override
    public PatternKind kind() {
        return PatternKind.NESTED_GROUP;
    }

    @Override
    public Optional<GrammarPattern> detect(GrammarModel model) {
        String text = model.normalizedText();
        boolean[] literal = GrammarScanner.literalMask(text);
        Deque<Frame> open = new ArrayDeque<>();
        List<String> nested = new ArrayList<>();

        for (int i = 0; i < text.length(); i++) {
            if (literal[i]) {
                continue;
            }
            char c = text.charAt(i);
            if (c == '(') {
                if (!open.isEmpty()) {
                    open.peek().hasChild = true;
                }
                open.push(new Frame(i));
            } else if (c == ')' && !open.isEmpty()) {
                Frame frame = open.pop();
                if (frame.hasChild) {
                    nested.add(text.substring(frame.start + 1, i));
                }
            }
        }

        if (nested.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(GrammarPattern.of(kind(), "Nested grouping", nested.size(), nested));
    }

    private static final class Frame {
        private final int start;
        private boolean hasChild;

        private Frame(int start) {
            this.start = start;
        }
    }
}
