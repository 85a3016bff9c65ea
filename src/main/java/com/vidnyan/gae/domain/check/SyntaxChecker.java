package com.vidnyan.gae.domain.check;

import com.vidnyan.gae.domain.model.GrammarModel;
import com.vidnyan.gae.domain.model.MalformedLine;
import com.vidnyan.gae.domain.text.GrammarScanner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Character set, bracket balance and rule-line shape.
 * All findings are errors and every check always runs.
 */
@Slf4j
@Component
@Order(10)
public class SyntaxChecker implements GrammarCheck {

    private static final String ALLOWED_PUNCTUATION = "=[]{}()|\";,-+*?.\\";

    @Override
    public CheckCategory category() {
        return CheckCategory.SYNTAX;
    }

    @Override
    public CheckResult check(CheckContext context) {
        GrammarModel model = context.model();
        String text = model.normalizedText();
        CheckResult.Builder result = CheckResult.builder(category());

        SortedSet<String> invalid = invalidCharacters(text);
        if (!invalid.isEmpty()) {
            result.error("invalid characters found: " + invalid);
        }

        checkBrackets(text, result);

        for (MalformedLine line : model.malformedLines()) {
            result.error(String.format("line %d: invalid rule format", line.line()));
        }

        CheckResult built = result.build();
        log.debug("Syntax check: {} errors", built.errors().size());
        return built;
    }

    SortedSet<String> invalidCharacters(String text) {
        SortedSet<String> invalid = new TreeSet<>();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!isAllowed(c)) {
                invalid.add(String.valueOf(c));
            }
        }
        return invalid;
    }

    private boolean isAllowed(char c) {
        return Character.isLetterOrDigit(c)
                || c == '_'
                || Character.isWhitespace(c)
                || ALLOWED_PUNCTUATION.indexOf(c) >= 0;
    }

    /**
     * Stack-based balance check. Brackets inside quoted literals are ignored.
     * A mismatched closer still consumes its opener.
     */
    void checkBrackets(String text, CheckResult.Builder result) {
        boolean[] literal = GrammarScanner.literalMask(text);
        Deque<int[]> stack = new ArrayDeque<>();

        for (int i = 0; i < text.length(); i++) {
            if (literal[i]) {
                continue;
            }
            char c = text.charAt(i);
            int opener = GrammarScanner.OPENERS.indexOf(c);
            int closer = GrammarScanner.CLOSERS.indexOf(c);
            if (opener >= 0) {
                stack.push(new int[] {opener, i});
            } else if (closer >= 0) {
                if (stack.isEmpty()) {
                    result.error(String.format("unmatched closing bracket at position %d: '%c'", i, c));
                } else if (stack.pop()[0] != closer) {
                    result.error(String.format("mismatched brackets at position %d", i));
                }
            }
        }

        // Report leftovers outermost first
        Iterator<int[]> leftovers = stack.descendingIterator();
        while (leftovers.hasNext()) {
            int[] open = leftovers.next();
            result.error(String.format("unmatched opening bracket at position %d: '%c'",
                    open[1], GrammarScanner.OPENERS.charAt(open[0])));
        }
    }
}
