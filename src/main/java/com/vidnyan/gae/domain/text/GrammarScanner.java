package com.vidnyan.gae.domain.text;

import java.util.ArrayList;
import java.util.List;

/**
 * Single-pass scanning primitives shared by every stage.
 * 
 * A quoted literal runs from a double quote to the next double quote on the same line.
 * An unterminated literal ends at the line break. Brackets, bars and identifiers
 * inside literals are never structural.
 */
public final class GrammarScanner {

    public static final String OPENERS = "([{";
    public static final String CLOSERS = ")]}";

    private GrammarScanner() {
    }

    /**
     * Mark every character that belongs to a quoted literal, quotes included.
     */
    public static boolean[] literalMask(String text) {
        boolean[] mask = new boolean[text.length()];
        boolean inLiteral = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n' || c == '\r') {
                inLiteral = false;
                continue;
            }
            if (c == '"') {
                mask[i] = true;
                inLiteral = !inLiteral;
                continue;
            }
            mask[i] = inLiteral;
        }
        return mask;
    }

    /**
     * Contents of every closed quoted literal, in order of appearance.
     */
    public static List<String> quotedLiterals(String text) {
        List<String> literals = new ArrayList<>();
        int start = -1;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n' || c == '\r') {
                start = -1;
            } else if (c == '"') {
                if (start < 0) {
                    start = i + 1;
                } else {
                    literals.add(text.substring(start, i));
                    start = -1;
                }
            }
        }
        return literals;
    }

    /**
     * Index of the first '=' outside literals, or -1.
     */
    public static int indexOfDefinition(String line) {
        boolean[] mask = literalMask(line);
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) == '=' && !mask[i]) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Split on '|' outside literals. Alternatives are trimmed; empty ones are kept.
     */
    public static List<String> splitAlternatives(String body) {
        boolean[] mask = literalMask(body);
        List<String> alternatives = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < body.length(); i++) {
            if (body.charAt(i) == '|' && !mask[i]) {
                alternatives.add(body.substring(start, i).strip());
                start = i + 1;
            }
        }
        alternatives.add(body.substring(start).strip());
        return alternatives;
    }

    /**
     * Count occurrences of a structural character outside literals.
     */
    public static int countStructural(String text, char target) {
        boolean[] mask = literalMask(text);
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == target && !mask[i]) {
                count++;
            }
        }
        return count;
    }

    /**
     * Maximum bracket nesting depth. Any opener increments, any closer decrements
     * with a floor of zero, so mismatched pairs still count.
     */
    public static int maxNestingDepth(String text) {
        boolean[] mask = literalMask(text);
        int depth = 0;
        int max = 0;
        for (int i = 0; i < text.length(); i++) {
            if (mask[i]) {
                continue;
            }
            char c = text.charAt(i);
            if (OPENERS.indexOf(c) >= 0) {
                depth++;
                max = Math.max(max, depth);
            } else if (CLOSERS.indexOf(c) >= 0) {
                depth = Math.max(0, depth - 1);
            }
        }
        return max;
    }

    /**
     * Contents of innermost groups of one bracket kind: an opener followed by no other
     * bracket of the same kind before its closer. Leftmost, non-overlapping.
     */
    public static List<String> innermostGroups(String text, char open, char close) {
        boolean[] mask = literalMask(text);
        List<String> groups = new ArrayList<>();
        int start = -1;
        for (int i = 0; i < text.length(); i++) {
            if (mask[i]) {
                continue;
            }
            char c = text.charAt(i);
            if (c == open) {
                start = i + 1;
            } else if (c == close && start >= 0) {
                groups.add(text.substring(start, i));
                start = -1;
            }
        }
        return groups;
    }

    /**
     * Identifiers outside literals in {@code text[from, to)}. An identifier is a run of
     * word characters that starts with an ASCII letter; runs starting with a digit or an
     * underscore are skipped whole.
     */
    public static List<String> identifiers(String text, int from, int to) {
        boolean[] mask = literalMask(text);
        List<String> identifiers = new ArrayList<>();
        int i = from;
        while (i < to) {
            if (mask[i] || !isWordChar(text.charAt(i))) {
                i++;
                continue;
            }
            int start = i;
            while (i < to && !mask[i] && isWordChar(text.charAt(i))) {
                i++;
            }
            if (isIdentifierStart(text.charAt(start))) {
                identifiers.add(text.substring(start, i));
            }
        }
        return identifiers;
    }

    public static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    public static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9') || c == '_';
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
