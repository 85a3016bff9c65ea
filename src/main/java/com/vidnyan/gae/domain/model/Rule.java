package com.vidnyan.gae.domain.model;

import com.vidnyan.gae.domain.text.GrammarScanner;

import java.util.List;

/**
 * A single production {@code name = body ;}.
 * Immutable value object; line is 1-based within the normalized text.
 */
public record Rule(
    String name,
    String body,
    int line
) {

    /**
     * Alternatives of the body split on '|' outside literals, trimmed.
     */
    public List<String> alternatives() {
        return GrammarScanner.splitAlternatives(body);
    }

    /**
     * Number of alternatives (bar count + 1).
     */
    public int branchingFactor() {
        return GrammarScanner.countStructural(body, '|') + 1;
    }

    /**
     * True when some alternative begins with this rule's own name as a whole identifier.
     */
    public boolean isLeftRecursive() {
        for (String alternative : alternatives()) {
            if (startsWithIdentifier(alternative, name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True when some alternative is blank or the empty literal.
     */
    public boolean hasEmptyAlternative() {
        return alternatives().stream()
                .anyMatch(alt -> alt.isEmpty() || alt.equals("\"\""));
    }

    private static boolean startsWithIdentifier(String text, String identifier) {
        if (!text.startsWith(identifier)) {
            return false;
        }
        return text.length() == identifier.length()
                || !GrammarScanner.isIdentifierPart(text.charAt(identifier.length()));
    }
}
