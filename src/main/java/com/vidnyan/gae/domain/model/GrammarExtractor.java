package com.vidnyan.gae.domain.model;

import com.vidnyan.gae.domain.text.GrammarScanner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Builds a {@link GrammarModel} from normalized grammar text.
 * 
 * Rules are line scoped: an identifier at line start, a definition sign, then a body
 * that runs to the end of the line with an optional trailing ';'. Terminal and
 * non-terminal sets are derived from the whole text, not per rule: every identifier
 * outside literals counts as a use unless it precedes the definition sign of its line.
 */
@Slf4j
@Component
public class GrammarExtractor {

    public GrammarModel extract(String normalizedText) {
        List<Rule> rules = new ArrayList<>();
        List<MalformedLine> malformed = new ArrayList<>();
        SortedSet<String> nonTerminals = new TreeSet<>();

        String[] lines = normalizedText.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            int lineNumber = i + 1;
            String line = lines[i].strip();
            if (line.isEmpty()) {
                continue;
            }

            int definition = GrammarScanner.indexOfDefinition(line);
            if (definition < 0) {
                // No left-hand side on this line, so every identifier is a use
                nonTerminals.addAll(GrammarScanner.identifiers(line, 0, line.length()));
                continue;
            }

            Optional<Rule> rule = matchRule(line, lineNumber);
            if (rule.isPresent()) {
                rules.add(rule.get());
            } else {
                malformed.add(new MalformedLine(lineNumber, line));
            }

            // Anything before the first definition sign is a definition, not a use
            nonTerminals.addAll(GrammarScanner.identifiers(line, definition + 1, line.length()));
        }

        SortedSet<String> terminals = new TreeSet<>(GrammarScanner.quotedLiterals(normalizedText));

        log.debug("Extracted {} rules, {} terminals, {} non-terminals, {} malformed lines",
                rules.size(), terminals.size(), nonTerminals.size(), malformed.size());
        return new GrammarModel(normalizedText, rules, terminals, nonTerminals, malformed);
    }

    /**
     * Match {@code identifier ws* '=' ws* body [';']} against one stripped line.
     * A line with nothing at all after the definition sign does not match;
     * {@code name = ;} matches with an empty body.
     */
    static Optional<Rule> matchRule(String line, int lineNumber) {
        if (line.isEmpty() || !GrammarScanner.isIdentifierStart(line.charAt(0))) {
            return Optional.empty();
        }
        int i = 1;
        while (i < line.length() && GrammarScanner.isIdentifierPart(line.charAt(i))) {
            i++;
        }
        String name = line.substring(0, i);

        while (i < line.length() && Character.isWhitespace(line.charAt(i))) {
            i++;
        }
        if (i >= line.length() || line.charAt(i) != '=') {
            return Optional.empty();
        }

        String rest = line.substring(i + 1).strip();
        if (rest.isEmpty()) {
            return Optional.empty();
        }
        String body = rest.endsWith(";")
                ? rest.substring(0, rest.length() - 1).strip()
                : rest;
        return Optional.of(new Rule(name, body, lineNumber));
    }
}
