package com.vidnyan.gae.domain.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;

/**
 * Everything extracted from one normalized grammar.
 * Built fresh per call and never shared between calls.
 *
 * @param normalizedText  output of the normalizer
 * @param rules           rules in source order, duplicates included
 * @param terminals       distinct literal contents
 * @param nonTerminals    distinct identifiers used on the right of a definition sign
 * @param malformedLines  lines with a definition sign that are not rule shaped
 */
public record GrammarModel(
    String normalizedText,
    List<Rule> rules,
    SortedSet<String> terminals,
    SortedSet<String> nonTerminals,
    List<MalformedLine> malformedLines
) {

    public GrammarModel {
        rules = List.copyOf(rules);
        terminals = Collections.unmodifiableSortedSet(terminals);
        nonTerminals = Collections.unmodifiableSortedSet(nonTerminals);
        malformedLines = List.copyOf(malformedLines);
    }

    /**
     * Distinct rule names in order of first definition.
     */
    public Set<String> ruleNames() {
        Set<String> names = new LinkedHashSet<>();
        rules.forEach(rule -> names.add(rule.name()));
        return names;
    }

    public boolean hasRules() {
        return !rules.isEmpty();
    }
}
