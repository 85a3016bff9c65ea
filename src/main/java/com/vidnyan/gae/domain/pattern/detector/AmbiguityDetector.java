package com.vidnyan.gae.domain.pattern.detector;

import com.vidnyan.gae.domain.model.GrammarModel;
import com.vidnyan.gae.domain.model.Rule;
import com.vidnyan.gae.domain.pattern.GrammarPattern;
import com.vidnyan.gae.domain.pattern.PatternDetector;
import com.vidnyan.gae.domain.pattern.PatternKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pairs of alternatives in one rule sharing a long word prefix.
 * Only whole matching words count towards the prefix length.
 *
 * Two alternatives share a prefix of at least {@value #MIN_PREFIX_LENGTH} characters exactly
 * when their shortest word prefix reaching that length is the same, so alternatives are
 * grouped by that key and pairs are counted per group instead of compared one by one.
 */
@Component
public class AmbiguityDetector implements PatternDetector {

    static final int MIN_PREFIX_LENGTH = 3;

    @Override
    public PatternKind kind() {
        return PatternKind.POTENTIAL_AMBIGUITY;
    }

    @Override
    public Optional<GrammarPattern> detect(GrammarModel model) {
        long pairs = 0;
        List<String> examples = new ArrayList<>();
        for (Rule rule : model.rules()) {
            pairs += scanRule(rule, examples);
        }
        if (pairs == 0) {
            return Optional.empty();
        }
        int occurrences = (int) Math.min(Integer.MAX_VALUE, pairs);
        return Optional.of(GrammarPattern.of(kind(),
                "Rules that may cause parsing ambiguities", occurrences, examples));
    }

    /**
     * Count the ambiguous pairs of one rule, adding examples in pair order until the cap is reached.
     */
    private long scanRule(Rule rule, List<String> examples) {
        List<String> alternatives = rule.alternatives();
        Map<String, List<Integer>> groups = new HashMap<>();
        String[] keys = new String[alternatives.size()];
        for (int i = 0; i < alternatives.size(); i++) {
            keys[i] = prefixKey(words(alternatives.get(i)));
            if (keys[i] != null) {
                groups.computeIfAbsent(keys[i], k -> new ArrayList<>()).add(i);
            }
        }

        long pairs = 0;
        for (List<Integer> group : groups.values()) {
            long size = group.size();
            pairs += size * (size - 1) / 2;
        }

        // First pairs in (i, j) order, same as a nested loop over the alternatives
        for (int i = 0; i < alternatives.size() && examples.size() < GrammarPattern.MAX_EXAMPLES; i++) {
            if (keys[i] == null) {
                continue;
            }
            for (int j : groups.get(keys[i])) {
                if (examples.size() >= GrammarPattern.MAX_EXAMPLES) {
                    break;
                }
                if (j > i) {
                    examples.add(String.format("%s: '%s' vs '%s'",
                            rule.name(), alternatives.get(i), alternatives.get(j)));
                }
            }
        }
        return pairs;
    }

    /**
     * Shortest run of leading words whose lengths add up to the minimum, or null when
     * the whole alternative is shorter than that.
     */
    static String prefixKey(String[] words) {
        int length = 0;
        for (int i = 0; i < words.length; i++) {
            length += words[i].length();
            if (length >= MIN_PREFIX_LENGTH) {
                return String.join(" ", List.of(words).subList(0, i + 1));
            }
        }
        return null;
    }

    private static String[] words(String text) {
        String stripped = text.strip();
        return stripped.isEmpty() ? new String[0] : stripped.split("\\s+");
    }
}
