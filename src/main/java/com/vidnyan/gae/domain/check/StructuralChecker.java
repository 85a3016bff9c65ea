package com.vidnyan.gae.domain.check;

import com.vidnyan.gae.domain.model.GrammarModel;
import com.vidnyan.gae.domain.model.Rule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Duplicate definitions, undefined non-terminals and unused rules.
 */
@Slf4j
@Component
@Order(20)
public class StructuralChecker implements GrammarCheck {

    public static final String NO_RULES = "no valid rules found in grammar";

    @Override
    public CheckCategory category() {
        return CheckCategory.STRUCTURAL;
    }

    @Override
    public CheckResult check(CheckContext context) {
        GrammarModel model = context.model();
        CheckResult.Builder result = CheckResult.builder(category());

        if (!model.hasRules()) {
            return result.error(NO_RULES).build();
        }

        Set<String> duplicates = duplicateNames(model);
        if (!duplicates.isEmpty()) {
            result.error("duplicate rule definitions: " + duplicates);
        }

        Set<String> defined = model.ruleNames();

        SortedSet<String> undefined = new TreeSet<>(model.nonTerminals());
        undefined.removeAll(defined);
        if (!undefined.isEmpty()) {
            String message = "undefined non-terminals: " + undefined;
            switch (context.level()) {
                case STRICT -> result.error(message);
                case MODERATE -> result.warning(message);
                case LENIENT -> log.debug("Ignoring {} undefined non-terminals", undefined.size());
            }
        }

        SortedSet<String> unused = new TreeSet<>(defined);
        unused.removeAll(model.nonTerminals());
        if (!unused.isEmpty() && context.level() == ValidationLevel.STRICT) {
            result.warning("unused rules: " + unused);
        }

        return result.build();
    }

    private Set<String> duplicateNames(GrammarModel model) {
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (Rule rule : model.rules()) {
            if (!seen.add(rule.name())) {
                duplicates.add(rule.name());
            }
        }
        return duplicates;
    }
}
