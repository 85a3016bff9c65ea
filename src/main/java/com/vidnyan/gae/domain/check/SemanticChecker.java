package com.vidnyan.gae.domain.check;

import com.vidnyan.gae.domain.model.GrammarModel;
import com.vidnyan.gae.domain.model.Rule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Left recursion and empty productions.
 */
@Slf4j
@Component
@Order(30)
public class SemanticChecker implements GrammarCheck {

    @Override
    public CheckCategory category() {
        return CheckCategory.SEMANTIC;
    }

    @Override
    public CheckResult check(CheckContext context) {
        GrammarModel model = context.model();
        CheckResult.Builder result = CheckResult.builder(category());

        Set<String> leftRecursive = new LinkedHashSet<>();
        Set<String> emptyProductions = new LinkedHashSet<>();
        for (Rule rule : model.rules()) {
            if (rule.isLeftRecursive()) {
                leftRecursive.add(rule.name());
            }
            if (rule.hasEmptyAlternative()) {
                emptyProductions.add(rule.name());
            }
        }

        if (!leftRecursive.isEmpty()) {
            String message = "left recursive rules detected: " + leftRecursive;
            switch (context.level()) {
                case STRICT -> result.error(message);
                case MODERATE, LENIENT -> result.warning(message);
            }
        }

        if (!emptyProductions.isEmpty() && context.level() == ValidationLevel.STRICT) {
            result.warning("empty productions found: " + emptyProductions);
        }

        log.debug("Semantic check: {} left recursive, {} empty", leftRecursive.size(), emptyProductions.size());
        return result.build();
    }
}
