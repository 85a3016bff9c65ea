package com.vidnyan.gae.domain.check;

/**
 * A validation stage run against an extracted grammar.
 * Implementations are stateless and must not throw for any grammar.
 */
public interface GrammarCheck {

    CheckCategory category();

    CheckResult check(CheckContext context);

    /**
     * Get the check name for logging.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
