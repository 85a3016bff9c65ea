package com.vidnyan.gae.domain.pattern;

import com.vidnyan.gae.domain.model.GrammarModel;

import java.util.Optional;

/**
 * Interface for pattern detectors. Each detector recognizes one {@link PatternKind}.
 */
public interface PatternDetector {

    PatternKind kind();

    /**
     * Scan the grammar; empty when the pattern does not occur.
     */
    Optional<GrammarPattern> detect(GrammarModel model);

    default String getName() {
        return getClass().getSimpleName();
    }
}
