package com.vidnyan.gae.domain.check;

import com.vidnyan.gae.domain.model.GrammarModel;

/**
 * Context provided to grammar checks.
 */
public record CheckContext(
    GrammarModel model,
    ValidationLevel level
) {

    public static CheckContext of(GrammarModel model, ValidationLevel level) {
        return new CheckContext(model, level);
    }
}
