package com.vidnyan.gae.domain.check;

import java.util.ArrayList;
import java.util.List;

/**
 * Errors and warnings produced by one check.
 */
public record CheckResult(
    CheckCategory category,
    List<String> errors,
    List<String> warnings
) {

    public CheckResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public boolean isClean() {
        return errors.isEmpty() && warnings.isEmpty();
    }

    public static Builder builder(CheckCategory category) {
        return new Builder(category);
    }

    public static class Builder {
        private final CheckCategory category;
        private final List<String> errors = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();

        private Builder(CheckCategory category) {
            this.category = category;
        }

        public Builder error(String message) { errors.add(message); return this; }
        public Builder warning(String message) { warnings.add(message); return this; }

        public CheckResult build() {
            return new CheckResult(category, errors, warnings);
        }
    }
}
