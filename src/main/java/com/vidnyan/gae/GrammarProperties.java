package com.vidnyan.gae;

import com.vidnyan.gae.domain.check.ValidationLevel;
import com.vidnyan.gae.domain.pattern.AnalysisDepth;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the grammar engine.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "gae.grammar")
public class GrammarProperties {

    public static final int DEFAULT_MAX_GRAMMAR_LENGTH = 1_000_000;

    /**
     * Longest grammar text accepted, in characters. Longer input is rejected
     * with a diagnostic instead of being scanned.
     */
    private int maxGrammarLength = DEFAULT_MAX_GRAMMAR_LENGTH;

    /**
     * Level used by the CLI when none is given.
     */
    private ValidationLevel defaultValidationLevel = ValidationLevel.STRICT;

    /**
     * Depth used by the CLI when none is given.
     */
    private AnalysisDepth defaultAnalysisDepth = AnalysisDepth.COMPREHENSIVE;

    @PostConstruct
    public void init() {
        if (maxGrammarLength <= 0) {
            throw new IllegalStateException("gae.grammar.max-grammar-length must be positive, got " + maxGrammarLength);
        }
    }

    public boolean exceedsLimit(String grammarText) {
        return grammarText.length() > maxGrammarLength;
    }

    public String limitMessage() {
        return String.format("grammar text exceeds maximum length of %d characters", maxGrammarLength);
    }
}
