package com.vidnyan.gae.domain.pattern.detector;

import com.vidnyan.gae.domain.pattern.PatternKind;
import org.springframework.stereotype.Component;

/**
 * Repetition elements {@code { ... }}.
 */
@Component
public class RepetitionGroupDetector extends InnermostGroupDetector {

    public RepetitionGroupDetector() {
        super('{', '}', "Repetition elements");
    }

    @Override
    public PatternKind kind() {
        return PatternKind.REPETITION_GROUP;
    }
}
