package com.vidnyan.gae.domain.pattern.detector;

import com.vidnyan.gae.domain.pattern.PatternKind;
import org.springframework.stereotype.Component;

/**
 * Optional elements {@code [ ... ]}.
 */
@Component
public class OptionalGroupDetector extends InnermostGroupDetector {

    public OptionalGroupDetector() {
        super('[', ']', "Optional elements");
    }

    @Override
    public PatternKind kind() {
        return PatternKind.OPTIONAL_GROUP;
    }
}
