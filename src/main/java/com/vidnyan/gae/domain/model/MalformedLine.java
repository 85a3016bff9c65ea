package com.vidnyan.gae.domain.model;

/**
 * A normalized line that contains a definition sign but is not shaped like a rule.
 */
public record MalformedLine(int line, String text) {
}
