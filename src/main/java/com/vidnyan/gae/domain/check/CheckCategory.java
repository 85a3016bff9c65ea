package com.vidnyan.gae.domain.check;

/**
 * Taxonomy of validation findings.
 */
public enum CheckCategory {
    SYNTAX,
    STRUCTURAL,
    SEMANTIC
}
