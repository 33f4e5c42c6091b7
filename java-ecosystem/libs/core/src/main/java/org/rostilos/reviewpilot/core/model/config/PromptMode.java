package org.rostilos.reviewpilot.core.model.config;

/**
 * How a repository's custom prompt combines with the base review prompt.
 */
public enum PromptMode {
    /** Custom text is appended to the base prompt. */
    EXTEND,
    /** Custom text replaces the base prompt; the output format block is still appended. */
    REPLACE
}
