package org.pragmatica.widgets.parser;

/**
 * Syntax error recovery strategy.
 */
public enum RecoveryStrategy {
    /**
     * Stop at the first syntax error; keep only the top-level expressions completed before it.
     */
    NONE,

    /**
     * Report the error, skip to the next separator at the current nesting depth and keep parsing.
     */
    ADVANCED
}
