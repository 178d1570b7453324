package org.pragmatica.widgets.parser;

import java.util.Objects;

/**
 * Parser configuration options.
 *
 * @param maxNestingDepth deepest expression nesting accepted before the subtree is skipped
 * @param recovery        what to do after a syntax error
 */
public record ParserConfig(int maxNestingDepth, RecoveryStrategy recovery) {

    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

    public static final ParserConfig DEFAULT = new ParserConfig(DEFAULT_MAX_NESTING_DEPTH, RecoveryStrategy.ADVANCED);

    public ParserConfig {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got " + maxNestingDepth);
        }
        Objects.requireNonNull(recovery, "recovery");
    }

    public ParserConfig withMaxNestingDepth(int depth) {
        return new ParserConfig(depth, recovery);
    }

    public ParserConfig withRecovery(RecoveryStrategy strategy) {
        return new ParserConfig(maxNestingDepth, strategy);
    }
}
