package org.pragmatica.widgets.lexer;

import org.pragmatica.widgets.tree.SourceSpan;

/**
 * Lexical tokens of widget source code. Tokens are immutable and carry their source span.
 */
public sealed interface Token {
    SourceSpan span();

    /**
     * The source text of this token.
     */
    String lexeme();

    default int line() {
        return span().start().line();
    }

    default int column() {
        return span().start().column();
    }

    // Identifiers and literals
    record Identifier(SourceSpan span, String lexeme) implements Token {}

    record Keyword(SourceSpan span, String lexeme) implements Token {}

    record StringLiteral(SourceSpan span, String lexeme, String value) implements Token {}

    record NumberLiteral(SourceSpan span, String lexeme, Number value) implements Token {}

    record BooleanLiteral(SourceSpan span, String lexeme, boolean value) implements Token {}

    // Punctuation
    record LParen(SourceSpan span) implements Token {
        @Override
        public String lexeme() {
            return "(";
        }
    }

    record RParen(SourceSpan span) implements Token {
        @Override
        public String lexeme() {
            return ")";
        }
    }

    record LBracket(SourceSpan span) implements Token {
        @Override
        public String lexeme() {
            return "[";
        }
    }

    record RBracket(SourceSpan span) implements Token {
        @Override
        public String lexeme() {
            return "]";
        }
    }

    record Comma(SourceSpan span) implements Token {
        @Override
        public String lexeme() {
            return ",";
        }
    }

    record Colon(SourceSpan span) implements Token {
        @Override
        public String lexeme() {
            return ":";
        }
    }

    record Dot(SourceSpan span) implements Token {
        @Override
        public String lexeme() {
            return ".";
        }
    }

    // Operators the grammar does not use (braces, '=>', ';', '...'); the parser reports or skips them
    record Operator(SourceSpan span, String lexeme) implements Token {}

    // Special
    record Eof(SourceSpan span) implements Token {
        @Override
        public String lexeme() {
            return "";
        }
    }

    record Error(SourceSpan span, String lexeme, String message) implements Token {}
}
