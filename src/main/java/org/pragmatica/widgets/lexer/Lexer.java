package org.pragmatica.widgets.lexer;

import org.pragmatica.widgets.error.Diagnostic;
import org.pragmatica.widgets.error.DiagnosticCode;
import org.pragmatica.widgets.tree.SourceLocation;
import org.pragmatica.widgets.tree.SourceSpan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Lexer for widget source code.
 *
 * <p>Scanning is total: every character ends up in a token, in skipped whitespace or in a comment.
 * Characters that cannot start a token become {@link Token.Error} tokens with a diagnostic and
 * scanning resumes at the next character.
 */
public final class Lexer {
    private static final int MAX_INPUT_SIZE = 10_000_000;
    private static final int DEFAULT_TOKEN_CAPACITY = 32;

    private static final Set<String> KEYWORDS = Set.of(
        "class", "const", "final", "var", "new", "this", "super", "null",
        "if", "else", "for", "while", "do", "switch", "case", "default",
        "break", "continue", "return", "void", "in", "is", "as");

    // Longest first
    private static final List<String> MULTI_CHAR_OPERATORS = List.of(
        "...", "?.", "??", "=>", "==", "!=", "<=", ">=", "&&", "||", "++", "--");

    private static final String SINGLE_CHAR_OPERATORS = "{};=+-*/!<>&|%~^?";

    private final String input;
    private final List<Diagnostic> diagnostics;
    private int pos;
    private int line;
    private int column;

    private Lexer(String input) {
        this.input = input;
        this.diagnostics = new ArrayList<>();
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    public static LexResult tokenize(String input) {
        Objects.requireNonNull(input, "input");
        if (input.length() > MAX_INPUT_SIZE) {
            throw new IllegalArgumentException(
                "Source input exceeds maximum size of " + MAX_INPUT_SIZE + " characters");
        }
        return new Lexer(input).tokenizeAll();
    }

    private LexResult tokenizeAll() {
        var tokens = new ArrayList<Token>();
        while (true) {
            skipWhitespaceAndComments();
            if (isAtEnd()) {
                break;
            }
            tokens.add(nextToken());
        }
        tokens.add(new Token.Eof(SourceSpan.at(currentLocation())));
        return new LexResult(tokens, diagnostics, input);
    }

    private Token nextToken() {
        var start = currentLocation();
        char c = peek();

        // Raw strings r'...' / r"..."
        if (c == 'r' && isQuote(peekAt(1))) {
            advance();
            return scanString(start, true);
        }
        if (isIdentifierStart(c)) {
            return scanIdentifier(start);
        }
        if (isQuote(c)) {
            return scanString(start, false);
        }
        // A leading '-' is always an operator; the parser folds it into a following number
        if (isDigit(c)) {
            return scanNumber(start);
        }
        return scanPunctuation(start);
    }

    private Token scanIdentifier(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isIdentifierPart(peek())) {
            sb.append(advance());
        }
        var text = sb.toString();
        if (text.equals("true") || text.equals("false")) {
            return new Token.BooleanLiteral(span(start), text, Boolean.parseBoolean(text));
        }
        if (KEYWORDS.contains(text)) {
            return new Token.Keyword(span(start), text);
        }
        return new Token.Identifier(span(start), text);
    }

    private Token scanString(SourceLocation start, boolean raw) {
        char quote = advance();
        boolean triple = peekAt(0) == quote && peekAt(1) == quote;
        if (triple) {
            advance();
            advance();
        }
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (true) {
            if (isAtEnd() || (!triple && peek() == '\n')) {
                var tokenSpan = span(start);
                diagnostics.add(Diagnostic.of(DiagnosticCode.UNTERMINATED_STRING, tokenSpan)
                                          .withLabel("string starts here")
                                          .withHelp("close the string with " + quote));
                return new Token.StringLiteral(tokenSpan, tokenSpan.extract(input), sb.toString());
            }
            char c = peek();
            if (c == quote) {
                if (!triple) {
                    advance();
                    break;
                }
                if (peekAt(1) == quote && peekAt(2) == quote) {
                    advance();
                    advance();
                    advance();
                    break;
                }
                sb.append(advance());
            } else if (c == '\\' && !raw) {
                scanEscapeSequence(sb);
            } else if (c == '$' && peekAt(1) == '{' && !raw) {
                scanInterpolation(sb, triple);
            } else {
                sb.append(advance());
            }
        }
        var tokenSpan = span(start);
        return new Token.StringLiteral(tokenSpan, tokenSpan.extract(input), sb.toString());
    }

    /**
     * Copies a {@code ${...}} interpolation verbatim. Quotes inside it open nested strings, which may
     * interpolate again, so the enclosing string only ends at the brace that closes the interpolation.
     * Stops early at end of input, or at a line break in a single-line string.
     */
    private void scanInterpolation(StringBuilder sb, boolean triple) {
        sb.append(advance());
        sb.append(advance());
        // '{' for an open brace, a quote character for an open nested string
        Deque<Character> open = new ArrayDeque<>();
        open.push('{');

        while (!open.isEmpty()) {
            if (isAtEnd() || (!triple && peek() == '\n')) {
                return;
            }
            char c = peek();
            char innermost = open.peek();
            if (innermost == '{') {
                if (c == '{') {
                    open.push('{');
                } else if (c == '}') {
                    open.pop();
                } else if (isQuote(c)) {
                    open.push(c);
                }
                sb.append(advance());
            } else if (c == '\\') {
                sb.append(advance());
                if (!isAtEnd()) {
                    sb.append(advance());
                }
            } else if (c == '$' && peekAt(1) == '{') {
                sb.append(advance());
                sb.append(advance());
                open.push('{');
            } else {
                if (c == innermost) {
                    open.pop();
                }
                sb.append(advance());
            }
        }
    }

    private void scanEscapeSequence(StringBuilder sb) {
        var escapeStart = currentLocation();
        advance();
        // skip backslash
        if (isAtEnd()) {
            sb.append('\\');
            return;
        }
        char c = advance();
        switch (c) {
            case 'n' -> sb.append('\n');
            case 'r' -> sb.append('\r');
            case 't' -> sb.append('\t');
            case 'b' -> sb.append('\b');
            case 'f' -> sb.append('\f');
            case 'v' -> sb.append('\u000B');
            case '0' -> sb.append('\0');
            case '\\', '\'', '"', '$' -> sb.append(c);
            case 'x' -> scanHexEscape(sb, escapeStart, 2);
            case 'u' -> {
                if (!isAtEnd() && peek() == '{') {
                    scanBracedUnicodeEscape(sb, escapeStart);
                } else {
                    scanHexEscape(sb, escapeStart, 4);
                }
            }
            default -> {
                sb.append(c);
                invalidEscape(escapeStart, String.valueOf(c));
            }
        }
    }

    private void scanHexEscape(StringBuilder sb, SourceLocation escapeStart, int digits) {
        var hex = new StringBuilder(digits);
        while (hex.length() < digits && !isAtEnd() && isHexDigit(peek())) {
            hex.append(advance());
        }
        if (hex.length() < digits) {
            var prefix = digits == 2 ? "x" : "u";
            sb.append(prefix).append(hex);
            invalidEscape(escapeStart, prefix + hex);
            return;
        }
        sb.append((char) Integer.parseInt(hex.toString(), 16));
    }

    private void scanBracedUnicodeEscape(StringBuilder sb, SourceLocation escapeStart) {
        advance();
        // skip {
        var hex = new StringBuilder(6);
        while (!isAtEnd() && isHexDigit(peek()) && hex.length() < 6) {
            hex.append(advance());
        }
        if (hex.length() == 0 || isAtEnd() || peek() != '}') {
            sb.append("u{").append(hex);
            invalidEscape(escapeStart, "u{" + hex);
            return;
        }
        advance();
        // skip }
        int codePoint = Integer.parseInt(hex.toString(), 16);
        if (!Character.isValidCodePoint(codePoint)) {
            sb.append("u{").append(hex).append('}');
            invalidEscape(escapeStart, "u{" + hex + "}");
            return;
        }
        sb.appendCodePoint(codePoint);
    }

    private void invalidEscape(SourceLocation escapeStart, String text) {
        diagnostics.add(Diagnostic.of(DiagnosticCode.INVALID_ESCAPE, span(escapeStart), text)
                                  .withContext(Diagnostic.LEXEME, "\\" + text));
    }

    private Token scanNumber(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        if (peek() == '0' && (peekAt(1) == 'x' || peekAt(1) == 'X')) {
            return scanHexNumber(start, sb);
        }
        boolean decimal = false;
        while (!isAtEnd() && isDigit(peek())) {
            sb.append(advance());
        }
        if (peekAt(0) == '.' && isDigit(peekAt(1))) {
            decimal = true;
            sb.append(advance());
            while (!isAtEnd() && isDigit(peek())) {
                sb.append(advance());
            }
        }
        if ((peekAt(0) == 'e' || peekAt(0) == 'E')
            && (isDigit(peekAt(1)) || ((peekAt(1) == '+' || peekAt(1) == '-') && isDigit(peekAt(2))))) {
            decimal = true;
            sb.append(advance());
            if (peek() == '+' || peek() == '-') {
                sb.append(advance());
            }
            while (!isAtEnd() && isDigit(peek())) {
                sb.append(advance());
            }
        }
        if (continuesNumber()) {
            return malformedNumber(start);
        }
        var text = sb.toString();
        return new Token.NumberLiteral(span(start), text, decimal ? Double.valueOf(text) : integerValue(text));
    }

    private Token scanHexNumber(SourceLocation start, StringBuilder sb) {
        sb.append(advance()).append(advance());
        // 0x
        var digits = new StringBuilder(16);
        while (!isAtEnd() && isHexDigit(peek())) {
            digits.append(advance());
        }
        if (digits.length() == 0 || digits.length() > 16 || continuesNumber()) {
            return malformedNumber(start);
        }
        long value = Long.parseUnsignedLong(digits.toString(), 16);
        return new Token.NumberLiteral(span(start), sb.append(digits).toString(), value);
    }

    private static Number integerValue(String text) {
        try {
            return Long.valueOf(text);
        } catch (NumberFormatException e) {
            // Too large for a long, keep magnitude as a double
            return Double.valueOf(text);
        }
    }

    private boolean continuesNumber() {
        if (isAtEnd()) {
            return false;
        }
        return isIdentifierPart(peek()) || (peek() == '.' && isDigit(peekAt(1)));
    }

    private Token malformedNumber(SourceLocation start) {
        while (!isAtEnd() && (isIdentifierPart(peek()) || (peek() == '.' && isIdentifierPart(peekAt(1))))) {
            advance();
        }
        var tokenSpan = span(start);
        var text = tokenSpan.extract(input);
        diagnostics.add(Diagnostic.of(DiagnosticCode.MALFORMED_NUMBER, tokenSpan, text)
                                  .withContext(Diagnostic.LEXEME, text)
                                  .withLabel("not a valid number"));
        return new Token.Error(tokenSpan, text, "Malformed number literal");
    }

    private Token scanPunctuation(SourceLocation start) {
        for (var operator : MULTI_CHAR_OPERATORS) {
            if (input.startsWith(operator, pos)) {
                for (int i = 0; i < operator.length(); i++) {
                    advance();
                }
                return new Token.Operator(span(start), operator);
            }
        }
        char c = peek();
        switch (c) {
            case '(' -> {
                advance();
                return new Token.LParen(span(start));
            }
            case ')' -> {
                advance();
                return new Token.RParen(span(start));
            }
            case '[' -> {
                advance();
                return new Token.LBracket(span(start));
            }
            case ']' -> {
                advance();
                return new Token.RBracket(span(start));
            }
            case ',' -> {
                advance();
                return new Token.Comma(span(start));
            }
            case ':' -> {
                advance();
                return new Token.Colon(span(start));
            }
            case '.' -> {
                advance();
                return new Token.Dot(span(start));
            }
            default -> {
                if (SINGLE_CHAR_OPERATORS.indexOf(c) >= 0) {
                    advance();
                    return new Token.Operator(span(start), String.valueOf(c));
                }
                return unexpectedCharacter(start);
            }
        }
    }

    private Token unexpectedCharacter(SourceLocation start) {
        int width = Character.charCount(input.codePointAt(pos));
        for (int i = 0; i < width; i++) {
            advance();
        }
        var tokenSpan = span(start);
        var text = tokenSpan.extract(input);
        diagnostics.add(Diagnostic.of(DiagnosticCode.UNEXPECTED_CHARACTER, tokenSpan, text)
                                  .withContext(Diagnostic.LEXEME, text)
                                  .withLabel("not valid here"));
        return new Token.Error(tokenSpan, text, "Unexpected character: " + text);
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (Character.isWhitespace(c) || c == '\uFEFF') {
                advance();
            } else if (c == '/' && peekAt(1) == '/') {
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
            } else if (c == '/' && peekAt(1) == '*') {
                skipBlockComment();
            } else {
                break;
            }
        }
    }

    private void skipBlockComment() {
        var start = currentLocation();
        advance();
        advance();
        // Block comments nest
        int depth = 1;
        while (!isAtEnd() && depth > 0) {
            if (peek() == '/' && peekAt(1) == '*') {
                advance();
                advance();
                depth++;
            } else if (peek() == '*' && peekAt(1) == '/') {
                advance();
                advance();
                depth--;
            } else {
                advance();
            }
        }
        if (depth > 0) {
            diagnostics.add(Diagnostic.of(DiagnosticCode.UNTERMINATED_COMMENT, span(start))
                                      .withHelp("close the comment with */"));
        }
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char peekAt(int offset) {
        int index = pos + offset;
        return index < input.length() ? input.charAt(index) : '\0';
    }

    private char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos);
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, currentLocation());
    }

    private static boolean isQuote(char c) {
        return c == '\'' || c == '"';
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
}
