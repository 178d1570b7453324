package org.pragmatica.widgets.parser;

import org.pragmatica.widgets.ast.AstNode;
import org.pragmatica.widgets.ast.AstNode.Argument;
import org.pragmatica.widgets.ast.AstNode.ArgumentList;
import org.pragmatica.widgets.ast.AstNode.ArrayLiteral;
import org.pragmatica.widgets.ast.AstNode.ConstructorCall;
import org.pragmatica.widgets.ast.AstNode.Identifier;
import org.pragmatica.widgets.ast.AstNode.Literal;
import org.pragmatica.widgets.ast.AstNode.MethodCall;
import org.pragmatica.widgets.ast.AstNode.NamedArgument;
import org.pragmatica.widgets.ast.AstNode.PositionalArgument;
import org.pragmatica.widgets.ast.AstNode.Program;
import org.pragmatica.widgets.ast.AstNode.PropertyAccess;
import org.pragmatica.widgets.error.Diagnostic;
import org.pragmatica.widgets.error.DiagnosticCode;
import org.pragmatica.widgets.lexer.LexResult;
import org.pragmatica.widgets.lexer.Token;
import org.pragmatica.widgets.tree.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Recursive-descent parser for widget constructor expressions.
 *
 * <p>Grammar, highest binding first:
 * <pre>
 * program    := (expression (';' | ',')?)* EOF
 * expression := ('const' | 'new')? primary postfix*
 * primary    := IDENT arguments?            -- constructor call when followed by '('
 *             | '-'? NUMBER | literal | array | '(' expression ')'
 * postfix    := ('.' | '?.') IDENT arguments? | '!'
 * arguments  := '(' (argument (',' argument)* ','?)? ')'
 * argument   := IDENT ':' expression | expression
 * array      := '[' ('...'? expression (',' '...'? expression)* ','?)? ']'
 * </pre>
 *
 * <p>A modifier is recorded on a constructor call and on a named constructor
 * ({@code const EdgeInsets.all(8)}); before a list literal it is accepted and dropped.
 *
 * <p>A syntax error is reported once, then the parser skips to the next comma at the current
 * nesting depth or to the closing delimiter and continues, so one bad argument costs only that
 * argument. A closing delimiter that does not match the innermost open one cannot be
 * resynchronized: the whole parse then yields an empty program with the collected diagnostics.
 */
public final class Parser {
    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    private static final Set<String> MODIFIERS = Set.of("const", "new");
    private static final Set<String> NON_BINARY_OPERATORS = Set.of("{", "}", ";", "=>", "...", "!");

    private final List<Token> tokens;
    private final ParserConfig config;
    private final List<Diagnostic> diagnostics;
    private final Deque<Token> openDelimiters;
    private int pos;
    private int depth;
    private Token lastConsumed;
    private boolean halted;
    private boolean structuralBreak;

    private Parser(List<Token> tokens, ParserConfig config) {
        this.tokens = tokens;
        this.config = config;
        this.diagnostics = new ArrayList<>();
        this.openDelimiters = new ArrayDeque<>();
        this.pos = 0;
        this.depth = 0;
        this.lastConsumed = tokens.get(0);
    }

    /**
     * Parse a token stream with the default configuration.
     * Lexical diagnostics are not repeated in the result.
     */
    public static ParseResult parse(LexResult lexResult) {
        return parse(lexResult.tokens(), ParserConfig.DEFAULT);
    }

    public static ParseResult parse(List<Token> tokens, ParserConfig config) {
        Objects.requireNonNull(tokens, "tokens");
        Objects.requireNonNull(config, "config");
        return new Parser(significant(tokens), config).parseProgram();
    }

    // Error tokens were already reported by the lexer
    private static List<Token> significant(List<Token> tokens) {
        var result = new ArrayList<Token>(tokens.size() + 1);
        for (var token : tokens) {
            if (token instanceof Token.Error) {
                continue;
            }
            if (token instanceof Token.Eof) {
                break;
            }
            result.add(token);
        }
        var end = result.isEmpty()
                  ? SourceSpan.EMPTY
                  : SourceSpan.at(result.get(result.size() - 1).span().end());
        var eof = tokens.isEmpty() || !(tokens.get(tokens.size() - 1) instanceof Token.Eof last)
                  ? new Token.Eof(end)
                  : last;
        result.add(eof);
        return result;
    }

    private ParseResult parseProgram() {
        var first = peek();
        var body = new ArrayList<AstNode>();

        while (!isAtEnd() && !halted) {
            var token = peek();
            if (isSeparator(token)) {
                advance();
                continue;
            }
            if (isCloser(token)) {
                strayCloser(token);
                break;
            }
            if (!canStartExpression(token)) {
                skipUnexpected(token);
                continue;
            }
            var expression = parseExpression();
            if (halted) {
                break;
            }
            expression.ifPresent(body::add);
        }

        var span = SourceSpan.of(first.span().start(), tokens.get(tokens.size() - 1).span().end());
        if (structuralBreak) {
            log.warn("Unbalanced delimiters, discarding {} parsed expressions ({} diagnostics)",
                     body.size(), diagnostics.size());
            return new ParseResult(Program.empty(span), diagnostics, true);
        }
        log.debug("Parsed {} top-level expressions from {} tokens, {} diagnostics",
                  body.size(), tokens.size(), diagnostics.size());
        return new ParseResult(new Program(span, body), diagnostics, false);
    }

    private Optional<AstNode> parseExpression() {
        if (depth >= config.maxNestingDepth()) {
            return tooDeep();
        }
        depth++;
        try {
            var start = peek();
            Optional<String> modifier = Optional.empty();
            if (start instanceof Token.Keyword keyword && MODIFIERS.contains(keyword.lexeme())) {
                advance();
                modifier = Optional.of(keyword.lexeme());
            }
            var primary = parsePrimary(start, modifier);
            if (primary.isEmpty() || halted) {
                return primary;
            }
            var expression = parsePostfix(start, primary.get(), modifier);
            if (expression.isEmpty() || halted) {
                return expression;
            }
            if (isBinaryOperator(peek())) {
                return skipOperatorExpression(start);
            }
            return expression;
        } finally {
            depth--;
        }
    }

    private Optional<AstNode> parsePrimary(Token start, Optional<String> modifier) {
        var token = peek();

        if (token instanceof Token.Identifier identifier) {
            advance();
            skipTypeArguments(Token.LParen.class);
            if (peek() instanceof Token.LParen) {
                var arguments = parseArguments();
                return Optional.of(new ConstructorCall(spanFrom(start), identifier.lexeme(), arguments, modifier));
            }
            return Optional.of(new Identifier(identifier.span(), identifier.lexeme()));
        }
        if (skipTypeArguments(Token.LBracket.class)) {
            return Optional.of(parseArray());
        }
        if (token instanceof Token.Keyword keyword) {
            if ("null".equals(keyword.lexeme())) {
                advance();
                return Optional.of(new Literal(keyword.span(), null, keyword.lexeme()));
            }
            if ("this".equals(keyword.lexeme())) {
                advance();
                return Optional.of(new Identifier(keyword.span(), keyword.lexeme()));
            }
        }
        if (token instanceof Token.StringLiteral) {
            return Optional.of(parseStrings());
        }
        if (token instanceof Token.NumberLiteral number) {
            advance();
            return Optional.of(new Literal(number.span(), number.value(), number.lexeme()));
        }
        if (token instanceof Token.BooleanLiteral bool) {
            advance();
            return Optional.of(new Literal(bool.span(), bool.value(), bool.lexeme()));
        }
        if (token instanceof Token.LBracket) {
            return Optional.of(parseArray());
        }
        if (token instanceof Token.LParen) {
            return isFunctionLiteral() ? skipFunctionLiteral() : parseParenthesized();
        }
        if (isOperator(token, "-") && peekAt(1) instanceof Token.NumberLiteral number) {
            advance();
            advance();
            return Optional.of(new Literal(spanFrom(token), negate(number.value()), "-" + number.lexeme()));
        }
        error(unexpected(token, "expression"));
        return Optional.empty();
    }

    /**
     * Every {@code .name} step counts as one nesting level, so chains are bounded like calls are.
     * A modifier is kept on a named constructor call ({@code const EdgeInsets.all(8)}).
     */
    private Optional<AstNode> parsePostfix(Token start, AstNode primary, Optional<String> modifier) {
        var current = primary;
        int steps = 0;

        try {
            while (!halted) {
                var token = peek();
                if (isOperator(token, "!")) {
                    // Null assertion does not change the shape of the tree
                    advance();
                    continue;
                }
                boolean nullAware = isOperator(token, "?.");
                if (!(token instanceof Token.Dot) && !nullAware) {
                    break;
                }
                if (depth >= config.maxNestingDepth()) {
                    return tooDeep();
                }
                depth++;
                steps++;
                advance();
                if (!(peek() instanceof Token.Identifier name)) {
                    error(Diagnostic.of(DiagnosticCode.EXPECTED_TOKEN, peek().span(), "property name", describe(peek()))
                                    .withContext(Diagnostic.LEXEME, peek().lexeme())
                                    .withLabel("expected a name after '" + token.lexeme() + "'"));
                    break;
                }
                advance();
                if (peek() instanceof Token.LParen) {
                    var namedConstructor = current == primary && primary instanceof Identifier && !nullAware;
                    var arguments = parseArguments();
                    current = new MethodCall(spanFrom(start), current, name.lexeme(), arguments,
                                             namedConstructor ? modifier : Optional.empty());
                } else {
                    current = new PropertyAccess(spanFrom(start), current, name.lexeme(), nullAware);
                }
            }
            return Optional.of(current);
        } finally {
            depth -= steps;
        }
    }

    private ArgumentList parseArguments() {
        var open = peek();
        advance();
        openDelimiters.push(open);
        var arguments = new ArrayList<Argument>();

        while (!halted) {
            var token = peek();
            if (isCloser(token) || isAtEnd()) {
                break;
            }
            var argument = parseArgument();
            if (halted) {
                break;
            }
            if (argument.isPresent()) {
                arguments.add(argument.get());
            } else {
                synchronize();
            }
            if (!continueList("',' or ')'")) {
                break;
            }
        }

        closeDelimiter();
        return new ArgumentList(spanFrom(open), arguments);
    }

    private Optional<Argument> parseArgument() {
        var start = peek();

        if (start instanceof Token.Identifier name && peekAt(1) instanceof Token.Colon) {
            advance();
            advance();
            int reported = diagnostics.size();
            var value = parseExpression();
            if (value.isEmpty()) {
                helpOnMissingValue(reported, name);
            }
            return value.<Argument>map(node -> new NamedArgument(spanFrom(start), name.lexeme(), node));
        }
        return parseExpression().<Argument>map(node -> new PositionalArgument(spanFrom(start), node));
    }

    private void helpOnMissingValue(int reported, Token.Identifier name) {
        if (diagnostics.size() != reported + 1) {
            return;
        }
        var last = diagnostics.get(reported);
        if (last.code() == DiagnosticCode.UNEXPECTED_TOKEN) {
            diagnostics.set(reported, last.withContext(Diagnostic.FIELD, name.lexeme())
                                          .withHelp("a named argument needs a value after ':'"));
        }
    }

    private ArrayLiteral parseArray() {
        var open = peek();
        advance();
        openDelimiters.push(open);
        var elements = new ArrayList<AstNode>();

        while (!halted) {
            var token = peek();
            if (isCloser(token) || isAtEnd()) {
                break;
            }
            if (isOperator(token, "...")) {
                advance();
            }
            if (isCollectionControl(peek())) {
                skipCollectionControl();
            } else {
                var element = parseExpression();
                if (halted) {
                    break;
                }
                if (element.isPresent()) {
                    elements.add(element.get());
                } else {
                    synchronize();
                }
            }
            if (!continueList("',' or ']'")) {
                break;
            }
        }

        closeDelimiter();
        return new ArrayLiteral(spanFrom(open), elements);
    }

    /**
     * Skips {@code <Widget>} or {@code <String, List<int>>} when it is directly followed by a token
     * of the given type. Type arguments do not appear in the tree.
     */
    private boolean skipTypeArguments(Class<? extends Token> followedBy) {
        if (!isOperator(peek(), "<")) {
            return false;
        }
        int offset = 1;
        int nesting = 1;
        while (nesting > 0) {
            var token = peekAt(offset);
            if (isOperator(token, "<")) {
                nesting++;
            } else if (isOperator(token, ">")) {
                nesting--;
            } else if (!(token instanceof Token.Identifier || token instanceof Token.Comma
                         || token instanceof Token.Dot || isOperator(token, "?"))) {
                return false;
            }
            offset++;
        }
        if (!followedBy.isInstance(peekAt(offset))) {
            return false;
        }
        for (int i = 0; i < offset; i++) {
            advance();
        }
        return true;
    }

    private AstNode parseStrings() {
        var first = (Token.StringLiteral) peek();
        advance();
        if (!(peek() instanceof Token.StringLiteral)) {
            return new Literal(first.span(), first.value(), first.lexeme());
        }
        // Adjacent string literals concatenate
        var value = new StringBuilder(first.value());
        var raw = new StringBuilder(first.lexeme());
        while (peek() instanceof Token.StringLiteral next) {
            advance();
            value.append(next.value());
            raw.append(' ').append(next.lexeme());
        }
        return new Literal(spanFrom(first), value.toString(), raw.toString());
    }

    private Optional<AstNode> parseParenthesized() {
        var open = peek();
        advance();
        openDelimiters.push(open);

        var inner = parseExpression();
        if (!halted) {
            if (inner.isEmpty()) {
                synchronize();
            } else if (!isCloser(peek()) && !isAtEnd()) {
                error(unexpected(peek(), "')'"));
                if (!halted) {
                    synchronize();
                }
            }
        }

        closeDelimiter();
        return inner;
    }

    /**
     * After a list element: {@code ','} continues the list, a closing delimiter or end of input ends
     * it, anything else is reported and skipped.
     */
    private boolean continueList(String expected) {
        var token = peek();
        if (token instanceof Token.Comma) {
            advance();
            return true;
        }
        if (isCloser(token) || isAtEnd() || halted) {
            return false;
        }
        error(unexpected(token, expected));
        if (halted) {
            return false;
        }
        synchronize();
        if (peek() instanceof Token.Comma) {
            advance();
            return true;
        }
        return false;
    }

    private void closeDelimiter() {
        var open = openDelimiters.pop();
        var token = peek();
        if (open instanceof Token.LParen && token instanceof Token.RParen
            || open instanceof Token.LBracket && token instanceof Token.RBracket) {
            advance();
            return;
        }
        if (halted) {
            return;
        }
        if (isAtEnd()) {
            error(Diagnostic.of(DiagnosticCode.UNCLOSED_DELIMITER, open.span(), open.lexeme())
                            .withContext(Diagnostic.LEXEME, open.lexeme())
                            .withLabel("opened here")
                            .withSecondaryLabel(token.span(), "input ends here")
                            .withHelp("add '" + closerFor(open) + "'"));
            return;
        }
        error(Diagnostic.of(DiagnosticCode.MISMATCHED_DELIMITER, token.span(), token.lexeme(), closerFor(open))
                        .withContext(Diagnostic.LEXEME, token.lexeme())
                        .withLabel("does not close '" + open.lexeme() + "'")
                        .withSecondaryLabel(open.span(), "opened here"));
        breakStructure();
    }

    private void strayCloser(Token token) {
        error(unexpected(token, "widget expression")
                  .withNote("no delimiter is open at this point"));
        breakStructure();
    }

    private void breakStructure() {
        structuralBreak = true;
        halted = true;
    }

    private Optional<AstNode> tooDeep() {
        var start = peek();
        error(Diagnostic.of(DiagnosticCode.NESTING_TOO_DEEP, start.span(), config.maxNestingDepth())
                        .withContext(Diagnostic.LEXEME, start.lexeme())
                        .withLabel("nested expression skipped"));
        if (!halted) {
            synchronize();
        }
        return Optional.empty();
    }

    private Optional<AstNode> skipOperatorExpression(Token start) {
        var operator = peek();
        skipExpressionRest();
        warn(Diagnostic.of(DiagnosticCode.UNSUPPORTED_SYNTAX, spanFrom(start), "operator expression")
                       .withContext(Diagnostic.LEXEME, operator.lexeme())
                       .withNote("only constructor calls, literals, lists and property chains are understood"));
        return Optional.empty();
    }

    private void skipCollectionControl() {
        var start = peek();
        synchronize();
        warn(Diagnostic.of(DiagnosticCode.UNSUPPORTED_SYNTAX, spanFrom(start), "collection '" + start.lexeme() + "' element")
                       .withContext(Diagnostic.LEXEME, start.lexeme()));
    }

    /**
     * {@code (params) => body}, {@code (params) { body }} and their {@code async} forms.
     */
    private boolean isFunctionLiteral() {
        int index = pos;
        int nesting = 0;
        do {
            var token = tokens.get(index);
            if (token instanceof Token.LParen) {
                nesting++;
            } else if (token instanceof Token.RParen) {
                nesting--;
            } else if (token instanceof Token.Eof) {
                return false;
            }
            index++;
        } while (nesting > 0);

        var next = tokens.get(index);
        if (next instanceof Token.Identifier marker && isAsyncMarker(marker)) {
            next = tokens.get(Math.min(index + 1, tokens.size() - 1));
        }
        return isOperator(next, "=>") || isOperator(next, "{");
    }

    private Optional<AstNode> skipFunctionLiteral() {
        var start = peek();
        skipBalanced();
        if (peek() instanceof Token.Identifier marker && isAsyncMarker(marker)) {
            advance();
        }
        if (isOperator(peek(), "=>")) {
            advance();
            skipExpressionRest();
        } else {
            skipBalanced();
        }
        warn(Diagnostic.of(DiagnosticCode.UNSUPPORTED_SYNTAX, spanFrom(start), "function literal")
                       .withLabel("callback ignored"));
        return Optional.empty();
    }

    private static boolean isAsyncMarker(Token.Identifier identifier) {
        return "async".equals(identifier.lexeme()) || "sync".equals(identifier.lexeme());
    }

    // Skips one delimited group starting at the current opener
    private void skipBalanced() {
        int nesting = 0;
        do {
            var token = peek();
            if (isOpener(token)) {
                nesting++;
            } else if (isCloser(token)) {
                nesting--;
            }
            advance();
        } while (nesting > 0 && !isAtEnd());
    }

    /**
     * Skips to the next {@code ','} at the current nesting depth, to any closing delimiter, or to end of input.
     */
    private void synchronize() {
        skipUntil(false);
    }

    // Like synchronize, also stopping at ';'
    private void skipExpressionRest() {
        skipUntil(true);
    }

    private void skipUntil(boolean atSemicolon) {
        int nesting = 0;
        while (!isAtEnd()) {
            var token = peek();
            if (nesting == 0 && (token instanceof Token.Comma || isCloser(token)
                                 || atSemicolon && isOperator(token, ";"))) {
                return;
            }
            if (isOpener(token)) {
                nesting++;
            } else if (isCloser(token)) {
                nesting--;
            }
            advance();
        }
    }

    // Top level: report once, then skip the run of tokens that cannot start an expression
    private void skipUnexpected(Token token) {
        error(unexpected(token, "widget expression"));
        int nesting = 0;
        do {
            var current = peek();
            if (isOpener(current)) {
                nesting++;
            } else if (isCloser(current)) {
                nesting--;
            }
            advance();
        } while (!isAtEnd() && (nesting > 0 || !(canStartExpression(peek()) || isSeparator(peek()) || isCloser(peek()))));
    }

    private Diagnostic unexpected(Token token, String expected) {
        return Diagnostic.of(DiagnosticCode.UNEXPECTED_TOKEN, token.span(), describe(token), expected)
                         .withContext(Diagnostic.LEXEME, token.lexeme())
                         .withLabel("found " + describe(token));
    }

    private void error(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
        if (diagnostic.isError() && config.recovery() == RecoveryStrategy.NONE) {
            halted = true;
        }
    }

    private void warn(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    private static boolean canStartExpression(Token token) {
        if (token instanceof Token.Keyword keyword) {
            return MODIFIERS.contains(keyword.lexeme()) || "null".equals(keyword.lexeme()) || "this".equals(keyword.lexeme());
        }
        return token instanceof Token.Identifier
               || token instanceof Token.StringLiteral
               || token instanceof Token.NumberLiteral
               || token instanceof Token.BooleanLiteral
               || token instanceof Token.LBracket
               || token instanceof Token.LParen;
    }

    private static Number negate(Number value) {
        if (value instanceof Long integer) {
            return -integer;
        }
        return -value.doubleValue();
    }

    private static boolean isCollectionControl(Token token) {
        return token instanceof Token.Keyword keyword
               && ("if".equals(keyword.lexeme()) || "for".equals(keyword.lexeme()));
    }

    private static boolean isSeparator(Token token) {
        return token instanceof Token.Comma || isOperator(token, ";");
    }

    private static boolean isOpener(Token token) {
        return token instanceof Token.LParen || token instanceof Token.LBracket || isOperator(token, "{");
    }

    private static boolean isCloser(Token token) {
        return token instanceof Token.RParen || token instanceof Token.RBracket || isOperator(token, "}");
    }

    private static boolean isBinaryOperator(Token token) {
        return token instanceof Token.Operator operator && !NON_BINARY_OPERATORS.contains(operator.lexeme());
    }

    private static boolean isOperator(Token token, String lexeme) {
        return token instanceof Token.Operator operator && operator.lexeme().equals(lexeme);
    }

    private static String closerFor(Token open) {
        return open instanceof Token.LBracket ? "]" : ")";
    }

    private boolean isAtEnd() {
        return peek() instanceof Token.Eof;
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peekAt(int offset) {
        return tokens.get(Math.min(pos + offset, tokens.size() - 1));
    }

    private void advance() {
        if (!isAtEnd()) {
            lastConsumed = tokens.get(pos);
            pos++;
        }
    }

    private SourceSpan spanFrom(Token start) {
        return SourceSpan.of(start.span().start(), lastConsumed.span().end());
    }

    private static String describe(Token token) {
        if (token instanceof Token.Identifier) {
            return "identifier '" + token.lexeme() + "'";
        }
        if (token instanceof Token.Keyword) {
            return "keyword '" + token.lexeme() + "'";
        }
        if (token instanceof Token.StringLiteral) {
            return "string literal";
        }
        if (token instanceof Token.NumberLiteral) {
            return "number " + token.lexeme();
        }
        if (token instanceof Token.Eof) {
            return "end of input";
        }
        return "'" + token.lexeme() + "'";
    }
}
