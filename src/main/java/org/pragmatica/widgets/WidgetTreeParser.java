package org.pragmatica.widgets;

import org.pragmatica.widgets.ast.AstNode.ConstructorCall;
import org.pragmatica.widgets.ast.AstNode.Program;
import org.pragmatica.widgets.extract.ExtractionResult;
import org.pragmatica.widgets.extract.ExtractorConfig;
import org.pragmatica.widgets.extract.WidgetCatalog;
import org.pragmatica.widgets.extract.WidgetExtractor;
import org.pragmatica.widgets.lexer.LexResult;
import org.pragmatica.widgets.lexer.Lexer;
import org.pragmatica.widgets.lexer.Token;
import org.pragmatica.widgets.parser.ParseResult;
import org.pragmatica.widgets.parser.Parser;
import org.pragmatica.widgets.parser.ParserConfig;
import org.pragmatica.widgets.parser.RecoveryStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Entry point for turning widget source code into widget trees.
 *
 * <p>Example usage:
 * <pre>{@code
 * var parser = WidgetTreeParser.create();
 * var result = parser.convert("""
 *     Container(
 *       color: Colors.blue,
 *       child: Text('hi'),
 *     )
 *     """);
 *
 * result.tree().ifPresent(root -> System.out.println(root.type()));
 * System.out.println(result.report().summary());
 * }</pre>
 *
 * <p>Instances are immutable. Every call allocates its own lexer, parser and extractor state, so
 * one instance may serve concurrent calls for independent sources.
 */
public final class WidgetTreeParser {

    private static final Logger log = LoggerFactory.getLogger(WidgetTreeParser.class);

    private final ParserConfig parserConfig;
    private final ExtractorConfig extractorConfig;

    private WidgetTreeParser(ParserConfig parserConfig, ExtractorConfig extractorConfig) {
        this.parserConfig = parserConfig;
        this.extractorConfig = extractorConfig;
    }

    public static WidgetTreeParser create() {
        return new WidgetTreeParser(ParserConfig.DEFAULT, ExtractorConfig.DEFAULT);
    }

    public static Builder builder() {
        return new Builder();
    }

    public ParserConfig parserConfig() {
        return parserConfig;
    }

    public ExtractorConfig extractorConfig() {
        return extractorConfig;
    }

    public LexResult tokenize(String source) {
        Objects.requireNonNull(source, "source");
        var result = Lexer.tokenize(source);
        log.debug("Tokenized {} characters into {} tokens", source.length(), result.size());
        return result;
    }

    /**
     * Parse a token stream. Lexical diagnostics are not repeated in the result.
     */
    public ParseResult parse(LexResult lexResult) {
        Objects.requireNonNull(lexResult, "lexResult");
        return parse(lexResult.tokens());
    }

    public ParseResult parse(List<Token> tokens) {
        return Parser.parse(tokens, parserConfig);
    }

    /**
     * Tokenize and parse. The result carries the lexical diagnostics followed by the syntax ones.
     */
    public ParseResult parseSource(String source) {
        var lexResult = tokenize(source);
        return parse(lexResult).withLeadingDiagnostics(lexResult.diagnostics());
    }

    /**
     * Check whether the source is well-formed without extracting widgets.
     */
    public ParseResult validateSyntax(String source) {
        return parseSource(source);
    }

    public ExtractionResult extractWidgets(Program program) {
        Objects.requireNonNull(program, "program");
        return WidgetExtractor.extract(program, extractorConfig);
    }

    public ExtractionResult extractWidgets(ConstructorCall call) {
        Objects.requireNonNull(call, "call");
        return WidgetExtractor.extract(call, extractorConfig);
    }

    /**
     * Run the whole pipeline. Never throws because of the content of {@code source}.
     */
    public ConversionResult convert(String source) {
        var lexResult = tokenize(source);
        var parseResult = parse(lexResult).withLeadingDiagnostics(lexResult.diagnostics());
        var extraction = extractWidgets(parseResult.program());
        var result = ConversionResult.of(lexResult, parseResult, extraction);

        log.debug("Converted source into {} widget(s) in {} tree(s): {}",
                  extraction.widgetCount(), extraction.roots().size(), result.report().summary());
        return result;
    }

    /**
     * Builder for parser instances with non-default limits, recovery or widget catalog.
     */
    public static final class Builder {
        private int maxDepth = ParserConfig.DEFAULT_MAX_NESTING_DEPTH;
        private RecoveryStrategy recovery = RecoveryStrategy.ADVANCED;
        private WidgetCatalog catalog = WidgetCatalog.builtIn();

        private Builder() {
        }

        /**
         * Nesting limit applied by both the parser and the extractor.
         */
        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder recovery(RecoveryStrategy recovery) {
            this.recovery = recovery;
            return this;
        }

        public Builder catalog(WidgetCatalog catalog) {
            this.catalog = Objects.requireNonNull(catalog, "catalog");
            return this;
        }

        public WidgetTreeParser build() {
            return new WidgetTreeParser(new ParserConfig(maxDepth, recovery),
                                        new ExtractorConfig(maxDepth, catalog));
        }
    }
}
