package org.pragmatica.widgets;

import org.pragmatica.widgets.error.DiagnosticReport;
import org.pragmatica.widgets.extract.ExtractionResult;
import org.pragmatica.widgets.extract.Widget;
import org.pragmatica.widgets.lexer.LexResult;
import org.pragmatica.widgets.parser.ParseResult;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of running the whole pipeline over one source text.
 *
 * <p>A conversion is usable whenever it produced at least one widget tree, even one made of
 * placeholders only. The report folds the diagnostics of all stages in pipeline order.
 */
public record ConversionResult(LexResult lexing, ParseResult parsing, ExtractionResult extraction,
                               DiagnosticReport report) {

    static ConversionResult of(LexResult lexing, ParseResult parsing, ExtractionResult extraction) {
        return new ConversionResult(lexing, parsing, extraction, DiagnosticReport.fold(parsing, extraction));
    }

    public boolean isUsable() {
        return extraction.isUsable();
    }

    /**
     * Whether no stage recorded an error. Warnings do not count.
     */
    public boolean isSuccess() {
        return !report.hasErrors();
    }

    public Optional<Widget> tree() {
        return extraction.tree();
    }

    public List<Widget> roots() {
        return extraction.roots();
    }
}
