package org.pragmatica.widgets.parser;

import org.pragmatica.widgets.ast.AstNode.Program;
import org.pragmatica.widgets.error.Diagnostic;
import org.pragmatica.widgets.error.StageResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Program produced by the parser together with lexical and syntax diagnostics.
 *
 * <p>The program may be partial: malformed arguments and elements are omitted, the surrounding
 * structure is kept. After a structural break (mismatched delimiters) the program is empty.
 *
 * @param program          parsed program, never null
 * @param diagnostics      syntax diagnostics, preceded by the lexical ones when parsed straight from source
 * @param structuralBreak  whether parsing collapsed to an empty program
 */
public record ParseResult(Program program, List<Diagnostic> diagnostics, boolean structuralBreak)
    implements StageResult<Program> {

    public ParseResult {
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * Same result with {@code earlier} diagnostics placed before this stage's own.
     */
    public ParseResult withLeadingDiagnostics(List<Diagnostic> earlier) {
        var all = new ArrayList<Diagnostic>(earlier);
        all.addAll(diagnostics);
        return new ParseResult(program, all, structuralBreak);
    }

    @Override
    public Program product() {
        return program;
    }

    /**
     * Whether there is anything to extract widgets from.
     */
    public boolean isUsable() {
        return !program.isEmpty();
    }
}
