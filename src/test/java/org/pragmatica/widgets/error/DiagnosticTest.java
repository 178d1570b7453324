package org.pragmatica.widgets.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.widgets.lexer.Lexer;
import org.pragmatica.widgets.parser.Parser;
import org.pragmatica.widgets.tree.SourceLocation;
import org.pragmatica.widgets.tree.SourceSpan;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticTest {

    private static final SourceSpan SPAN = SourceSpan.of(SourceLocation.at(3, 5, 40), SourceLocation.at(3, 8, 43));

    @Test
    void of_rendersMessageFromCodeTemplate() {
        var diagnostic = Diagnostic.of(DiagnosticCode.UNKNOWN_WIDGET, SPAN, "Foo");

        assertEquals("unknown widget type 'Foo', using placeholder", diagnostic.message());
        assertEquals(Diagnostic.Severity.WARNING, diagnostic.severity());
        assertEquals(DiagnosticCategory.WIDGET, diagnostic.category());
        assertFalse(diagnostic.isError());
        assertEquals(3, diagnostic.line());
        assertEquals(5, diagnostic.column());
    }

    @Test
    void toUserMessage_isPhrasedPerCategory() {
        var syntax = Diagnostic.of(DiagnosticCode.UNEXPECTED_TOKEN, SPAN, "')'", "expression");
        var widget = Diagnostic.of(DiagnosticCode.UNKNOWN_WIDGET, SPAN, "Foo").withContext(Diagnostic.WIDGET, "Foo");
        var validation = Diagnostic.of(DiagnosticCode.UNMAPPED_POSITIONAL, SPAN, 0, "Divider", "positional0")
                                   .withContext(Diagnostic.FIELD, "positional0");

        assertEquals("Syntax error at line 3: unexpected ')', expected expression", syntax.toUserMessage());
        assertEquals("Widget error in Foo: unknown widget type 'Foo', using placeholder", widget.toUserMessage());
        assertEquals("Validation error in positional0: positional argument 0 of 'Divider' has no property mapping, "
                     + "kept as 'positional0'", validation.toUserMessage());
    }

    @Test
    void toUserMessage_withoutContext_omitsSubject() {
        var widget = Diagnostic.of(DiagnosticCode.NOT_A_WIDGET, SPAN, "Colors.blue");

        assertEquals("Widget error: top-level expression is not a widget constructor: Colors.blue", widget.toUserMessage());
    }

    @Test
    void withers_returnNewInstances() {
        var original = Diagnostic.of(DiagnosticCode.UNKNOWN_WIDGET, SPAN, "Foo");

        var enriched = original.withContext(Diagnostic.LEXEME, "Foo").withNote("check the import");

        assertTrue(original.context().isEmpty());
        assertTrue(original.notes().isEmpty());
        assertEquals("Foo", enriched.context().get(Diagnostic.LEXEME));
        assertEquals(1, enriched.notes().size());
    }

    @Test
    void withContext_keepsInsertionOrder() {
        var diagnostic = Diagnostic.of(DiagnosticCode.VALUE_OUT_OF_RANGE, SPAN, 2, "opacity", "[0, 1]")
                                   .withContext(Diagnostic.FIELD, "opacity")
                                   .withContext(Diagnostic.VALUE, 2)
                                   .withContext(Diagnostic.WIDGET, "Opacity")
                                   .withContext(Diagnostic.LEXEME, "2");

        assertEquals(List.of(Diagnostic.FIELD, Diagnostic.VALUE, Diagnostic.WIDGET, Diagnostic.LEXEME),
                     List.copyOf(diagnostic.context().keySet()));
        assertThrows(UnsupportedOperationException.class, () -> diagnostic.context().put("x", "y"));
    }

    @Test
    void format_showsSourceLineWithUnderlineAndHelp() {
        var source = "Container(color: )";
        var diagnostic = Parser.parse(Lexer.tokenize(source)).diagnostics().get(0);

        var formatted = diagnostic.format(source, "main.dart");

        assertTrue(formatted.startsWith("error[E0101]: unexpected ')', expected expression\n"));
        assertTrue(formatted.contains("--> main.dart:1:18"));
        assertTrue(formatted.contains("1 | Container(color: )"));
        assertTrue(formatted.contains("                 ^ found ')'"));
        assertTrue(formatted.contains("= help: a named argument needs a value after ':'"));
    }

    @Test
    void format_secondaryLabel_usesDashes() {
        var source = "Column(children: [Text('a'))";
        var diagnostic = Parser.parse(Lexer.tokenize(source)).diagnostics().get(0);

        var formatted = diagnostic.format(source, null);

        assertTrue(formatted.contains("--> 1:28"));
        assertTrue(formatted.contains("- opened here"));
        assertTrue(formatted.contains("^ does not close '['"));
    }

    @Test
    void formatSimple_isSingleLine() {
        var diagnostic = Diagnostic.of(DiagnosticCode.MALFORMED_NUMBER, SPAN, "12abc");

        assertEquals("app.dart:3:5: error[E0004]: malformed number literal '12abc'", diagnostic.formatSimple("app.dart"));
    }
}
