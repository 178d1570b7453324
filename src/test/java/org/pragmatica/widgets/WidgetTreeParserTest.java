package org.pragmatica.widgets;

import org.junit.jupiter.api.Test;
import org.pragmatica.widgets.ast.AstNode.ConstructorCall;
import org.pragmatica.widgets.error.DiagnosticCode;
import org.pragmatica.widgets.extract.WidgetCatalog;
import org.pragmatica.widgets.extract.WidgetCategory;
import org.pragmatica.widgets.parser.RecoveryStrategy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class WidgetTreeParserTest {

    private final WidgetTreeParser parser = WidgetTreeParser.create();

    @Test
    void convert_validSource_succeeds() {
        var result = parser.convert("""
            Center(
              child: Text('Hello', style: TextStyle(fontSize: 24)),
            )
            """);

        assertTrue(result.isSuccess());
        assertTrue(result.isUsable());
        assertTrue(result.report().isEmpty());
        var root = result.tree().orElseThrow();
        assertEquals("Center", root.type());
        assertEquals("Text", root.children().get(0).type());
        assertEquals(2, result.extraction().widgetCount());
    }

    @Test
    void convert_missingValue_keepsPartialTree() {
        var result = parser.convert("Container(color: )");

        assertFalse(result.isSuccess());
        assertTrue(result.isUsable());
        var root = result.tree().orElseThrow();
        assertEquals("Container", root.type());
        assertTrue(root.property("color").isEmpty());
        assertEquals(1, result.report().errors().size());
        assertEquals(DiagnosticCode.UNEXPECTED_TOKEN, result.report().diagnostics().get(0).code());
    }

    @Test
    void convert_mismatchedDelimiter_isNotUsable() {
        var result = parser.convert("Column(children: [Text('a'))");

        assertFalse(result.isUsable());
        assertTrue(result.roots().isEmpty());
        assertTrue(result.parsing().structuralBreak());
        assertEquals(DiagnosticCode.MISMATCHED_DELIMITER, result.report().diagnostics().get(0).code());
    }

    @Test
    void convert_lexicalErrors_reportedOnce() {
        var result = parser.convert("Text('a', key: @)");

        var codes = result.report().diagnostics().stream().map(diagnostic -> diagnostic.code()).toList();

        assertEquals(1, codes.stream().filter(DiagnosticCode.UNEXPECTED_CHARACTER::equals).count());
        assertEquals(1, result.lexing().diagnostics().size());
        assertTrue(result.isUsable());
    }

    @Test
    void convert_emptySource_isEmptyAndClean() {
        var result = parser.convert("   // nothing here\n");

        assertTrue(result.isSuccess());
        assertFalse(result.isUsable());
        assertTrue(result.tree().isEmpty());
    }

    @Test
    void convert_longPropertyChain_keepsWidgetAndReportsDepth() {
        var result = assertDoesNotThrow(() -> parser.convert("Container(color: x" + ".y".repeat(500_000) + ")"));

        assertTrue(result.isUsable());
        assertEquals("Container", result.tree().orElseThrow().type());
        assertTrue(result.tree().orElseThrow().property("color").isEmpty());
        assertEquals(DiagnosticCode.NESTING_TOO_DEEP, result.report().diagnostics().get(0).code());
    }

    @Test
    void convert_subtractionInArgument_keepsOtherArguments() {
        var result = parser.convert("SizedBox(width: size-8, child: Text('a'))");

        assertTrue(result.isSuccess());
        var box = result.tree().orElseThrow();
        assertTrue(box.property("width").isEmpty());
        assertEquals("Text", box.children().get(0).type());
        assertEquals(DiagnosticCode.UNSUPPORTED_SYNTAX, result.report().diagnostics().get(0).code());
    }

    @Test
    void convert_nullSource_throws() {
        assertThrows(NullPointerException.class, () -> parser.convert(null));
    }

    @Test
    void parseSource_prependsLexicalDiagnostics() {
        var result = parser.parseSource("Row(children: [`])");

        assertEquals(DiagnosticCode.UNEXPECTED_CHARACTER, result.diagnostics().get(0).code());
        assertFalse(result.program().isEmpty());
    }

    @Test
    void parse_tokens_skipsLexicalDiagnostics() {
        var lexed = parser.tokenize("Row(children: [`])");

        var result = parser.parse(lexed);

        assertFalse(lexed.diagnostics().isEmpty());
        assertTrue(result.diagnostics().isEmpty());
    }

    @Test
    void validateSyntax_reportsWithoutExtracting() {
        var valid = parser.validateSyntax("Foo(bar: 1)");
        var invalid = parser.validateSyntax("Foo(bar: 1");

        assertTrue(valid.diagnostics().isEmpty());
        assertEquals(DiagnosticCode.UNCLOSED_DELIMITER, invalid.diagnostics().get(0).code());
    }

    @Test
    void extractWidgets_fromSubtree() {
        var program = parser.parseSource("Column(children: [Text('a'), Icon(Icons.add)])").program();
        var column = (ConstructorCall) program.body().get(0);

        var extraction = parser.extractWidgets(column);

        assertEquals(3, extraction.widgetCount());
        assertEquals("widget_1", extraction.tree().orElseThrow().id());
    }

    @Test
    void builder_appliesConfiguration() {
        var catalog = WidgetCatalog.builder()
                                   .withBuiltIns()
                                   .widget("GradientCard", WidgetCategory.CONTAINER, "gradient")
                                   .build();
        var custom = WidgetTreeParser.builder()
                                     .maxDepth(12)
                                     .recovery(RecoveryStrategy.NONE)
                                     .catalog(catalog)
                                     .build();

        assertEquals(12, custom.parserConfig().maxNestingDepth());
        assertEquals(12, custom.extractorConfig().maxWidgetDepth());
        assertEquals(RecoveryStrategy.NONE, custom.parserConfig().recovery());

        var result = custom.convert("GradientCard(LinearGradient(colors: [Colors.red]))");

        assertTrue(result.isSuccess());
        assertTrue(result.report().isEmpty());
        assertTrue(result.tree().orElseThrow().property("gradient").isPresent());
    }

    @Test
    void builder_rejectsNonPositiveDepth() {
        assertThrows(IllegalArgumentException.class, () -> WidgetTreeParser.builder().maxDepth(0).build());
    }

    @Test
    void convert_sharedInstance_isSafeAcrossThreads() throws Exception {
        var executor = Executors.newFixedThreadPool(8);
        try {
            var tasks = new ArrayList<Callable<Integer>>();
            for (int i = 0; i < 64; i++) {
                int count = i % 7 + 1;
                var source = "Column(children: [" + "Text('item'), ".repeat(count) + "])";
                tasks.add(() -> parser.convert(source).extraction().widgetCount());
            }

            var futures = executor.invokeAll(tasks);

            for (int i = 0; i < futures.size(); i++) {
                assertEquals(i % 7 + 2, futures.get(i).get());
            }
        } finally {
            executor.shutdown();
            assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        }
    }

    @Test
    void roots_severalTopLevelWidgets() {
        var result = parser.convert("Text('a');\nText('b');");

        assertEquals(List.of("Text", "Text"), result.roots().stream().map(widget -> widget.type()).toList());
        assertEquals("widget_2", result.roots().get(1).id());
    }
}
