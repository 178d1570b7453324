package org.pragmatica.widgets.extract;

import org.junit.jupiter.api.Test;
import org.pragmatica.widgets.ast.AstNode;
import org.pragmatica.widgets.ast.AstNode.ArgumentList;
import org.pragmatica.widgets.ast.AstNode.ConstructorCall;
import org.pragmatica.widgets.ast.AstNode.NamedArgument;
import org.pragmatica.widgets.error.Diagnostic;
import org.pragmatica.widgets.error.DiagnosticCategory;
import org.pragmatica.widgets.error.DiagnosticCode;
import org.pragmatica.widgets.lexer.Lexer;
import org.pragmatica.widgets.parser.Parser;
import org.pragmatica.widgets.tree.SourceSpan;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class WidgetExtractorTest {

    private static ExtractionResult extract(String source) {
        var parsed = Parser.parse(Lexer.tokenize(source));
        assertTrue(parsed.isSuccess(), () -> "Source should parse cleanly: " + parsed.errors());
        return WidgetExtractor.extract(parsed.program());
    }

    private static Widget root(String source) {
        return extract(source).tree().orElseThrow();
    }

    @Test
    void extract_containerWithText_buildsPropertiesStyleAndChild() {
        var container = root("Container(color: \"red\", child: Text(\"hi\"))");

        assertEquals("Container", container.type());
        assertEquals(Map.of("color", PropertyValue.Literal.of("red")), container.properties());
        assertEquals(Map.of("color", PropertyValue.Literal.of("red")), container.style());
        assertEquals(1, container.children().size());

        var text = container.children().get(0);
        assertEquals("Text", text.type());
        assertEquals(Optional.of("child"), text.slot());
        assertEquals(Map.of("text", PropertyValue.Literal.of("hi")), text.properties());
        assertTrue(text.children().isEmpty());
    }

    @Test
    void extract_unknownConstructorWithTrailingComma_yieldsPlaceholder() {
        var result = extract("Foo(bar: 1,)");

        var foo = result.tree().orElseThrow();
        assertEquals(Widget.UNKNOWN, foo.type());
        assertTrue(foo.isPlaceholder());
        assertEquals("Foo", foo.constructor());
        assertEquals(WidgetCategory.UNKNOWN, foo.category());
        assertEquals(Map.of("bar", PropertyValue.Literal.of(1L)), foo.properties());

        assertEquals(1, result.diagnostics().size());
        var diagnostic = result.diagnostics().get(0);
        assertEquals(DiagnosticCategory.WIDGET, diagnostic.category());
        assertEquals(DiagnosticCode.UNKNOWN_WIDGET, diagnostic.code());
        assertEquals("Foo", diagnostic.context().get(Diagnostic.WIDGET));
        assertTrue(result.isSuccess());
        assertTrue(result.isUsable());
    }

    @Test
    void extract_unknownConstructor_stillWalksNestedWidgets() {
        var result = extract("MyCard(child: Column(children: [Text('a'), Foo()]))");

        var card = result.tree().orElseThrow();
        assertTrue(card.isPlaceholder());
        var column = card.children().get(0);
        assertEquals("Column", column.type());
        assertEquals(2, column.children().size());
        assertEquals(2, result.diagnostics().size());
        assertTrue(result.diagnostics().stream().allMatch(d -> d.category() == DiagnosticCategory.WIDGET));
    }

    @Test
    void extract_validSource_hasOneWidgetPerConstructorCall() {
        var source = """
            Scaffold(
              appBar: AppBar(title: Text('Home')),
              body: Column(
                children: [
                  Text('b'),
                  Row(children: [Icon(Icons.star), Text('c')]),
                  Unknown1(),
                ],
              ),
            )
            """;
        var program = Parser.parse(Lexer.tokenize(source)).program();

        var result = WidgetExtractor.extract(program);

        assertEquals(countConstructorCalls(program), result.widgetCount());
        assertEquals(9, result.widgetCount());
    }

    @Test
    void extract_arrayOfWidgets_preservesElementOrder() {
        var column = root("Column(children: [Text('1'), Icon(Icons.add), Text('2'), Divider()])");

        assertEquals(List.of("Text", "Icon", "Text", "Divider"),
                     column.children().stream().map(Widget::type).toList());
        assertEquals("1", ((PropertyValue.Literal) column.children().get(0).properties().get("text")).value());
        assertEquals("2", ((PropertyValue.Literal) column.children().get(2).properties().get("text")).value());
        assertFalse(column.properties().containsKey("children"));
    }

    @Test
    void extract_ids_followPreOrder() {
        var column = root("Column(children: [Center(child: Text('x')), Spacer()])");

        assertEquals(List.of("widget_1", "widget_2", "widget_3", "widget_4"),
                     column.preOrder().stream().map(Widget::id).toList());
        assertEquals("Spacer", column.children().get(1).type());
        assertEquals("widget_4", column.children().get(1).id());
    }

    @Test
    void extract_slotsOfSeveralWidgetArguments_areRecorded() {
        var scaffold = root("Scaffold(appBar: AppBar(), body: Center(), floatingActionButton: FloatingActionButton())");

        assertEquals(List.of("appBar", "body", "floatingActionButton"),
                     scaffold.children().stream().map(child -> child.slot().orElseThrow()).toList());
        assertEquals(1, scaffold.childrenIn("body").size());
    }

    @Test
    void extract_positionalArguments_useCatalogSlots() {
        var padding = root("Padding(EdgeInsets.all(8), child: Icon(Icons.star, size: 24))");

        var insets = assertInstanceOf(PropertyValue.ObjectValue.class, padding.properties().get("padding"));
        assertEquals("EdgeInsets.all", insets.type());
        assertEquals(Optional.of(PropertyValue.Literal.of(8L)), insets.field("all"));

        var icon = padding.children().get(0);
        var glyph = assertInstanceOf(PropertyValue.Reference.class, icon.properties().get("icon"));
        assertEquals("Icons.star", glyph.expression());
    }

    @Test
    void extract_multiSlotValueConstructor_mapsEveryPosition() {
        var container = root("Container(color: Color.fromARGB(255, 0, 128, 255))");

        var color = assertInstanceOf(PropertyValue.ObjectValue.class, container.properties().get("color"));
        assertEquals(List.of("a", "r", "g", "b"), List.copyOf(color.fields().keySet()));
        assertEquals(PropertyValue.Literal.of(128L), color.fields().get("g"));
    }

    @Test
    void extract_unmappedPositional_isKeptUnderSyntheticKey() {
        var result = extract("Divider(5)");

        var divider = result.tree().orElseThrow();
        assertEquals(PropertyValue.Literal.of(5L), divider.properties().get("positional0"));
        var diagnostic = result.diagnostics().get(0);
        assertEquals(DiagnosticCode.UNMAPPED_POSITIONAL, diagnostic.code());
        assertEquals(DiagnosticCategory.VALIDATION, diagnostic.category());
        assertEquals("positional0", diagnostic.context().get(Diagnostic.FIELD));
        assertTrue(result.isSuccess());
    }

    @Test
    void extract_duplicateArgument_keepsFirstValue() {
        var result = extract("Text('a', maxLines: 1, maxLines: 2)");

        var text = result.tree().orElseThrow();
        assertEquals(PropertyValue.Literal.of(1L), text.properties().get("maxLines"));
        assertEquals(DiagnosticCode.DUPLICATE_ARGUMENT, result.diagnostics().get(0).code());
    }

    @Test
    void extract_unresolvableValues_becomeTypedReferences() {
        var container = root("""
            Container(
              color: Colors.blue.shade100,
              alignment: Alignment.center,
              width: MediaQuery.of(context).size.width,
              key: itemKey,
              decoration: BoxDecoration(color: Theme.of(context).colorScheme.primary),
            )
            """);

        assertReference(container, "color", ReferenceKind.COLOR, "Colors.blue.shade100");
        assertReference(container, "alignment", ReferenceKind.ENUM, "Alignment.center");
        assertReference(container, "width", ReferenceKind.EXPRESSION, "MediaQuery.of(context).size.width");
        assertReference(container, "key", ReferenceKind.IDENTIFIER, "itemKey");

        var decoration = assertInstanceOf(PropertyValue.ObjectValue.class, container.properties().get("decoration"));
        var themed = assertInstanceOf(PropertyValue.Reference.class, decoration.field("color").orElseThrow());
        assertEquals(ReferenceKind.THEME, themed.kind());
        assertEquals(Optional.of("colorScheme.primary"), themed.themePath());
        assertTrue(container.children().isEmpty());
    }

    @Test
    void extract_namedConstructors_areClassifiedAsTheirWidget() {
        var column = root("Column(children: [Image.asset('logo.png'), ListView.builder(itemCount: 3)])");

        var image = column.children().get(0);
        assertEquals("Image", image.type());
        assertEquals("Image.asset", image.constructor());
        assertEquals(PropertyValue.Literal.of("logo.png"), image.properties().get("name"));

        var list = column.children().get(1);
        assertEquals("ListView", list.type());
        assertEquals(WidgetCategory.LAYOUT, list.category());
    }

    @Test
    void extract_widgetInsideValueObject_isHoistedWithDottedSlot() {
        var bar = root("""
            BottomNavigationBar(items: [
              BottomNavigationBarItem(icon: Icon(Icons.home), label: 'Home'),
            ])
            """);

        assertEquals(1, bar.children().size());
        var icon = bar.children().get(0);
        assertEquals("Icon", icon.type());
        assertEquals(Optional.of("items.icon"), icon.slot());

        var items = assertInstanceOf(PropertyValue.ListValue.class, bar.properties().get("items"));
        var item = assertInstanceOf(PropertyValue.ObjectValue.class, items.items().get(0));
        assertEquals(Map.of("label", PropertyValue.Literal.of("Home")), item.fields());
    }

    @Test
    void extract_widgetPassedToUnevaluatedCall_isHoisted() {
        var result = extract("Center(child: wrapper.build(Text('x')))");

        var center = result.tree().orElseThrow();
        assertEquals(2, result.widgetCount());
        assertEquals("Text", center.children().get(0).type());
        assertReference(center, "child", ReferenceKind.EXPRESSION, "wrapper.build(Text('x'))");
    }

    @Test
    void extract_mixedArray_keepsNonWidgetElementsAsList() {
        var row = root("Row(children: [Text('a'), spacer])");

        assertEquals(1, row.children().size());
        var rest = assertInstanceOf(PropertyValue.ListValue.class, row.properties().get("children"));
        var reference = assertInstanceOf(PropertyValue.Reference.class, rest.items().get(0));
        assertEquals(ReferenceKind.IDENTIFIER, reference.kind());
    }

    @Test
    void extract_styleProjection_copiesVisualProperties() {
        var container = root("Container(padding: EdgeInsets.all(8), color: Colors.red, onTap: handler, child: Text('x'))");

        assertEquals(List.of("padding", "color"), List.copyOf(container.style().keySet()));
        assertEquals(List.of("padding", "color", "onTap"), List.copyOf(container.properties().keySet()));
        assertSame(container.properties().get("color"), container.style().get("color"));
    }

    @Test
    void extract_outOfRangeValues_areReportedButKept() {
        var result = extract("Opacity(opacity: 1.5, child: SizedBox(width: -10))");

        var opacity = result.tree().orElseThrow();
        assertEquals(PropertyValue.Literal.of(1.5), opacity.properties().get("opacity"));
        assertEquals(2, result.warningCount());
        var first = result.diagnostics().get(0);
        assertEquals(DiagnosticCode.VALUE_OUT_OF_RANGE, first.code());
        assertEquals("value 1.5 of 'opacity' is outside [0, 1]", first.message());
        assertEquals("value -10 of 'width' is outside [0, inf)", result.diagnostics().get(1).message());
    }

    @Test
    void extract_topLevelNonWidget_isReported() {
        var result = extract("Colors.blue; Text('x')");

        assertEquals(1, result.roots().size());
        var diagnostic = result.diagnostics().get(0);
        assertEquals(DiagnosticCode.NOT_A_WIDGET, diagnostic.code());
        assertEquals("top-level expression is not a widget constructor: Colors.blue", diagnostic.message());
    }

    @Test
    void extract_topLevelUnknownNamedConstructor_keepsWidgetsInside() {
        var result = extract("MyCard.primary(child: Column(children: [Text('a'), Text('b')]))");

        assertEquals(1, result.roots().size());
        var column = result.tree().orElseThrow();
        assertEquals("Column", column.type());
        assertTrue(column.slot().isEmpty());
        assertEquals(3, result.widgetCount());
        assertTrue(result.isUsable());

        assertEquals(1, result.diagnostics().size());
        var diagnostic = result.diagnostics().get(0);
        assertEquals(DiagnosticCode.NOT_A_WIDGET, diagnostic.code());
        assertEquals(List.of("1 widget expression(s) inside it extracted as separate trees"), diagnostic.notes());
    }

    @Test
    void extract_topLevelReference_extractsEachEmbeddedWidget() {
        var result = extract("wrapper.build(Text('a'), Icon(Icons.add))");

        assertEquals(List.of("Text", "Icon"), result.roots().stream().map(Widget::type).toList());
        assertEquals("widget_2", result.roots().get(1).id());
    }

    @Test
    void extract_emptyProgram_isNotUsable() {
        var result = extract("EdgeInsets.all(8)");

        assertTrue(result.roots().isEmpty());
        assertFalse(result.isUsable());
        assertTrue(result.tree().isEmpty());
    }

    @Test
    void extract_constructorCallSubtree_extractsOnlyThatCall() {
        var program = Parser.parse(Lexer.tokenize("Center(child: Text('x'))")).program();
        var center = (ConstructorCall) program.body().get(0);
        var text = (ConstructorCall) center.arguments().arguments().get(0).value();

        var result = WidgetExtractor.extract(text, ExtractorConfig.DEFAULT);

        assertEquals(1, result.widgetCount());
        assertEquals("Text", result.tree().orElseThrow().type());
        assertTrue(result.tree().orElseThrow().slot().isEmpty());
    }

    @Test
    void extract_beyondDepthLimit_dropsSubtreeWithDiagnostic() {
        var program = Parser.parse(Lexer.tokenize("Center(child: Padding(padding: 8, child: Text('x')))")).program();

        var result = WidgetExtractor.extract(program, ExtractorConfig.DEFAULT.withMaxWidgetDepth(2));

        assertEquals(2, result.widgetCount());
        var diagnostic = result.diagnostics().get(0);
        assertEquals(DiagnosticCode.NESTING_TOO_DEEP, diagnostic.code());
        assertEquals("Padding", diagnostic.context().get(Diagnostic.WIDGET));
        assertFalse(result.isSuccess());
    }

    @Test
    void extract_veryDeepTree_doesNotOverflowStack() {
        int levels = 10_000;
        AstNode node = call("Text", List.of());
        for (int i = 0; i < levels; i++) {
            node = call("Center", List.of(new NamedArgument(SourceSpan.EMPTY, "child", node)));
        }
        var program = new AstNode.Program(SourceSpan.EMPTY, List.of(node));

        var result = WidgetExtractor.extract(program, ExtractorConfig.DEFAULT.withMaxWidgetDepth(20_000));

        assertEquals(levels + 1, result.widgetCount());
        assertTrue(result.diagnostics().isEmpty());
    }

    @Test
    void extract_customCatalog_recognizesRegisteredWidget() {
        var catalog = WidgetCatalog.builder()
                                   .withBuiltIns()
                                   .widget("ProfileCard", WidgetCategory.CONTAINER, "child")
                                   .build();
        var program = Parser.parse(Lexer.tokenize("ProfileCard(Text('Ada'))")).program();

        var result = WidgetExtractor.extract(program, ExtractorConfig.DEFAULT.withCatalog(catalog));

        var card = result.tree().orElseThrow();
        assertEquals("ProfileCard", card.type());
        assertEquals(Optional.of("child"), card.children().get(0).slot());
        assertTrue(result.diagnostics().isEmpty());
    }

    private static ConstructorCall call(String name, List<AstNode.Argument> arguments) {
        return new ConstructorCall(SourceSpan.EMPTY, name, new ArgumentList(SourceSpan.EMPTY, arguments), Optional.empty());
    }

    private static void assertReference(Widget widget, String property, ReferenceKind kind, String expression) {
        var reference = assertInstanceOf(PropertyValue.Reference.class, widget.properties().get(property), property);
        assertEquals(kind, reference.kind(), property);
        assertEquals(expression, reference.expression(), property);
    }

    private static int countConstructorCalls(AstNode root) {
        int count = 0;
        var stack = new ArrayDeque<AstNode>();
        stack.push(root);
        while (!stack.isEmpty()) {
            var node = stack.pop();
            if (node instanceof ConstructorCall) {
                count++;
            }
            node.children().forEach(stack::push);
        }
        return count;
    }
}
