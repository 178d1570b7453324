package org.pragmatica.widgets.json;

import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;
import org.pragmatica.widgets.WidgetTreeParser;

import static org.junit.jupiter.api.Assertions.*;

class WidgetJsonTest {

    private final WidgetTreeParser parser = WidgetTreeParser.create();

    @Test
    void toJsonTree_rendersWidgetShape() {
        var root = parser.convert("""
            Container(
              color: Colors.blue,
              padding: EdgeInsets.all(8),
              child: Text('hi', softWrap: null),
            )
            """).tree().orElseThrow();

        var json = WidgetJson.toJsonTree(root);

        assertEquals("widget_1", json.get("id").getAsString());
        assertEquals("Container", json.get("type").getAsString());
        assertEquals("CONTAINER", json.get("category").getAsString());
        assertFalse(json.has("slot"));
        assertEquals(1, json.getAsJsonObject("span").get("line").getAsInt());

        var color = json.getAsJsonObject("properties").getAsJsonObject("color");
        assertEquals("reference", color.get("kind").getAsString());
        assertEquals("COLOR", color.get("referenceKind").getAsString());
        assertEquals("Colors.blue", color.get("expression").getAsString());

        var padding = json.getAsJsonObject("style").getAsJsonObject("padding");
        assertEquals("object", padding.get("kind").getAsString());
        assertEquals(8, padding.getAsJsonObject("fields").getAsJsonObject("all").get("value").getAsInt());

        var text = json.getAsJsonArray("children").get(0).getAsJsonObject();
        assertEquals("child", text.get("slot").getAsString());
        assertEquals("hi", text.getAsJsonObject("properties").getAsJsonObject("text").get("value").getAsString());
        assertTrue(text.getAsJsonObject("properties").getAsJsonObject("softWrap").get("value").isJsonNull());
        assertEquals(0, text.getAsJsonArray("children").size());
    }

    @Test
    void toJson_keepsNullLiteralsAndParsesBack() {
        var root = parser.convert("Text('x', softWrap: null)").tree().orElseThrow();

        var json = WidgetJson.toJson(root);

        assertTrue(json.contains("\"softWrap\":{\"kind\":\"literal\",\"value\":null}"));
        assertEquals("Text", JsonParser.parseString(json).getAsJsonObject().get("type").getAsString());
    }

    @Test
    void toJsonTree_themeReference_carriesPath() {
        var root = parser.convert("Text('x', style: Theme.of(context).textTheme.titleLarge)").tree().orElseThrow();

        var style = WidgetJson.toJsonTree(root).getAsJsonObject("properties").getAsJsonObject("style");

        assertEquals("THEME", style.get("referenceKind").getAsString());
        assertEquals("textTheme.titleLarge", style.get("themePath").getAsString());
    }

    @Test
    void toJsonTree_deepTree_rendersEveryLevel() {
        var deep = WidgetTreeParser.builder().maxDepth(1_000).build();
        var source = "Center(child: ".repeat(300) + "Text('x')" + ")".repeat(300);
        var root = deep.convert(source).tree().orElseThrow();

        var json = WidgetJson.toJsonTree(root);

        var current = json;
        int levels = 1;
        while (current.getAsJsonArray("children").size() > 0) {
            current = current.getAsJsonArray("children").get(0).getAsJsonObject();
            levels++;
        }
        assertEquals(301, levels);
        assertEquals("Text", current.get("type").getAsString());
    }

    @Test
    void toJson_report_listsDiagnostics() {
        var result = parser.convert("Foo(bar: )");

        var json = JsonParser.parseString(WidgetJson.toJson(result.report())).getAsJsonObject();

        assertTrue(json.get("hasErrors").getAsBoolean());
        assertEquals("1 error, 1 warning", json.get("summary").getAsString());
        var diagnostics = json.getAsJsonArray("diagnostics");
        assertEquals(2, diagnostics.size());
        var first = diagnostics.get(0).getAsJsonObject();
        assertEquals("E0101", first.get("code").getAsString());
        assertEquals("SYNTAX", first.get("category").getAsString());
        assertEquals(10, first.get("column").getAsInt());
        assertEquals("bar", first.getAsJsonObject("context").get("field").getAsString());
        assertEquals(1, json.getAsJsonArray("warnings").size());
    }
}
