package org.pragmatica.widgets.json;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import org.pragmatica.widgets.error.Diagnostic;
import org.pragmatica.widgets.error.DiagnosticReport;
import org.pragmatica.widgets.extract.PropertyValue;
import org.pragmatica.widgets.extract.Widget;
import org.pragmatica.widgets.tree.SourceSpan;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Map;

/**
 * JSON rendering of widget trees and diagnostic reports for the node-creation side.
 *
 * <p>Property values are tagged with a {@code kind} so consumers can tell a literal string from an
 * opaque reference:
 * <pre>
 * {"kind": "literal", "value": 16}
 * {"kind": "reference", "referenceKind": "COLOR", "expression": "Colors.blue"}
 * {"kind": "object", "type": "EdgeInsets.all", "fields": {"all": {...}}}
 * {"kind": "list", "items": [...]}
 * </pre>
 */
public final class WidgetJson {

    private static final Gson GSON = new GsonBuilder().serializeNulls().create();
    private static final Gson PRETTY = new GsonBuilder().serializeNulls().setPrettyPrinting().create();

    private WidgetJson() {
    }

    public static String toJson(Widget widget) {
        return GSON.toJson(toJsonTree(widget));
    }

    public static String toPrettyJson(Widget widget) {
        return PRETTY.toJson(toJsonTree(widget));
    }

    public static String toJson(DiagnosticReport report) {
        return GSON.toJson(toJsonTree(report));
    }

    public static JsonArray toJsonTree(List<Widget> roots) {
        var array = new JsonArray();
        roots.forEach(root -> array.add(toJsonTree(root)));
        return array;
    }

    /**
     * Convert a widget tree. Children are attached through an explicit stack, so deep trees do not
     * grow the call stack.
     */
    public static JsonObject toJsonTree(Widget root) {
        var rootJson = node(root);
        var stack = new ArrayDeque<Pending>();
        stack.push(new Pending(root, rootJson));

        while (!stack.isEmpty()) {
            var pending = stack.pop();
            var children = new JsonArray();
            for (var child : pending.widget().children()) {
                var childJson = node(child);
                children.add(childJson);
                stack.push(new Pending(child, childJson));
            }
            pending.json().add("children", children);
        }
        return rootJson;
    }

    public static JsonObject toJsonTree(DiagnosticReport report) {
        var json = new JsonObject();
        json.addProperty("hasErrors", report.hasErrors());
        json.addProperty("summary", report.summary());

        var diagnostics = new JsonArray();
        report.diagnostics().forEach(diagnostic -> diagnostics.add(toJsonTree(diagnostic)));
        json.add("diagnostics", diagnostics);

        var warnings = new JsonArray();
        report.warnings().forEach(warnings::add);
        json.add("warnings", warnings);
        return json;
    }

    public static JsonObject toJsonTree(Diagnostic diagnostic) {
        var json = new JsonObject();
        json.addProperty("severity", diagnostic.severity().display());
        json.addProperty("category", diagnostic.category().name());
        json.addProperty("code", diagnostic.code().code());
        json.addProperty("message", diagnostic.message());
        json.addProperty("line", diagnostic.line());
        json.addProperty("column", diagnostic.column());
        json.addProperty("userMessage", diagnostic.toUserMessage());

        var context = new JsonObject();
        diagnostic.context().forEach(context::addProperty);
        json.add("context", context);

        var notes = new JsonArray();
        diagnostic.notes().forEach(notes::add);
        json.add("notes", notes);
        return json;
    }

    public static JsonElement toJsonTree(PropertyValue value) {
        var json = new JsonObject();
        if (value instanceof PropertyValue.Literal literal) {
            json.addProperty("kind", "literal");
            json.add("value", literal(literal.value()));
        } else if (value instanceof PropertyValue.ListValue list) {
            json.addProperty("kind", "list");
            var items = new JsonArray();
            list.items().forEach(item -> items.add(toJsonTree(item)));
            json.add("items", items);
        } else if (value instanceof PropertyValue.ObjectValue object) {
            json.addProperty("kind", "object");
            json.addProperty("type", object.type());
            json.add("fields", properties(object.fields()));
        } else if (value instanceof PropertyValue.Reference reference) {
            json.addProperty("kind", "reference");
            json.addProperty("referenceKind", reference.kind().name());
            json.addProperty("expression", reference.expression());
            reference.themePath().ifPresent(path -> json.addProperty("themePath", path));
        }
        return json;
    }

    private static JsonObject node(Widget widget) {
        var json = new JsonObject();
        json.addProperty("id", widget.id());
        json.addProperty("type", widget.type());
        json.addProperty("constructor", widget.constructor());
        json.addProperty("category", widget.category().name());
        widget.slot().ifPresent(slot -> json.addProperty("slot", slot));
        json.add("span", span(widget.span()));
        json.add("properties", properties(widget.properties()));
        json.add("style", properties(widget.style()));
        return json;
    }

    private static JsonObject properties(Map<String, PropertyValue> values) {
        var json = new JsonObject();
        values.forEach((name, value) -> json.add(name, toJsonTree(value)));
        return json;
    }

    private static JsonElement literal(Object value) {
        if (value == null) {
            return JsonNull.INSTANCE;
        }
        if (value instanceof Number number) {
            return new JsonPrimitive(number);
        }
        if (value instanceof Boolean bool) {
            return new JsonPrimitive(bool);
        }
        return new JsonPrimitive(value.toString());
    }

    private static JsonObject span(SourceSpan span) {
        var json = new JsonObject();
        json.addProperty("line", span.start().line());
        json.addProperty("column", span.start().column());
        json.addProperty("offset", span.start().offset());
        json.addProperty("length", span.length());
        return json;
    }

    private record Pending(Widget widget, JsonObject json) {
    }
}
