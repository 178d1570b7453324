package org.pragmatica.widgets.extract;

import org.pragmatica.widgets.tree.SourceSpan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One UI element extracted from a widget constructor call.
 *
 * <p>{@code properties} holds every non-widget argument in source order. Widget-valued arguments
 * are not properties: they become {@code children}, each tagged with the {@code slot} it was passed
 * in ({@code child}, {@code children}, {@code appBar}, or a dotted path such as
 * {@code items.icon} for widgets found inside value objects). {@code style} is a projection of
 * {@code properties}; the same entries stay in {@code properties}.
 *
 * @param id          pre-order id, unique within one extraction run
 * @param type        widget class name, or {@value #UNKNOWN} for an unrecognized constructor
 * @param constructor constructor as written, e.g. {@code Image.asset} or the unrecognized name
 * @param category    catalog category, {@link WidgetCategory#UNKNOWN} for placeholders
 * @param properties  resolved arguments by property name
 * @param style       visual and layout subset of {@code properties}
 * @param children    nested widgets in source order
 * @param slot        argument this widget was passed in, empty for roots
 * @param span        source range of the constructor call
 */
public record Widget(
    String id,
    String type,
    String constructor,
    WidgetCategory category,
    Map<String, PropertyValue> properties,
    Map<String, PropertyValue> style,
    List<Widget> children,
    Optional<String> slot,
    SourceSpan span
) {
    public static final String UNKNOWN = "Unknown";

    public Widget {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        style = Collections.unmodifiableMap(new LinkedHashMap<>(style));
        children = List.copyOf(children);
    }

    public boolean isPlaceholder() {
        return UNKNOWN.equals(type);
    }

    public Optional<PropertyValue> property(String name) {
        return Optional.ofNullable(properties.get(name));
    }

    public List<Widget> childrenIn(String slotName) {
        return children.stream()
                       .filter(child -> child.slot().filter(slotName::equals).isPresent())
                       .toList();
    }

    /**
     * This widget and all its descendants in pre-order.
     */
    public List<Widget> preOrder() {
        var result = new ArrayList<Widget>();
        var stack = new ArrayDeque<Widget>();
        stack.push(this);
        while (!stack.isEmpty()) {
            var widget = stack.pop();
            result.add(widget);
            for (int i = widget.children.size() - 1; i >= 0; i--) {
                stack.push(widget.children.get(i));
            }
        }
        return result;
    }

    /**
     * Number of widgets in this subtree, this one included.
     */
    public int size() {
        return preOrder().size();
    }

    /**
     * First widget of the given type in pre-order, this one included.
     */
    public Optional<Widget> find(String widgetType) {
        return preOrder().stream()
                         .filter(widget -> widget.type.equals(widgetType))
                         .findFirst();
    }
}
