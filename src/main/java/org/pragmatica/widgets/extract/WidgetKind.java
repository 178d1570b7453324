package org.pragmatica.widgets.extract;

import java.util.List;
import java.util.Objects;

/**
 * A widget constructor the catalog recognizes.
 *
 * @param name            constructor name as written, possibly dotted ({@code Image.asset})
 * @param category        coarse classification
 * @param positionalSlots property names positional arguments map to, in order
 */
public record WidgetKind(String name, WidgetCategory category, List<String> positionalSlots) {

    public WidgetKind {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(category, "category");
        positionalSlots = List.copyOf(positionalSlots);
    }

    /**
     * Widget type reported for this kind: the class name without a named-constructor suffix.
     */
    public String typeName() {
        int dot = name.indexOf('.');
        return dot < 0 ? name : name.substring(0, dot);
    }

    public boolean isNamedConstructor() {
        return name.indexOf('.') >= 0;
    }
}
