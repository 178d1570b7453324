package org.pragmatica.widgets.extract;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolved value of a widget property or of a value-object field.
 */
public sealed interface PropertyValue {

    /**
     * String, number, boolean or null literal.
     *
     * @param value {@link String}, {@link Long}, {@link Double}, {@link Boolean} or {@code null}
     */
    record Literal(Object value) implements PropertyValue {
        public static Literal of(Object value) {
            return new Literal(value);
        }

        public Optional<Double> asNumber() {
            return value instanceof Number number ? Optional.of(number.doubleValue()) : Optional.empty();
        }
    }

    record ListValue(List<PropertyValue> items) implements PropertyValue {
        public ListValue {
            items = List.copyOf(items);
        }
    }

    /**
     * Value constructed by a known value type, e.g. {@code EdgeInsets.all(8)} or {@code TextStyle(...)}.
     *
     * @param type   constructor name as written
     * @param fields arguments in source order, positional ones under their mapped names
     */
    record ObjectValue(String type, Map<String, PropertyValue> fields) implements PropertyValue {
        public ObjectValue {
            Objects.requireNonNull(type, "type");
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }

        public Optional<PropertyValue> field(String name) {
            return Optional.ofNullable(fields.get(name));
        }
    }

    /**
     * Expression the extractor does not evaluate, kept as source text for downstream interpretation.
     *
     * @param themePath for {@link ReferenceKind#THEME}, the member path after {@code Theme.of(context)}
     */
    record Reference(ReferenceKind kind, String expression, Optional<String> themePath) implements PropertyValue {
        public static Reference of(ReferenceKind kind, String expression) {
            return new Reference(kind, expression, Optional.empty());
        }

        public static Reference theme(String expression, String path) {
            return new Reference(ReferenceKind.THEME, expression, Optional.of(path));
        }
    }
}
