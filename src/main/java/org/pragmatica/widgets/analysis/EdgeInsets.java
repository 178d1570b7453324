package org.pragmatica.widgets.analysis;

import org.pragmatica.widgets.extract.PropertyValue;

import java.util.Optional;

/**
 * Resolved padding or margin in logical pixels.
 */
public record EdgeInsets(double top, double right, double bottom, double left) {

    public static final EdgeInsets ZERO = uniform(0);

    public static EdgeInsets uniform(double value) {
        return new EdgeInsets(value, value, value, value);
    }

    public boolean isUniform() {
        return top == right && right == bottom && bottom == left;
    }

    /**
     * Interpret a property value: a number, {@code EdgeInsets.all/symmetric/only/fromLTRB},
     * their directional forms, or {@code EdgeInsets.zero}. Anything else is not resolvable.
     */
    public static Optional<EdgeInsets> from(PropertyValue value) {
        if (value instanceof PropertyValue.Literal literal) {
            return literal.asNumber().map(EdgeInsets::uniform);
        }
        if (value instanceof PropertyValue.Reference reference) {
            return "EdgeInsets.zero".equals(reference.expression()) ? Optional.of(ZERO) : Optional.empty();
        }
        if (!(value instanceof PropertyValue.ObjectValue object)) {
            return Optional.empty();
        }
        return switch (object.type()) {
            case "EdgeInsets.all" -> number(object, "all").map(EdgeInsets::uniform);
            case "EdgeInsets.symmetric", "EdgeInsetsDirectional.symmetric" -> {
                double horizontal = numberOrZero(object, "horizontal");
                double vertical = numberOrZero(object, "vertical");
                yield Optional.of(new EdgeInsets(vertical, horizontal, vertical, horizontal));
            }
            case "EdgeInsets.only", "EdgeInsets.fromLTRB" ->
                Optional.of(new EdgeInsets(numberOrZero(object, "top"), numberOrZero(object, "right"),
                                           numberOrZero(object, "bottom"), numberOrZero(object, "left")));
            case "EdgeInsetsDirectional.only", "EdgeInsetsDirectional.fromSTEB" ->
                Optional.of(new EdgeInsets(numberOrZero(object, "top"), numberOrZero(object, "end"),
                                           numberOrZero(object, "bottom"), numberOrZero(object, "start")));
            default -> Optional.empty();
        };
    }

    private static Optional<Double> number(PropertyValue.ObjectValue object, String field) {
        return object.field(field)
                     .filter(PropertyValue.Literal.class::isInstance)
                     .flatMap(value -> ((PropertyValue.Literal) value).asNumber());
    }

    private static double numberOrZero(PropertyValue.ObjectValue object, String field) {
        return number(object, field).orElse(0.0);
    }
}
