package org.pragmatica.widgets.extract;

import java.util.List;
import java.util.Objects;

/**
 * A constructor producing a plain value (style, geometry, color) rather than a widget.
 *
 * @param name            constructor name as written, possibly dotted ({@code EdgeInsets.all})
 * @param positionalSlots field names positional arguments map to, in order
 */
public record ValueKind(String name, List<String> positionalSlots) {

    public ValueKind {
        Objects.requireNonNull(name, "name");
        positionalSlots = List.copyOf(positionalSlots);
    }
}
