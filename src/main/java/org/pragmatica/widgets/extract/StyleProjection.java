package org.pragmatica.widgets.extract;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Selects the properties that describe how a widget looks or is laid out.
 */
public final class StyleProjection {

    public static final Set<String> STYLE_KEYS = Set.of(
        "color", "backgroundColor", "foregroundColor", "shadowColor", "borderColor", "focusColor",
        "hoverColor", "splashColor", "padding", "margin", "alignment", "width", "height", "decoration",
        "style", "fontSize", "fontWeight", "elevation", "borderRadius", "shape", "mainAxisAlignment",
        "crossAxisAlignment", "mainAxisSize", "constraints", "textAlign", "fit", "flex", "opacity", "spacing",
        "runSpacing");

    private StyleProjection() {
    }

    public static boolean isStyleKey(String name) {
        return STYLE_KEYS.contains(name);
    }

    /**
     * Style subset of {@code properties}, in property order. The input map is not modified.
     */
    public static Map<String, PropertyValue> project(Map<String, PropertyValue> properties) {
        var style = new LinkedHashMap<String, PropertyValue>();
        properties.forEach((name, value) -> {
            if (isStyleKey(name)) {
                style.put(name, value);
            }
        });
        return Collections.unmodifiableMap(style);
    }
}
