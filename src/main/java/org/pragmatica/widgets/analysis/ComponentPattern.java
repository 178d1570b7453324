package org.pragmatica.widgets.analysis;

import org.pragmatica.widgets.extract.PropertyValue;
import org.pragmatica.widgets.extract.Widget;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A group of structurally identical widgets that could become one reusable component.
 *
 * <p>Instances share widget types, child slots and nesting all the way down; they may differ in
 * property values. Each distinct set of differences from the first instance is one {@link Variant}.
 *
 * @param id            {@code component_} followed by the structure hash
 * @param name          generated component name, unique within one detection run
 * @param structureHash hash of the shared structure, base 36
 * @param instances     matching widgets in pre-order; the first one is the base
 * @param variants      distinct variants, most used first when some were dropped
 * @param confidence    score between 0 and 1
 */
public record ComponentPattern(String id,
                               String name,
                               String structureHash,
                               List<Widget> instances,
                               List<Variant> variants,
                               double confidence) {

    public ComponentPattern {
        Objects.requireNonNull(name, "name");
        instances = List.copyOf(instances);
        variants = List.copyOf(variants);
    }

    public Widget base() {
        return instances.get(0);
    }

    public String type() {
        return base().type();
    }

    public int usageCount() {
        return instances.size();
    }

    /**
     * One way the instances of a component differ from its base.
     *
     * @param widget      first instance showing these differences
     * @param differences property differences from the base, in property order; empty for the base itself
     * @param usageCount  instances with exactly these differences
     */
    public record Variant(String id, String name, Widget widget, List<Difference> differences, int usageCount) {
        public Variant {
            differences = List.copyOf(differences);
        }

        public List<Difference> propertyDifferences() {
            return differences.stream()
                              .filter(difference -> difference.category().isEmpty())
                              .toList();
        }

        public List<Difference> stylingDifferences() {
            return differences.stream()
                              .filter(difference -> difference.category().isPresent())
                              .toList();
        }

        Variant used() {
            return new Variant(id, name, widget, differences, usageCount + 1);
        }
    }

    /**
     * A property whose value differs between the base and a variant.
     *
     * @param baseValue    value on the base, empty when the base does not set it
     * @param variantValue value on the variant, empty when the variant does not set it
     * @param category     styling category for style properties, empty for other properties
     */
    public record Difference(String property,
                             Optional<PropertyValue> baseValue,
                             Optional<PropertyValue> variantValue,
                             Optional<StyleCategory> category) {
    }

    public enum StyleCategory {
        COLOR,
        TYPOGRAPHY,
        SPACING,
        BORDER,
        SHADOW,
        /** Size, alignment and other layout-related style. */
        LAYOUT;

        static StyleCategory of(String property) {
            var name = property.toLowerCase();
            if (name.contains("color")) {
                return COLOR;
            }
            if (name.contains("font") || name.contains("text") || name.equals("style")) {
                return TYPOGRAPHY;
            }
            if (name.contains("padding") || name.contains("margin") || name.contains("spacing")) {
                return SPACING;
            }
            if (name.contains("border") || name.equals("shape") || name.equals("decoration")) {
                return BORDER;
            }
            if (name.contains("shadow") || name.equals("elevation")) {
                return SHADOW;
            }
            return LAYOUT;
        }
    }
}
