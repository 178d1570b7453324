package org.pragmatica.widgets.analysis;

import org.pragmatica.widgets.analysis.ComponentPattern.Difference;
import org.pragmatica.widgets.analysis.ComponentPattern.StyleCategory;
import org.pragmatica.widgets.analysis.ComponentPattern.Variant;
import org.pragmatica.widgets.extract.PropertyValue;
import org.pragmatica.widgets.extract.StyleProjection;
import org.pragmatica.widgets.extract.Widget;
import org.pragmatica.widgets.extract.WidgetCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Finds repeated widget structures that are candidates for reusable components.
 *
 * <p>Every widget of the given trees, nested ones included, is grouped with the widgets whose whole
 * subtree has the same shape: same types, same child slots, same nesting. Groups with enough
 * instances are split into variants by their property values and scored; those reaching the
 * configured confidence are reported.
 *
 * <p>Shapes are computed bottom-up over a pre-order list, so deep trees are safe. Instances are
 * thread-safe.
 */
public final class ComponentDetector {

    private static final Logger log = LoggerFactory.getLogger(ComponentDetector.class);

    private static final Set<String> SCAFFOLDING_TYPES = Set.of("Scaffold", "AppBar", "SliverAppBar",
                                                                "MaterialApp", "CupertinoApp");
    private static final Set<String> NAMED_BY_TYPE = Set.of("Card", "Container", "Row", "Column");
    private static final Set<String> TYPOGRAPHY_KEYS = Set.of("style", "fontSize", "fontWeight", "textAlign");

    private final ComponentDetectorConfig config;

    private ComponentDetector(ComponentDetectorConfig config) {
        this.config = config;
    }

    public static ComponentDetector create() {
        return new ComponentDetector(ComponentDetectorConfig.DEFAULT);
    }

    public static ComponentDetector create(ComponentDetectorConfig config) {
        return new ComponentDetector(Objects.requireNonNull(config, "config"));
    }

    public ComponentDetectorConfig config() {
        return config;
    }

    public ComponentDetection detect(Widget root) {
        return detect(List.of(root));
    }

    public ComponentDetection detect(List<Widget> roots) {
        var all = new ArrayList<Widget>();
        for (var root : roots) {
            all.addAll(root.preOrder());
        }
        var shapes = shapes(all);

        var groups = new LinkedHashMap<Integer, List<Widget>>();
        for (var widget : all) {
            if (isCandidate(widget)) {
                groups.computeIfAbsent(shapes.get(widget).id(), key -> new ArrayList<>()).add(widget);
            }
        }

        var patterns = new ArrayList<ComponentPattern>();
        var usedNames = new HashMap<String, Integer>();
        for (var group : groups.values()) {
            if (group.size() < config.minInstances()) {
                continue;
            }
            var variants = variants(group);
            double confidence = confidence(group, variants);
            if (confidence < config.minConfidence()) {
                log.debug("Skipping {} instances of {}, confidence {}", group.size(), group.get(0).type(), confidence);
                continue;
            }
            var hash = Integer.toUnsignedString(shapes.get(group.get(0)).hash(), 36);
            var name = uniqueName(componentName(group.get(0), variants), usedNames);
            patterns.add(new ComponentPattern("component_" + hash, name, hash, group, variants, confidence));
        }

        var detection = new ComponentDetection(patterns, all.size());
        log.debug("Detected {} components covering {} of {} widgets",
                  detection.uniquePatterns(), detection.totalInstances(), detection.totalWidgets());
        return detection;
    }

    private record Shape(int id, int hash) {}

    // Reverse pre-order visits every child before its parent
    private static Map<Widget, Shape> shapes(List<Widget> all) {
        var shapes = new IdentityHashMap<Widget, Shape>();
        var ids = new HashMap<String, Integer>();

        for (int i = all.size() - 1; i >= 0; i--) {
            var widget = all.get(i);
            var key = new StringBuilder(shapeName(widget)).append('(');
            int hash = shapeName(widget).hashCode();
            for (var child : widget.children()) {
                var childShape = shapes.get(child);
                key.append(child.slot().orElse("")).append('=').append(childShape.id()).append(',');
                hash = 31 * (31 * hash + child.slot().orElse("").hashCode()) + childShape.hash();
            }
            int id = ids.computeIfAbsent(key.append(')').toString(), k -> ids.size());
            shapes.put(widget, new Shape(id, hash));
        }
        return shapes;
    }

    private static String shapeName(Widget widget) {
        return widget.isPlaceholder() ? widget.constructor() : widget.type();
    }

    private boolean isCandidate(Widget widget) {
        if (widget.isPlaceholder() && !config.includeUnknownWidgets()) {
            return false;
        }
        if (SCAFFOLDING_TYPES.contains(widget.type())) {
            return false;
        }
        return !isSimpleLeaf(widget);
    }

    private static boolean isSimpleLeaf(Widget widget) {
        var category = widget.category();
        return widget.children().isEmpty()
               && (category == WidgetCategory.TEXT || category == WidgetCategory.IMAGE)
               && widget.properties().size() <= 1;
    }

    private List<Variant> variants(List<Widget> group) {
        var base = group.get(0);
        var bySignature = new LinkedHashMap<String, Variant>();

        for (var widget : group) {
            var differences = differences(base, widget);
            var signature = differences.stream()
                                       .map(difference -> difference.property() + ":" + difference.variantValue())
                                       .sorted()
                                       .collect(Collectors.joining("|"));
            bySignature.compute(signature, (key, existing) -> existing != null
                ? existing.used()
                : new Variant("variant_" + Integer.toUnsignedString(key.hashCode(), 36),
                              variantName(differences), widget, differences, 1));
        }

        var variants = new ArrayList<>(bySignature.values());
        if (variants.size() > config.maxVariants()) {
            variants.sort(Comparator.comparingInt(Variant::usageCount).reversed());
            return List.copyOf(variants.subList(0, config.maxVariants()));
        }
        return variants;
    }

    private List<Difference> differences(Widget base, Widget variant) {
        var names = new LinkedHashSet<>(base.properties().keySet());
        names.addAll(variant.properties().keySet());

        var differences = new ArrayList<Difference>();
        for (var name : names) {
            if (config.ignoreProperties().contains(name)) {
                continue;
            }
            var baseValue = base.property(name);
            var variantValue = variant.property(name);
            if (!baseValue.equals(variantValue)) {
                var category = StyleProjection.isStyleKey(name)
                               ? Optional.of(StyleCategory.of(name))
                               : Optional.<StyleCategory>empty();
                differences.add(new Difference(name, baseValue, variantValue, category));
            }
        }
        return differences;
    }

    private double confidence(List<Widget> group, List<Variant> variants) {
        double instanceScore = Math.min(group.size() / 5.0, 0.5);
        double complexityScore = complexity(group.get(0)) * 0.3;
        double variantScore = variantScore(variants) * 0.2;
        return Math.min(instanceScore + complexityScore + variantScore, 1.0);
    }

    private static double complexity(Widget widget) {
        double score = 0.2;
        score += Math.min(widget.children().size() / 3.0, 0.3);
        score += Math.min(widget.properties().size() / 5.0, 0.3);
        if (widget.style().keySet().stream().anyMatch(name -> name.toLowerCase().contains("color"))) {
            score += 0.1;
        }
        if (widget.properties().keySet().stream().anyMatch(TYPOGRAPHY_KEYS::contains)) {
            score += 0.1;
        }
        if (LayoutAnalyzer.analyze(widget).type() != LayoutType.NONE) {
            score += 0.1;
        }
        return Math.min(score, 1.0);
    }

    // Fewer variants with even usage score higher
    private double variantScore(List<Variant> variants) {
        if (variants.isEmpty()) {
            return 0;
        }
        if (variants.size() == 1) {
            return 1;
        }
        int total = 0;
        int most = 0;
        for (var variant : variants) {
            total += variant.usageCount();
            most = Math.max(most, variant.usageCount());
        }
        double countScore = Math.max(0, 1 - (variants.size() - 1) / (double) config.maxVariants());
        double usageScore = (double) total / variants.size() / most;
        return (countScore + usageScore) / 2;
    }

    private static String componentName(Widget base, List<Variant> variants) {
        String name;
        if (base.isPlaceholder()) {
            name = base.constructor();
        } else if (base.category() == WidgetCategory.BUTTON) {
            name = "Button";
        } else if (NAMED_BY_TYPE.contains(base.type())) {
            name = base.type();
        } else {
            name = "Component";
        }
        for (var variant : variants) {
            for (var difference : variant.differences()) {
                var suffix = descriptor(difference.property());
                if (suffix.isPresent()) {
                    return name + suffix.get();
                }
            }
        }
        return name;
    }

    private static Optional<String> descriptor(String property) {
        var name = property.toLowerCase();
        if (name.contains("color")) {
            return Optional.of("Color");
        }
        if (name.contains("size")) {
            return Optional.of("Size");
        }
        if (name.contains("text")) {
            return Optional.of("Text");
        }
        return Optional.empty();
    }

    private static String uniqueName(String name, Map<String, Integer> usedNames) {
        int count = usedNames.merge(name, 1, Integer::sum);
        return count == 1 ? name : name + count;
    }

    private static String variantName(List<Difference> differences) {
        if (differences.isEmpty()) {
            return "Default";
        }
        var first = differences.get(0);
        var descriptor = descriptor(first.property());
        if (descriptor.isPresent() && !descriptor.get().equals("Text")) {
            return capitalize(first.variantValue().map(ComponentDetector::describe).orElse("none")) + descriptor.get();
        }
        if (descriptor.isPresent()) {
            return "TextVariant";
        }
        return "Variant" + differences.size();
    }

    // Short label: literal text, last segment of a reference, or the value type
    private static String describe(PropertyValue value) {
        if (value instanceof PropertyValue.Literal literal) {
            return String.valueOf(literal.value());
        }
        if (value instanceof PropertyValue.Reference reference) {
            var expression = reference.expression();
            return expression.substring(expression.lastIndexOf('.') + 1);
        }
        if (value instanceof PropertyValue.ObjectValue object) {
            return object.type();
        }
        return "list";
    }

    private static String capitalize(String text) {
        return text.isEmpty() ? text : Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }
}
