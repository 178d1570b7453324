package org.pragmatica.widgets.analysis;

import org.pragmatica.widgets.extract.PropertyValue;
import org.pragmatica.widgets.extract.Widget;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Structure of one or more extracted widget trees with per-widget locations.
 *
 * @param trees     per-root statistics, in root order
 * @param locations every widget by id, in pre-order
 */
public record TreeAnalysis(List<TreeStats> trees, Map<String, WidgetLocation> locations) {

    /**
     * @param depth     number of levels, 1 for a lone root
     * @param nodeCount widgets in the tree, root included
     */
    public record TreeStats(Widget root, int depth, int nodeCount) {
    }

    public TreeAnalysis {
        trees = List.copyOf(trees);
        locations = Collections.unmodifiableMap(new LinkedHashMap<>(locations));
    }

    public int totalWidgets() {
        return locations.size();
    }

    public int maxDepth() {
        return trees.stream()
                    .mapToInt(TreeStats::depth)
                    .max()
                    .orElse(0);
    }

    /**
     * Widgets that hold or can hold other widgets.
     */
    public List<Widget> containers() {
        return widgets(widget -> !widget.children().isEmpty() || widget.category().holdsChildren());
    }

    public List<Widget> leaves() {
        return widgets(widget -> widget.children().isEmpty());
    }

    public Optional<WidgetLocation> location(String id) {
        return Optional.ofNullable(locations.get(id));
    }

    /**
     * Enclosing widgets of the given one, nearest first.
     */
    public List<Widget> ancestors(String id) {
        var result = new ArrayList<Widget>();
        var parent = location(id).flatMap(WidgetLocation::parentId);
        while (parent.isPresent()) {
            var location = locations.get(parent.get());
            result.add(location.widget());
            parent = location.parentId();
        }
        return result;
    }

    /**
     * Other children of the given widget's parent, in source order. Roots have no siblings.
     */
    public List<Widget> siblings(String id) {
        return location(id).flatMap(WidgetLocation::parentId)
                           .map(locations::get)
                           .map(parent -> parent.widget()
                                                .children()
                                                .stream()
                                                .filter(child -> !child.id().equals(id))
                                                .toList())
                           .orElse(List.of());
    }

    /**
     * Widget reached from root {@code rootIndex} by following child indexes.
     */
    public Optional<Widget> widgetAt(int rootIndex, List<Integer> indexPath) {
        if (rootIndex < 0 || rootIndex >= trees.size()) {
            return Optional.empty();
        }
        var current = trees.get(rootIndex).root();
        for (int index : indexPath) {
            if (index < 0 || index >= current.children().size()) {
                return Optional.empty();
            }
            current = current.children().get(index);
        }
        return Optional.of(current);
    }

    public List<Widget> findByType(String type) {
        return widgets(widget -> widget.type().equals(type));
    }

    public List<Widget> findByProperty(String name) {
        return widgets(widget -> widget.properties().containsKey(name));
    }

    public List<Widget> findByProperty(String name, PropertyValue value) {
        return widgets(widget -> widget.property(name).filter(value::equals).isPresent());
    }

    private List<Widget> widgets(Predicate<Widget> filter) {
        return locations.values()
                        .stream()
                        .map(WidgetLocation::widget)
                        .filter(filter)
                        .toList();
    }
}
