package org.pragmatica.widgets.analysis;

import org.pragmatica.widgets.analysis.TreeAnalysis.TreeStats;
import org.pragmatica.widgets.extract.Widget;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

/**
 * Computes depth, size and per-widget locations of extracted widget trees.
 *
 * <p>Traversal uses an explicit stack, so arbitrarily deep trees are safe.
 */
public final class WidgetTreeAnalyzer {

    private WidgetTreeAnalyzer() {
    }

    public static TreeAnalysis analyze(Widget root) {
        return analyze(List.of(root));
    }

    public static TreeAnalysis analyze(List<Widget> roots) {
        var trees = new ArrayList<TreeStats>();
        var locations = new LinkedHashMap<String, WidgetLocation>();

        for (var root : roots) {
            int maxDepth = 0;
            int count = 0;
            var stack = new ArrayDeque<WidgetLocation>();
            stack.push(new WidgetLocation(root, Optional.empty(), List.of(), List.of(root.type()), 0));

            while (!stack.isEmpty()) {
                var location = stack.pop();
                var widget = location.widget();
                locations.put(widget.id(), location);
                count++;
                maxDepth = Math.max(maxDepth, location.depth());

                for (int i = widget.children().size() - 1; i >= 0; i--) {
                    stack.push(childLocation(location, i));
                }
            }
            trees.add(new TreeStats(root, maxDepth + 1, count));
        }
        return new TreeAnalysis(trees, locations);
    }

    private static WidgetLocation childLocation(WidgetLocation parent, int index) {
        var child = parent.widget().children().get(index);
        var indexPath = new ArrayList<>(parent.indexPath());
        indexPath.add(index);
        var typePath = new ArrayList<>(parent.typePath());
        typePath.add(child.type());
        return new WidgetLocation(child, Optional.of(parent.widget().id()), indexPath, typePath, parent.depth() + 1);
    }
}
