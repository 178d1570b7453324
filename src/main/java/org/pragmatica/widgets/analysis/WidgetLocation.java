package org.pragmatica.widgets.analysis;

import org.pragmatica.widgets.extract.Widget;

import java.util.List;
import java.util.Optional;

/**
 * Position of one widget inside its tree.
 *
 * @param widget    the widget
 * @param parentId  id of the enclosing widget, empty for a root
 * @param indexPath child indexes from the root down to this widget, empty for a root
 * @param typePath  widget types from the root down to this widget, both included
 * @param depth     0 for a root
 */
public record WidgetLocation(
    Widget widget,
    Optional<String> parentId,
    List<Integer> indexPath,
    List<String> typePath,
    int depth
) {
    public WidgetLocation {
        indexPath = List.copyOf(indexPath);
        typePath = List.copyOf(typePath);
    }

    public boolean isRoot() {
        return parentId.isEmpty();
    }

    /**
     * Index among the parent's children, 0 for a root.
     */
    public int siblingIndex() {
        return indexPath.isEmpty() ? 0 : indexPath.get(indexPath.size() - 1);
    }

    /**
     * Type path rendered as {@code Scaffold > Column > Text}.
     */
    public String describe() {
        return String.join(" > ", typePath);
    }
}
