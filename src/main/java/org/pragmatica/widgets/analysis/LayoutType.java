package org.pragmatica.widgets.analysis;

/**
 * How a widget arranges its children.
 */
public enum LayoutType {
    ROW,
    COLUMN,
    /** Row, column or {@code Flex} with at least one {@code Expanded} or {@code Flexible} child. */
    FLEX,
    STACK,
    WRAP,
    GRID,
    SCROLL,
    SINGLE_CHILD,
    NONE
}
