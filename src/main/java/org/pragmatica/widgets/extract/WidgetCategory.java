package org.pragmatica.widgets.extract;

/**
 * Coarse classification of widget kinds, used by layout analysis and downstream node creation.
 */
public enum WidgetCategory {
    /** Lays out a list of children. */
    LAYOUT,
    /** Wraps a single child. */
    CONTAINER,
    TEXT,
    ICON,
    IMAGE,
    BUTTON,
    INPUT,
    /** Application and page scaffolding, bars, drawers, tiles. */
    NAVIGATION,
    /** Leaf visuals without content of their own: dividers, spacers, indicators. */
    DISPLAY,
    /** Placeholder for a constructor the catalog does not know. */
    UNKNOWN;

    public boolean holdsChildren() {
        return this == LAYOUT || this == CONTAINER || this == NAVIGATION || this == BUTTON;
    }
}
