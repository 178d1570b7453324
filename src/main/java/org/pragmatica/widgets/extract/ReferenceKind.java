package org.pragmatica.widgets.extract;

/**
 * What an opaque expression reference most likely points at.
 */
public enum ReferenceKind {
    /** {@code Theme.of(context).colorScheme.primary} and the like. */
    THEME,
    /** {@code Colors.blue}, {@code Colors.blue.shade100}, {@code CupertinoColors.systemRed}. */
    COLOR,
    /** {@code Type.member}: {@code MainAxisAlignment.center}, {@code Icons.add}, {@code FontWeight.bold}. */
    ENUM,
    /** A bare variable or constant name. */
    IDENTIFIER,
    /** Any other expression. */
    EXPRESSION
}
