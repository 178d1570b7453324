package org.pragmatica.widgets.tree;

/**
 * A position in widget source text. Line and column are 1-based, offset is 0-based.
 */
public record SourceLocation(int line, int column, int offset) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0);

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    public boolean isAfter(SourceLocation other) {
        return offset > other.offset;
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
