package org.pragmatica.widgets.tree;

/**
 * A range in widget source text from start (inclusive) to end (exclusive).
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    public static final SourceSpan EMPTY = new SourceSpan(SourceLocation.START, SourceLocation.START);

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location);
    }

    /**
     * Span running from the start of this span to the end of {@code other}.
     */
    public SourceSpan to(SourceSpan other) {
        return new SourceSpan(start, other.end);
    }

    public int length() {
        return end.offset() - start.offset();
    }

    public boolean isEmpty() {
        return length() == 0;
    }

    public boolean contains(SourceSpan other) {
        return start.offset() <= other.start.offset() && end.offset() >= other.end.offset();
    }

    public String extract(String source) {
        return source.substring(start.offset(), Math.min(end.offset(), source.length()));
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
