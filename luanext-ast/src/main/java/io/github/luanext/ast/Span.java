package io.github.luanext.ast;

/**
 * A region of source text, as byte offsets plus the line and column of its start.
 */
public final class Span {
    /**
     * A placeholder span, for synthesized nodes.
     */
    public static final Span DUMMY = new Span(0, 0, 0, 0);

    /**
     * The start offset, inclusive.
     */
    public final int start;
    /**
     * The end offset, exclusive.
     */
    public final int end;
    /**
     * The line of {@link #start}, 1-based.
     */
    public final int line;
    /**
     * The column of {@link #start}, 1-based.
     */
    public final int column;

    /**
     * Construct a span.
     *
     * @param start  The start offset.
     * @param end    The end offset.
     * @param line   The line of the start offset.
     * @param column The column of the start offset.
     */
    public Span(int start, int end, int line, int column) {
        this.start = start;
        this.end = end;
        this.line = line;
        this.column = column;
    }

    /**
     * Get whether this is an empty placeholder span.
     *
     * @return Whether this span is empty at offset 0.
     */
    public boolean isDummy() {
        return start == 0 && end == 0;
    }

    /**
     * Get the smallest span covering both this and {@code other}.
     * <p>
     * Merging with a {@link #isDummy() dummy} span returns the other span unchanged.
     *
     * @param other The other span.
     * @return The merged span.
     */
    public Span merge(Span other) {
        if (isDummy()) return other;
        if (other.isDummy()) return this;
        Span first = start <= other.start ? this : other;
        return new Span(first.start, Math.max(end, other.end), first.line, first.column);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Span span = (Span) o;
        return start == span.start && end == span.end && line == span.line && column == span.column;
    }

    @Override
    public int hashCode() {
        return ((start * 31 + end) * 31 + line) * 31 + column;
    }

    @Override
    public String toString() {
        return line + ":" + column + "[" + start + ".." + end + ")";
    }
}
