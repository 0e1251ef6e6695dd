package org.pragmatica.dvrtl.tree;

/**
 * A range in source text from start (inclusive) to end (exclusive).
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    /**
     * Span used for trees that were not built from source text.
     */
    public static final SourceSpan SYNTHETIC = at(SourceLocation.START);

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location);
    }

    public int length() {
        return end.offset() - start.offset();
    }

    public String extract(String source) {
        return source.substring(start.offset(), end.offset());
    }

    public SourceSpan merge(SourceSpan other) {
        var newStart = start.isBefore(other.start) ? start : other.start;
        var newEnd = other.end.isBefore(end) ? end : other.end;
        return new SourceSpan(newStart, newEnd);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
