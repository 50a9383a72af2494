package org.tricoteuses.amendment.tree;

/**
 * A range in source text from start (inclusive) to stop (exclusive), as 0-based char offsets.
 */
public record SourceSpan(int start, int stop) {

    public SourceSpan {
        if (start < 0 || stop < start) {
            throw new IllegalArgumentException("Invalid span " + start + "-" + stop);
        }
    }

    public static SourceSpan of(int start, int stop) {
        return new SourceSpan(start, stop);
    }

    public static SourceSpan at(int offset) {
        return new SourceSpan(offset, offset);
    }

    public int length() {
        return stop - start;
    }

    public boolean isEmpty() {
        return start == stop;
    }

    public boolean contains(SourceSpan other) {
        return start <= other.start && other.stop <= stop;
    }

    public String extract(String source) {
        return source.substring(start, stop);
    }

    /**
     * Smallest span covering both spans.
     */
    public SourceSpan merge(SourceSpan other) {
        return new SourceSpan(Math.min(start, other.start), Math.max(stop, other.stop));
    }

    public SourceSpan shift(int delta) {
        return new SourceSpan(start + delta, stop + delta);
    }

    @Override
    public String toString() {
        return start + "-" + stop;
    }
}
