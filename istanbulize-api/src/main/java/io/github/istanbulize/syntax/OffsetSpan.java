package io.github.istanbulize.syntax;

/**
 * Half-open span {@code [start, end)} of UTF-16 code unit offsets into a source text. This is the unit V8 reports
 * coverage ranges in, and the unit of Java string indices.
 */
public record OffsetSpan(int start, int end) {

    public OffsetSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    /** True if {@code other} lies within this span (shared boundaries included). */
    public boolean encloses(OffsetSpan other) {
        return start <= other.start && other.end <= end;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
