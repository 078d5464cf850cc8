package io.github.istanbulize.v8;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.github.istanbulize.syntax.OffsetSpan;

/**
 * Hit count of one offset range, as reported by V8's {@code Profiler.CoverageRange}. Offsets are UTF-16 code units,
 * {@code endOffset} exclusive.
 */
@JsonPropertyOrder({"startOffset", "endOffset", "count"})
public record RangeCov(
        @JsonProperty("startOffset") int startOffset,
        @JsonProperty("endOffset") int endOffset,
        @JsonProperty("count") long count) {

    public RangeCov {
        if (startOffset < 0 || endOffset < startOffset) {
            throw new IllegalArgumentException("Invalid range [" + startOffset + ", " + endOffset + ")");
        }
        if (count < 0) {
            throw new IllegalArgumentException("Negative count " + count + " for range [" + startOffset + ", "
                    + endOffset + ")");
        }
    }

    public OffsetSpan span() {
        return new OffsetSpan(startOffset, endOffset);
    }
}
