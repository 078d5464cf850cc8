package io.github.istanbulize.v8;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * Coverage of one function ({@code Profiler.FunctionCoverage}). The first range spans the whole function and carries
 * its invocation count; the following ranges refine counts for nested blocks.
 */
@JsonPropertyOrder({"functionName", "ranges", "isBlockCoverage"})
public record FunctionCov(
        @JsonProperty("functionName") String functionName,
        @JsonProperty("ranges") List<RangeCov> ranges,
        @JsonProperty("isBlockCoverage") boolean isBlockCoverage) {

    public FunctionCov {
        Objects.requireNonNull(functionName, "functionName");
        ranges = ranges == null ? List.of() : List.copyOf(ranges);
    }

    public static FunctionCov of(String functionName, RangeCov... ranges) {
        return new FunctionCov(functionName, List.of(ranges), ranges.length > 1);
    }

    /** The range spanning the whole function, or null for a malformed entry without ranges. */
    public @Nullable RangeCov rootRange() {
        return ranges.isEmpty() ? null : ranges.get(0);
    }
}
