package io.github.istanbulize.report;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Start and end {@link Position} of a node, end exclusive. */
public record SourceLocation(@JsonProperty("start") Position start, @JsonProperty("end") Position end) {

    public static SourceLocation of(int startLine, int startColumn, int endLine, int endColumn) {
        return new SourceLocation(new Position(startLine, startColumn), new Position(endLine, endColumn));
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
