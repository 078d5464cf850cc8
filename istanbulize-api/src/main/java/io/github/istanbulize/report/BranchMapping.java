package io.github.istanbulize.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/**
 * Entry of {@link FileCoverage#branchMap()}. Branch extraction is not performed yet, so reports never contain one; the
 * type fixes the shape of the reserved field.
 *
 * @param type Istanbul branch type, e.g. {@code cond-expr} or {@code if}
 * @param line first line of the branching construct
 * @param loc location of the branching construct
 * @param locations one location per branch, in the order of the counts in {@link FileCoverage#b()}
 */
@JsonPropertyOrder({"type", "line", "loc", "locations"})
public record BranchMapping(
        @JsonProperty("type") String type,
        @JsonProperty("line") int line,
        @JsonProperty("loc") SourceLocation loc,
        @JsonProperty("locations") List<SourceLocation> locations) {

    public BranchMapping {
        locations = List.copyOf(locations);
    }
}
