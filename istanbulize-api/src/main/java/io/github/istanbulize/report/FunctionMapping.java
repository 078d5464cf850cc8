package io.github.istanbulize.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Entry of {@link FileCoverage#fnMap()}.
 *
 * @param name function name as last reported by the engine, empty if never reported
 * @param decl location of the declaration
 * @param loc location of the whole function
 * @param line first line of the function
 */
@JsonPropertyOrder({"name", "decl", "loc", "line"})
public record FunctionMapping(
        @JsonProperty("name") String name,
        @JsonProperty("decl") SourceLocation decl,
        @JsonProperty("loc") SourceLocation loc,
        @JsonProperty("line") int line) {

    public static FunctionMapping of(String name, SourceLocation loc) {
        return new FunctionMapping(name, loc, loc, loc.start().line());
    }
}
