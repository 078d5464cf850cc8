package io.github.istanbulize.v8;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import java.util.Objects;

/**
 * Coverage snapshot of one script ({@code Profiler.ScriptCoverage}). V8 lists the script-level function (the whole
 * script, empty name) first.
 */
@JsonPropertyOrder({"scriptId", "url", "functions"})
public record ScriptCov(
        @JsonProperty("scriptId") String scriptId,
        @JsonProperty("url") String url,
        @JsonProperty("functions") List<FunctionCov> functions) {

    public ScriptCov {
        Objects.requireNonNull(url, "url");
        scriptId = scriptId == null ? "0" : scriptId;
        functions = functions == null ? List.of() : List.copyOf(functions);
    }

    public ScriptCov withFunctions(List<FunctionCov> newFunctions) {
        return new ScriptCov(scriptId, url, newFunctions);
    }
}
