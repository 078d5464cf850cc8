package io.github.istanbulize.v8;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Coverage of a whole process: the {@code {"result": [...]}} document Node writes to {@code NODE_V8_COVERAGE}. */
public record ProcessCov(@JsonProperty("result") List<ScriptCov> result) {

    public ProcessCov {
        result = result == null ? List.of() : List.copyOf(result);
    }
}
