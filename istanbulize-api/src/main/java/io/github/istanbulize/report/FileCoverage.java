package io.github.istanbulize.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Istanbul file coverage for one script. Keys of {@code statementMap}/{@code s} are {@code s0, s1, ...}, keys of
 * {@code fnMap}/{@code f} are {@code f0, f1, ...}; map iteration follows key order.
 */
@JsonPropertyOrder({"path", "statementMap", "s", "fnMap", "f", "branchMap", "b"})
public record FileCoverage(
        @JsonProperty("path") String path,
        @JsonProperty("statementMap") Map<String, SourceLocation> statementMap,
        @JsonProperty("s") Map<String, Long> s,
        @JsonProperty("fnMap") Map<String, FunctionMapping> fnMap,
        @JsonProperty("f") Map<String, Long> f,
        @JsonProperty("branchMap") Map<String, BranchMapping> branchMap,
        @JsonProperty("b") Map<String, List<Long>> b) {

    public FileCoverage {
        statementMap = ordered(statementMap);
        s = ordered(s);
        fnMap = ordered(fnMap);
        f = ordered(f);
        branchMap = ordered(branchMap);
        b = ordered(b);
        if (!statementMap.keySet().equals(s.keySet())) {
            throw new IllegalArgumentException("statementMap and s must have the same keys");
        }
        if (!fnMap.keySet().equals(f.keySet())) {
            throw new IllegalArgumentException("fnMap and f must have the same keys");
        }
        if (!branchMap.keySet().equals(b.keySet())) {
            throw new IllegalArgumentException("branchMap and b must have the same keys");
        }
    }

    private static <V> Map<String, V> ordered(Map<String, V> map) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
