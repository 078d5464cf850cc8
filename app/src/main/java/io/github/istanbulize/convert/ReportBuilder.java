package io.github.istanbulize.convert;

import io.github.istanbulize.report.BranchMapping;
import io.github.istanbulize.report.FileCoverage;
import io.github.istanbulize.report.FunctionMapping;
import io.github.istanbulize.report.SourceLocation;
import io.github.istanbulize.syntax.SyntaxNode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders accumulated counts as Istanbul {@link FileCoverage}. Ids ({@code s0, s1, ...}, {@code f0, f1, ...}) follow
 * the iteration order of the count maps.
 */
final class ReportBuilder {

    private ReportBuilder() {}

    static FileCoverage build(
            String path,
            Map<SyntaxNode, Long> statementCounts,
            Map<SyntaxNode, Long> functionCounts,
            Map<SyntaxNode, String> functionNames) {
        var statementMap = new LinkedHashMap<String, SourceLocation>();
        var s = new LinkedHashMap<String, Long>();
        int i = 0;
        for (var entry : statementCounts.entrySet()) {
            var key = "s" + i++;
            statementMap.put(key, entry.getKey().location());
            s.put(key, entry.getValue());
        }

        var fnMap = new LinkedHashMap<String, FunctionMapping>();
        var f = new LinkedHashMap<String, Long>();
        i = 0;
        for (var entry : functionCounts.entrySet()) {
            var key = "f" + i++;
            var node = entry.getKey();
            fnMap.put(key, FunctionMapping.of(functionNames.getOrDefault(node, ""), node.location()));
            f.put(key, entry.getValue());
        }

        // Branch extraction is not implemented; the fields are part of the format and stay empty.
        Map<String, BranchMapping> branchMap = Map.of();
        Map<String, List<Long>> b = Map.of();

        return new FileCoverage(path, statementMap, s, fnMap, f, branchMap, b);
    }
}
