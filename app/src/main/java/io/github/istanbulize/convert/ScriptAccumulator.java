package io.github.istanbulize.convert;

import io.github.istanbulize.report.FileCoverage;
import io.github.istanbulize.syntax.JsParser;
import io.github.istanbulize.syntax.ScriptSource;
import io.github.istanbulize.syntax.SyntaxNode;
import io.github.istanbulize.syntax.SyntaxTree;
import io.github.istanbulize.v8.FunctionCov;
import io.github.istanbulize.v8.ScriptCov;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Accumulates V8 coverage snapshots of one script onto its syntax tree.
 *
 * <p>Construction walks the tree once, recording for every node its nearest enclosing root (function or program) and
 * registering every function and every countable statement with a count of zero. Each {@link #add(ScriptCov)} then
 * matches the snapshot's functions to roots and adds the resolved counts. Counts never decrease: a function that the
 * snapshot does not report leaves its own count and its statements' counts untouched.
 *
 * <p>Registration order is traversal order and fixes the order of the report, whatever snapshots are added.
 *
 * <p>Not thread-safe. Separate instances are independent.
 */
public final class ScriptAccumulator {
    private static final Logger logger = LogManager.getLogger(ScriptAccumulator.class);

    private final SyntaxTree tree;
    private final List<SyntaxNode> roots = new ArrayList<>();
    // node id -> id of its nearest enclosing root, -1 if none
    private final int[] rootIds;
    private final Map<SyntaxNode, Long> functionCounts = new LinkedHashMap<>();
    private final Map<SyntaxNode, String> functionNames = new HashMap<>();
    private final Map<SyntaxNode, Long> statementCounts = new LinkedHashMap<>();
    private @Nullable String path;

    public ScriptAccumulator(SyntaxTree tree) {
        this.tree = tree;
        this.rootIds = new int[tree.size()];
        Arrays.fill(rootIds, -1);

        tree.traverse((node, parent) -> {
            if (node.isRoot()) {
                roots.add(node);
                rootIds[node.id()] = node.id();
            } else if (parent != null) {
                rootIds[node.id()] = rootIds[parent.id()];
            }
            if (node.isFunction()) {
                functionCounts.put(node, 0L);
            }
            if (node.isStatement() && !(node.isBlockStatement() || node.isFunctionDeclaration())) {
                if (rootIds[node.id()] >= 0) {
                    statementCounts.put(node, 0L);
                } else {
                    logger.debug("Dropping statement {} without an enclosing root", node);
                }
            }
        });
    }

    /** Parses {@code source} with {@code parser} and builds an accumulator over the result. */
    public static ScriptAccumulator parse(ScriptSource source, JsParser parser) {
        return new ScriptAccumulator(parser.parse(source.sourceText(), source.sourceType()));
    }

    /**
     * Adds one coverage snapshot of the script. The call is all-or-nothing: every count is resolved before the first
     * one is updated.
     *
     * @throws CoverageMismatchException if a matched function has a statement no range encloses, or a matched root is
     *     not tracked
     */
    public void add(ScriptCov scriptCov) {
        var matches = FunctionMatcher.matchFunctions(roots, scriptCov.functions());

        var functionDeltas = new LinkedHashMap<SyntaxNode, FunctionCov>();
        for (var entry : matches.entrySet()) {
            var node = entry.getKey();
            if (node.isProgram()) {
                continue;
            }
            if (!functionCounts.containsKey(node)) {
                throw CoverageMismatchException.unknownNode(node);
            }
            functionDeltas.put(node, entry.getValue());
        }

        var statementDeltas = new LinkedHashMap<SyntaxNode, Long>();
        for (var statement : statementCounts.keySet()) {
            int rootId = rootIds[statement.id()];
            var functionCov = matches.get(tree.node(rootId));
            if (functionCov == null) {
                continue;
            }
            statementDeltas.put(statement, RangeMatcher.matchCount(functionCov.ranges(), statement.span()));
        }

        path = scriptCov.url();
        for (var entry : functionDeltas.entrySet()) {
            var functionCov = entry.getValue();
            var rootRange = functionCov.rootRange();
            long count = rootRange == null ? 0 : rootRange.count();
            functionCounts.merge(entry.getKey(), count, Long::sum);
            functionNames.put(entry.getKey(), functionCov.functionName());
        }
        statementDeltas.forEach((statement, count) -> statementCounts.merge(statement, count, Long::sum));

        logger.debug(
                "Added coverage of {}: {}/{} roots matched, {}/{} statements updated",
                scriptCov.url(),
                matches.size(),
                roots.size(),
                statementDeltas.size(),
                statementCounts.size());
    }

    /** Adds every snapshot in order. Stops at the first failing snapshot; earlier ones stay applied. */
    public void addAll(Iterable<ScriptCov> scriptCovs) {
        for (var scriptCov : scriptCovs) {
            add(scriptCov);
        }
    }

    public FileCoverage toReport() {
        return ReportBuilder.build(path == null ? "" : path, statementCounts, functionCounts, functionNames);
    }

    public SyntaxTree tree() {
        return tree;
    }

    /** URL of the last added snapshot, or null if none was added. */
    public @Nullable String path() {
        return path;
    }

    /** Functions and the program, in traversal order. */
    public List<SyntaxNode> roots() {
        return Collections.unmodifiableList(roots);
    }

    /** Tracked functions, in report order. */
    public List<SyntaxNode> functions() {
        return List.copyOf(functionCounts.keySet());
    }

    /** Tracked statements, in report order. */
    public List<SyntaxNode> statements() {
        return List.copyOf(statementCounts.keySet());
    }

    /** The nearest enclosing root of {@code node}, or null if it has none. */
    public @Nullable SyntaxNode rootOf(SyntaxNode node) {
        int rootId = rootIds[node.id()];
        return rootId < 0 ? null : tree.node(rootId);
    }

    public long functionCount(SyntaxNode function) {
        var count = functionCounts.get(function);
        if (count == null) {
            throw CoverageMismatchException.unknownNode(function);
        }
        return count;
    }

    public long statementCount(SyntaxNode statement) {
        var count = statementCounts.get(statement);
        if (count == null) {
            throw new IllegalArgumentException("Not a tracked statement: " + statement);
        }
        return count;
    }
}
