package io.github.istanbulize.convert;

import static org.junit.jupiter.api.Assertions.*;

import io.github.istanbulize.report.FileCoverage;
import io.github.istanbulize.syntax.SyntaxTree;
import io.github.istanbulize.testutil.TestTrees;
import io.github.istanbulize.v8.FunctionCov;
import io.github.istanbulize.v8.RangeCov;
import io.github.istanbulize.v8.ScriptCov;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class ScriptAccumulatorTest {

    private static final String URL = "file:///app/f.js";

    // function f(){1;2;}
    // 0         1
    // 012345678901234567
    private static final String SOURCE = "function f(){1;2;}";

    private static SyntaxTree functionTree() {
        var builder = TestTrees.script(SOURCE);
        int fn = builder.functionDeclaration(0, 0, 18);
        int block = builder.block(fn, 12, 18);
        builder.statement(block, 13, 15);
        builder.statement(block, 15, 17);
        return builder.build();
    }

    private static ScriptCov snapshot(FunctionCov... functions) {
        return new ScriptCov("1", URL, List.of(functions));
    }

    private static List<Long> counts(Map<String, Long> map) {
        return List.copyOf(map.values());
    }

    @Test
    void testFunctionWithNestedRanges() {
        var accumulator = new ScriptAccumulator(functionTree());

        accumulator.add(snapshot(FunctionCov.of("f", new RangeCov(0, 18, 3), new RangeCov(15, 17, 0))));

        var report = accumulator.toReport();
        assertEquals(URL, report.path());
        assertEquals(List.of(3L, 0L), counts(report.s()));
        assertEquals(List.of("s0", "s1"), List.copyOf(report.statementMap().keySet()));
        assertEquals(List.of(3L), counts(report.f()));
        assertEquals("f", report.fnMap().get("f0").name());
        assertEquals(1, report.fnMap().get("f0").line());
        assertTrue(report.branchMap().isEmpty());
        assertTrue(report.b().isEmpty());
    }

    @Test
    void testScriptEntryListedFirstDoesNotStealFunctionEntry() {
        var accumulator = new ScriptAccumulator(functionTree());

        accumulator.add(snapshot(
                FunctionCov.of("", new RangeCov(0, 18, 1)),
                FunctionCov.of("f", new RangeCov(0, 18, 3), new RangeCov(15, 17, 0))));

        var report = accumulator.toReport();
        assertEquals(List.of(3L, 0L), counts(report.s()));
        assertEquals(List.of(3L), counts(report.f()));
    }

    @Test
    void testSnapshotWithoutFunctionsLeavesCountsAtZero() {
        var accumulator = new ScriptAccumulator(functionTree());
        var function = accumulator.functions().get(0);

        accumulator.add(snapshot());

        assertEquals(0, accumulator.functionCount(function));
        for (var statement : accumulator.statements()) {
            assertEquals(0, accumulator.statementCount(statement));
        }
        assertEquals(URL, accumulator.path());
        assertEquals("", accumulator.toReport().fnMap().get("f0").name(), "Unreported functions have no name");
    }

    @Test
    void testSequentialAddsSumCounts() {
        var accumulator = new ScriptAccumulator(functionTree());
        var function = accumulator.functions().get(0);

        accumulator.add(snapshot(FunctionCov.of("f", new RangeCov(0, 18, 1))));
        accumulator.add(snapshot(FunctionCov.of("f", new RangeCov(0, 18, 1))));

        assertEquals(2, accumulator.functionCount(function));
        assertEquals(List.of(2L, 2L), counts(accumulator.toReport().s()));
    }

    @Test
    void testToReportIsIdempotent() {
        var accumulator = new ScriptAccumulator(functionTree());
        accumulator.add(snapshot(FunctionCov.of("f", new RangeCov(0, 18, 3), new RangeCov(15, 17, 0))));

        FileCoverage first = accumulator.toReport();
        FileCoverage second = accumulator.toReport();

        assertEquals(first, second);
    }

    @Test
    void testCountsNeverDecrease() {
        var accumulator = new ScriptAccumulator(functionTree());
        var snapshots = List.of(
                snapshot(FunctionCov.of("f", new RangeCov(0, 18, 2), new RangeCov(13, 15, 0))),
                snapshot(),
                snapshot(FunctionCov.of("f", new RangeCov(0, 18, 0))),
                snapshot(FunctionCov.of("", new RangeCov(0, 18, 1))),
                snapshot(FunctionCov.of("f", new RangeCov(0, 18, 5), new RangeCov(15, 17, 1))));

        var previous = new ArrayList<>(counts(accumulator.toReport().s()));
        previous.addAll(counts(accumulator.toReport().f()));
        for (var scriptCov : snapshots) {
            accumulator.add(scriptCov);
            var current = new ArrayList<>(counts(accumulator.toReport().s()));
            current.addAll(counts(accumulator.toReport().f()));
            for (int i = 0; i < current.size(); i++) {
                assertTrue(current.get(i) >= previous.get(i), "Count " + i + " decreased after " + scriptCov);
            }
            previous = current;
        }
        assertEquals(List.of(6L, 4L), counts(accumulator.toReport().s()));
    }

    @Test
    void testMergeEquivalence() {
        var a = snapshot(FunctionCov.of("f", new RangeCov(0, 18, 2), new RangeCov(13, 15, 1), new RangeCov(15, 17, 0)));
        var b = snapshot(FunctionCov.of("f", new RangeCov(0, 18, 4), new RangeCov(13, 15, 3), new RangeCov(15, 17, 2)));
        var summed =
                snapshot(FunctionCov.of("f", new RangeCov(0, 18, 6), new RangeCov(13, 15, 4), new RangeCov(15, 17, 2)));

        var sequential = new ScriptAccumulator(functionTree());
        sequential.add(a);
        sequential.add(b);

        var single = new ScriptAccumulator(functionTree());
        single.add(summed);

        assertEquals(single.toReport(), sequential.toReport());
        assertEquals(List.of(4L, 2L), counts(sequential.toReport().s()));
    }

    @Test
    void testIdsAreStableAcrossConstructionsAndAdds() {
        var untouched = new ScriptAccumulator(functionTree());
        var busy = new ScriptAccumulator(functionTree());
        busy.add(snapshot(FunctionCov.of("f", new RangeCov(0, 18, 1))));
        busy.add(snapshot());
        busy.add(snapshot(FunctionCov.of("f", new RangeCov(0, 18, 2), new RangeCov(13, 15, 0))));

        var expected = untouched.toReport();
        var actual = busy.toReport();
        assertEquals(expected.statementMap(), actual.statementMap());
        assertEquals(List.copyOf(expected.s().keySet()), List.copyOf(actual.s().keySet()));
        assertEquals(List.copyOf(expected.fnMap().keySet()), List.copyOf(actual.fnMap().keySet()));
        assertEquals(expected.fnMap().get("f0").loc(), actual.fnMap().get("f0").loc());
    }

    @Test
    void testInnermostRangeResolvesStatement() {
        var builder = TestTrees.script(" ".repeat(100));
        int fn = builder.function(0, 0, 100);
        int statement = builder.statement(fn, 12, 15);
        var accumulator = new ScriptAccumulator(builder.build());

        accumulator.add(snapshot(FunctionCov.of("g", new RangeCov(0, 100, 1), new RangeCov(10, 20, 5))));

        assertEquals(5, accumulator.statementCount(accumulator.tree().node(statement)));
        assertEquals(1, accumulator.functionCount(accumulator.tree().node(fn)));
    }

    @Test
    void testOverlappingEntryDoesNotMatch() {
        var builder = TestTrees.script(" ".repeat(60));
        int fn = builder.function(0, 10, 50);
        var accumulator = new ScriptAccumulator(builder.build());

        accumulator.add(snapshot(FunctionCov.of("g", new RangeCov(10, 51, 4))));

        assertEquals(0, accumulator.functionCount(accumulator.tree().node(fn)));
    }

    @Test
    void testUnmatchedRootKeepsStatementCounts() {
        // "a;function g(){b;}"
        var builder = TestTrees.script("a;function g(){b;}");
        int top = builder.statement(0, 0, 2);
        int fn = builder.functionDeclaration(0, 2, 18);
        int block = builder.block(fn, 14, 18);
        int inner = builder.statement(block, 15, 17);
        var accumulator = new ScriptAccumulator(builder.build());
        var tree = accumulator.tree();

        accumulator.add(
                snapshot(FunctionCov.of("", new RangeCov(0, 18, 1)), FunctionCov.of("g", new RangeCov(2, 18, 4))));
        // the second run only reports the script, g keeps its totals
        accumulator.add(snapshot(FunctionCov.of("", new RangeCov(0, 18, 1))));

        assertEquals(2, accumulator.statementCount(tree.node(top)));
        assertEquals(4, accumulator.statementCount(tree.node(inner)));
        assertEquals(4, accumulator.functionCount(tree.node(fn)));
    }

    @Test
    void testStatementsBelongToNearestRoot() {
        var builder = TestTrees.script("a;function g(){b;}");
        int top = builder.statement(0, 0, 2);
        int fn = builder.functionDeclaration(0, 2, 18);
        int block = builder.block(fn, 14, 18);
        int inner = builder.statement(block, 15, 17);
        var accumulator = new ScriptAccumulator(builder.build());
        var tree = accumulator.tree();

        assertEquals(tree.program(), accumulator.rootOf(tree.node(top)));
        assertEquals(tree.node(fn), accumulator.rootOf(tree.node(inner)));
        assertEquals(tree.node(fn), accumulator.rootOf(tree.node(fn)));
        assertEquals(List.of(tree.program(), tree.node(fn)), accumulator.roots());
        assertEquals(
                List.of(tree.node(top), tree.node(inner)),
                accumulator.statements(),
                "Blocks and declarations are not counted");
    }

    @Test
    void testFailingAddChangesNothing() {
        // the statement at [5, 15) sticks out of its function, so no range of the function can enclose it
        var builder = TestTrees.script(" ".repeat(40));
        int fn = builder.function(0, 0, 10);
        int statement = builder.statement(fn, 5, 15);
        int other = builder.function(0, 20, 30);
        var accumulator = new ScriptAccumulator(builder.build());
        var tree = accumulator.tree();

        accumulator.add(new ScriptCov("1", "first.js", List.of(FunctionCov.of("h", new RangeCov(20, 30, 2)))));
        var before = accumulator.toReport();

        var bad = new ScriptCov(
                "1",
                "second.js",
                List.of(FunctionCov.of("h", new RangeCov(20, 30, 7)), FunctionCov.of("g", new RangeCov(0, 10, 1))));
        var e = assertThrows(CoverageMismatchException.class, () -> accumulator.add(bad));

        assertEquals(CoverageMismatchException.Kind.COUNT_NOT_FOUND, e.kind());
        assertEquals(before, accumulator.toReport());
        assertEquals("first.js", accumulator.path());
        assertEquals(2, accumulator.functionCount(tree.node(other)));
        assertEquals(0, accumulator.functionCount(tree.node(fn)));
        assertEquals(0, accumulator.statementCount(tree.node(statement)));
    }

    @Test
    void testUnknownFunctionLookup() {
        var accumulator = new ScriptAccumulator(functionTree());
        var statement = accumulator.statements().get(0);

        var e = assertThrows(CoverageMismatchException.class, () -> accumulator.functionCount(statement));
        assertEquals(CoverageMismatchException.Kind.UNKNOWN_NODE, e.kind());
        assertThrows(IllegalArgumentException.class, () -> accumulator.statementCount(accumulator.functions().get(0)));
    }

    @Test
    void testReportBeforeAnyAdd() {
        var accumulator = new ScriptAccumulator(functionTree());

        var report = accumulator.toReport();

        assertNull(accumulator.path());
        assertEquals("", report.path());
        assertEquals(List.of(0L, 0L), counts(report.s()));
        assertEquals(List.of(0L), counts(report.f()));
    }

    @Test
    void testAddAllFoldsInOrder() {
        var accumulator = new ScriptAccumulator(functionTree());

        accumulator.addAll(List.of(
                new ScriptCov("1", "a.js", List.of(FunctionCov.of("f", new RangeCov(0, 18, 1)))),
                new ScriptCov("1", "b.js", List.of(FunctionCov.of("f", new RangeCov(0, 18, 2))))));

        assertEquals("b.js", accumulator.path());
        assertEquals(List.of(3L), counts(accumulator.toReport().f()));
    }
}
