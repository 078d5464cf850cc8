package io.github.istanbulize.convert;

import io.github.istanbulize.syntax.OffsetSpan;
import io.github.istanbulize.syntax.SyntaxNode;

/**
 * The coverage data does not fit the parsed syntax tree. Raised by {@link ScriptAccumulator#add} before any state is
 * changed, so the accumulator keeps the totals of the previous snapshots.
 */
public class CoverageMismatchException extends RuntimeException {

    public enum Kind {
        /** No range of a matched function encloses one of its statements. */
        COUNT_NOT_FOUND,
        /** A matched function root was never registered while building the accumulator. */
        UNKNOWN_NODE
    }

    private final Kind kind;

    public CoverageMismatchException(Kind kind, String message) {
        super(kind + ": " + message);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    static CoverageMismatchException countNotFound(OffsetSpan span) {
        return new CoverageMismatchException(Kind.COUNT_NOT_FOUND, "no coverage range encloses " + span);
    }

    static CoverageMismatchException unknownNode(SyntaxNode node) {
        return new CoverageMismatchException(Kind.UNKNOWN_NODE, "function " + node + " is not tracked");
    }
}
