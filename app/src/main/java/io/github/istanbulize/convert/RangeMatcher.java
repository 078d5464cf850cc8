package io.github.istanbulize.convert;

import io.github.istanbulize.syntax.OffsetSpan;
import io.github.istanbulize.v8.RangeCov;
import java.util.List;

/** Resolves the hit count of a node from the ranges of the function it belongs to. */
public final class RangeMatcher {

    private RangeMatcher() {}

    /**
     * Returns the count of the innermost range enclosing {@code span}.
     *
     * <p>V8 lists the ranges of a function outer to inner, so the last enclosing range in list order is the innermost
     * one. That holds even when nested ranges share a boundary with their parent.
     *
     * @throws CoverageMismatchException of kind {@code COUNT_NOT_FOUND} if no range encloses the span
     */
    public static long matchCount(List<RangeCov> ranges, OffsetSpan span) {
        for (int i = ranges.size() - 1; i >= 0; i--) {
            var range = ranges.get(i);
            if (range.startOffset() <= span.start() && span.end() <= range.endOffset()) {
                return range.count();
            }
        }
        throw CoverageMismatchException.countNotFound(span);
    }
}
