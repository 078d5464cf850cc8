package io.github.istanbulize.convert;

import io.github.istanbulize.syntax.SyntaxNode;
import io.github.istanbulize.v8.FunctionCov;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Pairs syntactic roots with V8 function coverage entries. A root matches an entry only if the entry's first range has
 * exactly the root's span; each entry is used at most once.
 */
public final class FunctionMatcher {
    private static final Logger logger = LogManager.getLogger(FunctionMatcher.class);

    private FunctionMatcher() {}

    /**
     * Function roots are matched in the given (traversal) order, the program last. For each root the remaining entries
     * are scanned from last to first. The program is deferred because V8 lists the script-level entry first: a function
     * spanning the whole script must take its own entry, not the script's.
     *
     * @return matched roots in matching order; roots without an entry are absent
     */
    public static Map<SyntaxNode, FunctionCov> matchFunctions(
            Collection<SyntaxNode> roots, List<FunctionCov> functions) {
        var remaining = new ArrayList<>(functions);
        var matched = new LinkedHashMap<SyntaxNode, FunctionCov>();

        var ordered = new ArrayList<SyntaxNode>(roots.size());
        for (var root : roots) {
            if (!root.isProgram()) {
                ordered.add(root);
            }
        }
        for (var root : roots) {
            if (root.isProgram()) {
                ordered.add(root);
            }
        }

        for (var root : ordered) {
            int matchedIndex = -1;
            for (int i = remaining.size() - 1; i >= 0; i--) {
                var rootRange = remaining.get(i).rootRange();
                if (rootRange != null
                        && rootRange.startOffset() == root.span().start()
                        && rootRange.endOffset() == root.span().end()) {
                    matchedIndex = i;
                    break;
                }
            }
            if (matchedIndex >= 0) {
                matched.put(root, remaining.remove(matchedIndex));
            }
        }

        if (!remaining.isEmpty() && logger.isDebugEnabled()) {
            logger.debug(
                    "Discarding {} function coverage entries without a matching syntax node: {}",
                    remaining.size(),
                    remaining.stream().map(FunctionMatcher::describe).toList());
        }
        return matched;
    }

    private static String describe(FunctionCov function) {
        var name = function.functionName().isEmpty() ? "(anonymous)" : function.functionName();
        var rootRange = function.rootRange();
        return rootRange == null ? name : name + rootRange.span();
    }
}
