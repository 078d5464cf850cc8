package io.github.istanbulize.parser;

import java.util.function.Predicate;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/** Recursive search helpers over TreeSitter nodes. */
public final class TreeSitterTraversalUtils {

    private TreeSitterTraversalUtils() {}

    /** Recursively finds the first node, in pre-order, matching the given predicate. */
    public static @Nullable TSNode findNodeRecursive(@Nullable TSNode rootNode, Predicate<TSNode> predicate) {
        if (rootNode == null || rootNode.isNull()) {
            return null;
        }

        if (predicate.test(rootNode)) {
            return rootNode;
        }

        for (int i = 0; i < rootNode.getChildCount(); i++) {
            var child = rootNode.getChild(i);
            if (child != null && !child.isNull()) {
                var result = findNodeRecursive(child, predicate);
                if (result != null) {
                    return result;
                }
            }
        }

        return null;
    }

    /** First ERROR or MISSING node below {@code rootNode}, or null if the tree parsed cleanly. */
    public static @Nullable TSNode findFirstError(TSNode rootNode) {
        if (!rootNode.hasError()) {
            return null;
        }
        return findNodeRecursive(
                rootNode, node -> JavaScriptTreeSitterNodeTypes.ERROR.equals(node.getType()) || node.isMissing());
    }

    /**
     * End byte of {@code node} ignoring a trailing {@code ;} token. Used for declarations in a {@code for} header,
     * whose grammar rule swallows the header separator.
     */
    public static int endByteWithoutSemicolon(TSNode node) {
        for (int i = node.getChildCount() - 1; i >= 0; i--) {
            var child = node.getChild(i);
            if (child == null || child.isNull()) {
                continue;
            }
            if (!JavaScriptTreeSitterNodeTypes.SEMICOLON.equals(child.getType())) {
                return child.getEndByte();
            }
        }
        return node.getEndByte();
    }

    /** True if {@code child} lies entirely before the {@code body} field of {@code parent}. */
    public static boolean precedesBody(TSNode parent, TSNode child) {
        var body = parent.getChildByFieldName(JavaScriptTreeSitterNodeTypes.BODY_FIELD);
        if (body == null || body.isNull()) {
            return false;
        }
        return child.getEndByte() <= body.getStartByte() && child.getStartByte() < body.getStartByte();
    }
}
