package io.github.istanbulize.syntax;

import io.github.istanbulize.report.SourceLocation;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Read-only syntax tree stored as an arena of {@link SyntaxNode}s in pre-order. Node ids are indices into that arena,
 * so a parent always has a smaller id than its children and a plain forward scan is a depth-first traversal.
 *
 * <p>Trees are built through {@link #builder(String, SourceType)}; the first node added must be the program.
 */
public final class SyntaxTree {
    private final String sourceText;
    private final SourceType sourceType;
    private final List<SyntaxNode> nodes;

    private SyntaxTree(String sourceText, SourceType sourceType, List<SyntaxNode> nodes) {
        this.sourceText = sourceText;
        this.sourceType = sourceType;
        this.nodes = Collections.unmodifiableList(nodes);
    }

    public static Builder builder(String sourceText, SourceType sourceType) {
        return new Builder(sourceText, sourceType);
    }

    public String sourceText() {
        return sourceText;
    }

    public SourceType sourceType() {
        return sourceType;
    }

    public SyntaxNode program() {
        return nodes.get(0);
    }

    public SyntaxNode node(int id) {
        return nodes.get(id);
    }

    public @Nullable SyntaxNode parent(SyntaxNode node) {
        return node.parentId() < 0 ? null : nodes.get(node.parentId());
    }

    /** All nodes, in pre-order. */
    public List<SyntaxNode> nodes() {
        return nodes;
    }

    public int size() {
        return nodes.size();
    }

    /** Visits every node, parents before children, in source order. */
    public void traverse(SyntaxVisitor visitor) {
        for (var node : nodes) {
            visitor.enter(node, parent(node));
        }
    }

    public static final class Builder {
        private final String sourceText;
        private final SourceType sourceType;
        private final List<SyntaxNode> nodes = new ArrayList<>();
        private boolean built;

        private Builder(String sourceText, SourceType sourceType) {
            this.sourceText = sourceText;
            this.sourceType = sourceType;
        }

        /**
         * Appends a node. Nodes must be added in pre-order: the parent has to be added already.
         *
         * @return the id of the new node
         */
        public int add(String type, NodeKind kind, int parentId, OffsetSpan span, SourceLocation location) {
            if (built) {
                throw new IllegalStateException("Tree already built");
            }
            int id = nodes.size();
            if (id == 0) {
                if (kind != NodeKind.PROGRAM || parentId != -1) {
                    throw new IllegalArgumentException("The first node must be a program without a parent");
                }
            } else {
                if (kind == NodeKind.PROGRAM) {
                    throw new IllegalArgumentException("Only the first node may be a program");
                }
                if (parentId < 0 || parentId >= id) {
                    throw new IllegalArgumentException(
                            "Parent " + parentId + " of node " + id + " (" + type + ") has not been added yet");
                }
            }
            if (span.end() > sourceText.length()) {
                throw new IllegalArgumentException(
                        "Span " + span + " of " + type + " exceeds source length " + sourceText.length());
            }
            nodes.add(new SyntaxNode(id, type, kind, parentId, span, location));
            return id;
        }

        public SyntaxTree build() {
            if (nodes.isEmpty()) {
                throw new IllegalStateException("A syntax tree needs at least a program node");
            }
            built = true;
            return new SyntaxTree(sourceText, sourceType, nodes);
        }
    }
}
