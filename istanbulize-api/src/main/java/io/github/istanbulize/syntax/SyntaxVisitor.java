package io.github.istanbulize.syntax;

import org.jetbrains.annotations.Nullable;

/** Callback for {@link SyntaxTree#traverse(SyntaxVisitor)}. */
@FunctionalInterface
public interface SyntaxVisitor {

    /**
     * Called once per node, parents before children.
     *
     * @param node the visited node
     * @param parent its parent, or null for the program
     */
    void enter(SyntaxNode node, @Nullable SyntaxNode parent);
}
