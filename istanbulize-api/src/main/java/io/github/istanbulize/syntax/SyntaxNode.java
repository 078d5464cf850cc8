package io.github.istanbulize.syntax;

import io.github.istanbulize.report.SourceLocation;

/**
 * One node of a {@link SyntaxTree}. Nodes are addressed by their pre-order index ({@code id}) inside the tree that
 * produced them; {@code parentId} is {@code -1} for the program.
 *
 * @param id pre-order index within the owning tree
 * @param type grammar node type, e.g. {@code function_declaration}
 * @param kind coverage classification
 * @param parentId id of the parent node, or -1
 * @param span UTF-16 offset span
 * @param location line/column span (1-based lines, 0-based columns)
 */
public record SyntaxNode(int id, String type, NodeKind kind, int parentId, OffsetSpan span, SourceLocation location) {

    public boolean isProgram() {
        return kind == NodeKind.PROGRAM;
    }

    public boolean isFunction() {
        return kind == NodeKind.FUNCTION || kind == NodeKind.FUNCTION_DECLARATION;
    }

    public boolean isFunctionDeclaration() {
        return kind == NodeKind.FUNCTION_DECLARATION;
    }

    public boolean isBlockStatement() {
        return kind == NodeKind.BLOCK_STATEMENT;
    }

    public boolean isStatement() {
        return kind == NodeKind.STATEMENT || kind == NodeKind.BLOCK_STATEMENT || kind == NodeKind.FUNCTION_DECLARATION;
    }

    /** A function or the program: the unit V8 reports a function coverage entry for. */
    public boolean isRoot() {
        return isProgram() || isFunction();
    }

    @Override
    public String toString() {
        return type + "#" + id + span;
    }
}
