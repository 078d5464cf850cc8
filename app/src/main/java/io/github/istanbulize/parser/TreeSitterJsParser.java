package io.github.istanbulize.parser;

import static io.github.istanbulize.parser.JavaScriptTreeSitterNodeTypes.*;

import io.github.istanbulize.syntax.JsParser;
import io.github.istanbulize.syntax.NodeKind;
import io.github.istanbulize.syntax.OffsetSpan;
import io.github.istanbulize.syntax.SourceParseException;
import io.github.istanbulize.syntax.SourceType;
import io.github.istanbulize.syntax.SyntaxTree;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterJavascript;

/**
 * {@link JsParser} backed by the TreeSitter JavaScript grammar.
 *
 * <p>The TreeSitter tree is copied into a {@link SyntaxTree} arena and dropped, so the result holds no native state.
 * Offsets are converted from UTF-8 bytes to UTF-16 code units. Node classification follows ECMAScript statement
 * semantics rather than the grammar's: directive prologues are not statements, and neither are the test/update
 * clauses of a {@code for} header.
 *
 * <p>Instances are safe to share between threads; each thread gets its own TreeSitter parser.
 */
public final class TreeSitterJsParser implements JsParser {
    private static final Logger logger = LogManager.getLogger(TreeSitterJsParser.class);

    private final ThreadLocal<TSParser> threadLocalParser = ThreadLocal.withInitial(() -> {
        var parser = new TSParser();
        if (!parser.setLanguage(new TreeSitterJavascript())) {
            throw new IllegalStateException("Failed to set the JavaScript language on TSParser");
        }
        return parser;
    });

    @Override
    public SyntaxTree parse(String sourceText, SourceType sourceType) {
        long parseStart = System.nanoTime();
        var source = new SourceText(sourceText);
        TSTree tree = threadLocalParser.get().parseString(null, sourceText);
        TSNode rootNode = tree.getRootNode();
        if (rootNode.isNull()) {
            throw new SourceParseException("Parser produced no syntax tree", 1, 0);
        }

        var errorNode = TreeSitterTraversalUtils.findFirstError(rootNode);
        if (errorNode != null) {
            var position = source.position(source.charOffset(errorNode.getStartByte()));
            var message = errorNode.isMissing() ? "Missing " + errorNode.getType() : "Unexpected token";
            throw new SourceParseException(message, position.line(), position.column());
        }
        if (sourceType == SourceType.SCRIPT) {
            rejectModuleDeclarations(rootNode, source);
        }

        var builder = SyntaxTree.builder(sourceText, sourceType);
        var programSpan = new OffsetSpan(0, sourceText.length());
        int programId = builder.add(PROGRAM, NodeKind.PROGRAM, -1, programSpan, source.location(programSpan));

        Deque<PendingNode> stack = new ArrayDeque<>();
        pushChildren(stack, rootNode, programId, true);
        while (!stack.isEmpty()) {
            var pending = stack.pop();
            var span = source.spanOfBytes(pending.startByte(), pending.endByte());
            int id = builder.add(pending.type(), pending.kind(), pending.parentId(), span, source.location(span));
            var node = pending.node();
            if (node != null) {
                pushChildren(stack, node, id, isFunctionBody(pending.parentType(), node));
            }
        }

        var syntaxTree = builder.build();
        logger.debug(
                "Parsed {} characters into {} nodes in {} ms",
                sourceText.length(),
                syntaxTree.size(),
                (System.nanoTime() - parseStart) / 1_000_000);
        return syntaxTree;
    }

    /**
     * Classifies the named children of {@code node} and pushes them so that they are popped in source order.
     *
     * @param directiveScope whether {@code node} is a program or function body, where leading string literal
     *     statements form the directive prologue
     */
    private static void pushChildren(Deque<PendingNode> stack, TSNode node, int nodeId, boolean directiveScope) {
        var children = new ArrayList<PendingNode>();
        boolean inPrologue = directiveScope;
        boolean forHeader = FOR_STATEMENT.equals(node.getType());
        if (FOR_IN_STATEMENT.equals(node.getType())) {
            var declaration = forInDeclaration(node, nodeId);
            if (declaration != null) {
                children.add(declaration);
            }
        }
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            var child = node.getNamedChild(i);
            if (child == null || child.isNull() || EXTRA_TYPES.contains(child.getType())) {
                continue;
            }
            var type = child.getType();
            var kind = classify(type);
            int endByte = child.getEndByte();

            if (inPrologue && isDirective(child)) {
                kind = NodeKind.OTHER;
            } else {
                inPrologue = false;
                if (forHeader && TreeSitterTraversalUtils.precedesBody(node, child)) {
                    if (DECLARATION_TYPES.contains(type)) {
                        endByte = TreeSitterTraversalUtils.endByteWithoutSemicolon(child);
                    } else if (kind == NodeKind.STATEMENT) {
                        kind = NodeKind.OTHER;
                    }
                }
            }
            children.add(new PendingNode(child, type, node.getType(), nodeId, kind, child.getStartByte(), endByte));
        }
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(children.get(i));
        }
    }

    /**
     * The declaration in a {@code for (const x of y)} or {@code for (var k in o)} head. The grammar keeps its keyword
     * and binding as loose fields of the loop, so the node is synthesized from {@code kind} up to the binding or its
     * initializer.
     */
    private static @Nullable PendingNode forInDeclaration(TSNode forIn, int forInId) {
        var kindToken = forIn.getChildByFieldName(KIND_FIELD);
        var left = forIn.getChildByFieldName(LEFT_FIELD);
        if (kindToken == null || kindToken.isNull() || left == null || left.isNull()) {
            return null;
        }
        var value = forIn.getChildByFieldName(VALUE_FIELD);
        int endByte = value == null || value.isNull() ? left.getEndByte() : value.getEndByte();
        var type = VAR_KEYWORD.equals(kindToken.getType()) ? VARIABLE_DECLARATION : LEXICAL_DECLARATION;
        return new PendingNode(
                null, type, forIn.getType(), forInId, NodeKind.STATEMENT, kindToken.getStartByte(), endByte);
    }

    static NodeKind classify(String type) {
        if (FUNCTION_DECLARATION_TYPES.contains(type)) {
            return NodeKind.FUNCTION_DECLARATION;
        }
        if (FUNCTION_EXPRESSION_TYPES.contains(type)) {
            return NodeKind.FUNCTION;
        }
        if (STATEMENT_BLOCK.equals(type)) {
            return NodeKind.BLOCK_STATEMENT;
        }
        if (STATEMENT_TYPES.contains(type)) {
            return NodeKind.STATEMENT;
        }
        return NodeKind.OTHER;
    }

    private static boolean isFunctionBody(String parentType, TSNode node) {
        return STATEMENT_BLOCK.equals(node.getType())
                && (FUNCTION_DECLARATION_TYPES.contains(parentType) || FUNCTION_EXPRESSION_TYPES.contains(parentType));
    }

    // A directive is an expression statement made of a single string literal, e.g. "use strict";
    private static boolean isDirective(TSNode node) {
        if (!EXPRESSION_STATEMENT.equals(node.getType()) || node.getNamedChildCount() != 1) {
            return false;
        }
        var expression = node.getNamedChild(0);
        return expression != null && !expression.isNull() && STRING.equals(expression.getType());
    }

    private static void rejectModuleDeclarations(TSNode rootNode, SourceText source) {
        for (int i = 0; i < rootNode.getNamedChildCount(); i++) {
            var child = rootNode.getNamedChild(i);
            if (child == null || child.isNull()) {
                continue;
            }
            if (IMPORT_STATEMENT.equals(child.getType()) || EXPORT_STATEMENT.equals(child.getType())) {
                var position = source.position(source.charOffset(child.getStartByte()));
                throw new SourceParseException(
                        "'import' and 'export' may appear only with sourceType: module",
                        position.line(),
                        position.column());
            }
        }
    }

    // node is null for declarations synthesized from a for-in/of head
    private record PendingNode(
            @Nullable TSNode node,
            String type,
            String parentType,
            int parentId,
            NodeKind kind,
            int startByte,
            int endByte) {}
}
