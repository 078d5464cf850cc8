package io.github.istanbulize.syntax;

/** Classification of a syntax node, as far as coverage conversion cares about it. */
public enum NodeKind {
    /** The top-level program. Always the first node of a tree. */
    PROGRAM,
    /** Function expression, arrow function, method, getter or setter. */
    FUNCTION,
    /** A function that is also a declaration statement ({@code function f() {}}). */
    FUNCTION_DECLARATION,
    /** A braced statement list. Structural only, never counted. */
    BLOCK_STATEMENT,
    STATEMENT,
    OTHER
}
