package io.github.istanbulize.parser;

import java.util.Set;

/** Constants for JavaScript TreeSitter node type names. */
public final class JavaScriptTreeSitterNodeTypes {

    // ===== ROOTS =====
    public static final String PROGRAM = "program";

    // Function-like declarations (statements)
    public static final String FUNCTION_DECLARATION = "function_declaration";
    public static final String GENERATOR_FUNCTION_DECLARATION = "generator_function_declaration";

    // Function-like expressions
    public static final String FUNCTION_EXPRESSION = "function_expression";
    // Name used for function expressions by grammar versions before 0.21
    public static final String FUNCTION = "function";
    public static final String GENERATOR_FUNCTION = "generator_function";
    public static final String ARROW_FUNCTION = "arrow_function";
    public static final String METHOD_DEFINITION = "method_definition";

    // ===== STATEMENTS =====
    public static final String STATEMENT_BLOCK = "statement_block";
    public static final String EXPRESSION_STATEMENT = "expression_statement";
    public static final String VARIABLE_DECLARATION = "variable_declaration";
    public static final String LEXICAL_DECLARATION = "lexical_declaration";
    public static final String IF_STATEMENT = "if_statement";
    public static final String FOR_STATEMENT = "for_statement";
    public static final String FOR_IN_STATEMENT = "for_in_statement";
    public static final String WHILE_STATEMENT = "while_statement";
    public static final String DO_STATEMENT = "do_statement";
    public static final String RETURN_STATEMENT = "return_statement";
    public static final String THROW_STATEMENT = "throw_statement";
    public static final String TRY_STATEMENT = "try_statement";
    public static final String SWITCH_STATEMENT = "switch_statement";
    public static final String BREAK_STATEMENT = "break_statement";
    public static final String CONTINUE_STATEMENT = "continue_statement";
    public static final String LABELED_STATEMENT = "labeled_statement";
    public static final String EMPTY_STATEMENT = "empty_statement";
    public static final String DEBUGGER_STATEMENT = "debugger_statement";
    public static final String WITH_STATEMENT = "with_statement";
    public static final String CLASS_DECLARATION = "class_declaration";
    public static final String IMPORT_STATEMENT = "import_statement";
    public static final String EXPORT_STATEMENT = "export_statement";

    // ===== OTHERS =====
    public static final String STRING = "string";
    public static final String COMMENT = "comment";
    public static final String HASH_BANG_LINE = "hash_bang_line";
    public static final String ERROR = "ERROR";
    public static final String SEMICOLON = ";";

    public static final String BODY_FIELD = "body";
    public static final String KIND_FIELD = "kind";
    public static final String LEFT_FIELD = "left";
    public static final String VALUE_FIELD = "value";
    public static final String VAR_KEYWORD = "var";

    public static final Set<String> FUNCTION_DECLARATION_TYPES =
            Set.of(FUNCTION_DECLARATION, GENERATOR_FUNCTION_DECLARATION);

    public static final Set<String> FUNCTION_EXPRESSION_TYPES =
            Set.of(FUNCTION_EXPRESSION, FUNCTION, GENERATOR_FUNCTION, ARROW_FUNCTION, METHOD_DEFINITION);

    /** Countable statements. Blocks and function declarations are classified separately. */
    public static final Set<String> STATEMENT_TYPES = Set.of(
            EXPRESSION_STATEMENT,
            VARIABLE_DECLARATION,
            LEXICAL_DECLARATION,
            IF_STATEMENT,
            FOR_STATEMENT,
            FOR_IN_STATEMENT,
            WHILE_STATEMENT,
            DO_STATEMENT,
            RETURN_STATEMENT,
            THROW_STATEMENT,
            TRY_STATEMENT,
            SWITCH_STATEMENT,
            BREAK_STATEMENT,
            CONTINUE_STATEMENT,
            LABELED_STATEMENT,
            EMPTY_STATEMENT,
            DEBUGGER_STATEMENT,
            WITH_STATEMENT,
            CLASS_DECLARATION,
            IMPORT_STATEMENT,
            EXPORT_STATEMENT);

    public static final Set<String> DECLARATION_TYPES = Set.of(VARIABLE_DECLARATION, LEXICAL_DECLARATION);

    /** Nodes that carry no syntax of their own and are left out of the tree. */
    public static final Set<String> EXTRA_TYPES = Set.of(COMMENT, HASH_BANG_LINE);

    private JavaScriptTreeSitterNodeTypes() {}
}
