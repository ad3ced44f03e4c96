package com.repo.codepath.tree;

import java.util.Set;

/**
 * Node kinds of the tree-sitter JavaScript grammar that the analyzer and the
 * rules look at.
 */
public final class NodeKinds {

    private NodeKinds() {
    }

    public static final String PROGRAM = "program";
    public static final String COMMENT = "comment";

    // Units
    public static final String FUNCTION_DECLARATION = "function_declaration";
    public static final String GENERATOR_FUNCTION_DECLARATION = "generator_function_declaration";
    public static final String FUNCTION = "function";
    public static final String FUNCTION_EXPRESSION = "function_expression";
    public static final String GENERATOR_FUNCTION = "generator_function";
    public static final String ARROW_FUNCTION = "arrow_function";
    public static final String METHOD_DEFINITION = "method_definition";
    public static final String CLASS_STATIC_BLOCK = "class_static_block";
    public static final String FIELD_DEFINITION = "field_definition";
    public static final String CLASS_DECLARATION = "class_declaration";
    public static final String CLASS = "class";
    public static final String PAIR = "pair";
    public static final String PAIR_PATTERN = "pair_pattern";
    public static final String VARIABLE_DECLARATOR = "variable_declarator";

    // Statements
    public static final String STATEMENT_BLOCK = "statement_block";
    public static final String EXPRESSION_STATEMENT = "expression_statement";
    public static final String EMPTY_STATEMENT = "empty_statement";
    public static final String IF_STATEMENT = "if_statement";
    public static final String ELSE_CLAUSE = "else_clause";
    public static final String SWITCH_STATEMENT = "switch_statement";
    public static final String SWITCH_BODY = "switch_body";
    public static final String SWITCH_CASE = "switch_case";
    public static final String SWITCH_DEFAULT = "switch_default";
    public static final String TRY_STATEMENT = "try_statement";
    public static final String CATCH_CLAUSE = "catch_clause";
    public static final String FINALLY_CLAUSE = "finally_clause";
    public static final String WHILE_STATEMENT = "while_statement";
    public static final String DO_STATEMENT = "do_statement";
    public static final String FOR_STATEMENT = "for_statement";
    public static final String FOR_IN_STATEMENT = "for_in_statement";
    public static final String LABELED_STATEMENT = "labeled_statement";
    public static final String BREAK_STATEMENT = "break_statement";
    public static final String CONTINUE_STATEMENT = "continue_statement";
    public static final String RETURN_STATEMENT = "return_statement";
    public static final String THROW_STATEMENT = "throw_statement";
    public static final String DEBUGGER_STATEMENT = "debugger_statement";
    public static final String WITH_STATEMENT = "with_statement";
    public static final String IMPORT_STATEMENT = "import_statement";
    public static final String EXPORT_STATEMENT = "export_statement";
    public static final String LEXICAL_DECLARATION = "lexical_declaration";
    public static final String VARIABLE_DECLARATION = "variable_declaration";

    // Expressions
    public static final String PARENTHESIZED_EXPRESSION = "parenthesized_expression";
    public static final String BINARY_EXPRESSION = "binary_expression";
    public static final String AUGMENTED_ASSIGNMENT_EXPRESSION = "augmented_assignment_expression";
    public static final String TERNARY_EXPRESSION = "ternary_expression";
    public static final String CALL_EXPRESSION = "call_expression";
    public static final String NEW_EXPRESSION = "new_expression";
    public static final String MEMBER_EXPRESSION = "member_expression";
    public static final String SUBSCRIPT_EXPRESSION = "subscript_expression";
    public static final String YIELD_EXPRESSION = "yield_expression";
    public static final String ARGUMENTS = "arguments";
    public static final String TEMPLATE_STRING = "template_string";

    // Patterns
    public static final String ASSIGNMENT_PATTERN = "assignment_pattern";
    public static final String OBJECT_ASSIGNMENT_PATTERN = "object_assignment_pattern";
    public static final String ARRAY_PATTERN = "array_pattern";
    public static final String REST_PATTERN = "rest_pattern";

    // Identifiers
    public static final String IDENTIFIER = "identifier";
    public static final String PROPERTY_IDENTIFIER = "property_identifier";
    public static final String SHORTHAND_PROPERTY_IDENTIFIER = "shorthand_property_identifier";
    public static final String PRIVATE_PROPERTY_IDENTIFIER = "private_property_identifier";
    public static final String STATEMENT_IDENTIFIER = "statement_identifier";
    public static final String IMPORT_CLAUSE = "import_clause";
    public static final String IMPORT_SPECIFIER = "import_specifier";
    public static final String NAMESPACE_IMPORT = "namespace_import";

    // Literals
    public static final String STRING = "string";
    public static final String NUMBER = "number";
    public static final String REGEX = "regex";
    public static final String NULL = "null";
    public static final String TRUE = "true";
    public static final String FALSE = "false";

    public static final Set<String> LITERALS = Set.of(STRING, NUMBER, REGEX, NULL, TRUE, FALSE);

    /**
     * Statements that an unlabeled {@code break} may leave.
     */
    public static final Set<String> BREAKABLE_STATEMENTS = Set.of(
            DO_STATEMENT, WHILE_STATEMENT, FOR_STATEMENT, FOR_IN_STATEMENT, SWITCH_STATEMENT);

    public static final Set<String> LOOPS = Set.of(
            WHILE_STATEMENT, DO_STATEMENT, FOR_STATEMENT, FOR_IN_STATEMENT);

    public static final Set<String> FUNCTIONS = Set.of(
            FUNCTION_DECLARATION, GENERATOR_FUNCTION_DECLARATION, FUNCTION, FUNCTION_EXPRESSION,
            GENERATOR_FUNCTION, ARROW_FUNCTION, METHOD_DEFINITION);
}
