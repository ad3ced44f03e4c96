package com.repo.codepath.codepath;

import com.repo.codepath.tree.FileContext;
import com.repo.codepath.tree.SyntaxTreeReader;

import java.util.List;

/**
 * Syntax tree dumps shared by the code path tests.
 */
final class Fixtures {

    private Fixtures() {
    }

    // if (a) { foo(); }
    static final String IF = """
            (program
              (if_statement
                condition: (parenthesized_expression (identifier "a"))
                consequence: (statement_block
                  (expression_statement (call_expression function: (identifier "foo") arguments: (arguments))))))
            """;

    // if (a) { b(); } else { c(); }
    static final String IF_ELSE = """
            (program
              (if_statement
                condition: (parenthesized_expression (identifier "a"))
                consequence: (statement_block
                  (expression_statement (call_expression function: (identifier "b") arguments: (arguments))))
                alternative: (else_clause
                  (statement_block
                    (expression_statement (call_expression function: (identifier "c") arguments: (arguments)))))))
            """;

    // a || b;
    static final String LOGICAL_OR = """
            (program
              (expression_statement
                (binary_expression left: (identifier "a") operator: "||" right: (identifier "b"))))
            """;

    // a?.b;
    static final String OPTIONAL_MEMBER = """
            (program
              (expression_statement
                (member_expression
                  object: (identifier "a")
                  optional_chain: (optional_chain "?.")
                  property: (property_identifier "b"))))
            """;

    // while (true) { foo(); } bar();
    static final String WHILE_TRUE = """
            (program
              (while_statement
                condition: (parenthesized_expression (true))
                body: (statement_block
                  (expression_statement (call_expression function: (identifier "foo") arguments: (arguments)))))
              (expression_statement (call_expression function: (identifier "bar") arguments: (arguments))))
            """;

    // do { a(); } while (b);
    static final String DO_WHILE = """
            (program
              (do_statement
                body: (statement_block
                  (expression_statement (call_expression function: (identifier "a") arguments: (arguments))))
                condition: (parenthesized_expression (identifier "b"))))
            """;

    // for (;;) { if (done) break; }
    static final String FOR_EVER_WITH_BREAK = """
            (program
              (for_statement
                initializer: (empty_statement)
                condition: (empty_statement)
                body: (statement_block
                  (if_statement
                    condition: (parenthesized_expression (identifier "done"))
                    consequence: (break_statement)))))
            """;

    // function foo() { return 1; bar(); }
    static final String RETURN_THEN_DEAD_CODE = """
            (program
              (function_declaration
                name: (identifier "foo")
                parameters: (formal_parameters)
                body: (statement_block
                  (return_statement (number "1"))
                  (expression_statement (call_expression function: (identifier "bar") arguments: (arguments))))))
            """;

    // function f() { try { return; } finally { cleanup(); } }
    static final String TRY_FINALLY_RETURN = """
            (program
              (function_declaration
                name: (identifier "f")
                parameters: (formal_parameters)
                body: (statement_block
                  (try_statement
                    body: (statement_block (return_statement))
                    finalizer: (finally_clause
                      body: (statement_block
                        (expression_statement
                          (call_expression function: (identifier "cleanup") arguments: (arguments)))))))))
            """;

    // class A { x = 1; static y = 2; static { } }
    static final String CLASS_MEMBERS = """
            (program
              (class_declaration
                name: (identifier "A")
                body: (class_body
                  (field_definition property: (property_identifier "x") value: (number "1"))
                  (field_definition "static" property: (property_identifier "y") value: (number "2"))
                  (class_static_block body: (statement_block)))))
            """;

    // switch (x) { case 1: a(); break; default: b(); case 2: c(); }
    static final String SWITCH_DEFAULT_IN_MIDDLE = """
            (program
              (switch_statement
                value: (parenthesized_expression (identifier "x"))
                body: (switch_body
                  (switch_case
                    value: (number "1")
                    body: (expression_statement (call_expression function: (identifier "a") arguments: (arguments)))
                    body: (break_statement))
                  (switch_default
                    body: (expression_statement (call_expression function: (identifier "b") arguments: (arguments))))
                  (switch_case
                    value: (number "2")
                    body: (expression_statement (call_expression function: (identifier "c") arguments: (arguments)))))))
            """;

    // try { a(); } catch (e) { b(); }
    static final String TRY_CATCH = """
            (program
              (try_statement
                body: (statement_block
                  (expression_statement (call_expression function: (identifier "a") arguments: (arguments))))
                handler: (catch_clause
                  parameter: (identifier "e")
                  body: (statement_block
                    (expression_statement (call_expression function: (identifier "b") arguments: (arguments)))))))
            """;

    // try { a(); } catch (e) { b(); } finally { c(); }
    static final String TRY_CATCH_FINALLY = """
            (program
              (try_statement
                body: (statement_block
                  (expression_statement (call_expression function: (identifier "a") arguments: (arguments))))
                handler: (catch_clause
                  parameter: (identifier "e")
                  body: (statement_block
                    (expression_statement (call_expression function: (identifier "b") arguments: (arguments)))))
                finalizer: (finally_clause
                  body: (statement_block
                    (expression_statement (call_expression function: (identifier "c") arguments: (arguments)))))))
            """;

    // outer: while (a) { while (b) { if (c) continue outer; break outer; } d(); }
    static final String LABELED_NESTED_LOOPS = """
            (program
              (labeled_statement
                label: (statement_identifier "outer")
                body: (while_statement
                  condition: (parenthesized_expression (identifier "a"))
                  body: (statement_block
                    (while_statement
                      condition: (parenthesized_expression (identifier "b"))
                      body: (statement_block
                        (if_statement
                          condition: (parenthesized_expression (identifier "c"))
                          consequence: (continue_statement label: (statement_identifier "outer")))
                        (break_statement label: (statement_identifier "outer"))))
                    (expression_statement (call_expression function: (identifier "d") arguments: (arguments)))))))
            """;

    // for (const x of xs) { a(); }
    static final String FOR_OF = """
            (program
              (for_in_statement
                kind: "const"
                left: (identifier "x")
                operator: "of"
                right: (identifier "xs")
                body: (statement_block
                  (expression_statement (call_expression function: (identifier "a") arguments: (arguments))))))
            """;

    // a ?? b;
    static final String NULLISH_COALESCING = """
            (program
              (expression_statement
                (binary_expression left: (identifier "a") operator: "??" right: (identifier "b"))))
            """;

    // a &&= b;
    static final String LOGICAL_AND_ASSIGNMENT = """
            (program
              (expression_statement
                (augmented_assignment_expression left: (identifier "a") operator: "&&=" right: (identifier "b"))))
            """;

    // a ? b : c;
    static final String TERNARY = """
            (program
              (expression_statement
                (ternary_expression
                  condition: (identifier "a")
                  consequence: (identifier "b")
                  alternative: (identifier "c"))))
            """;

    // for (;;) { try { break; } finally { a(); } } b();
    static final String BREAK_THROUGH_FINALLY = """
            (program
              (for_statement
                initializer: (empty_statement)
                condition: (empty_statement)
                body: (statement_block
                  (try_statement
                    body: (statement_block (break_statement))
                    finalizer: (finally_clause
                      body: (statement_block
                        (expression_statement (call_expression function: (identifier "a") arguments: (arguments))))))))
              (expression_statement (call_expression function: (identifier "b") arguments: (arguments))))
            """;

    // while (x) { try { continue; } finally { a(); } b(); }
    static final String CONTINUE_THROUGH_FINALLY = """
            (program
              (while_statement
                condition: (parenthesized_expression (identifier "x"))
                body: (statement_block
                  (try_statement
                    body: (statement_block (continue_statement))
                    finalizer: (finally_clause
                      body: (statement_block
                        (expression_statement (call_expression function: (identifier "a") arguments: (arguments))))))
                  (expression_statement (call_expression function: (identifier "b") arguments: (arguments))))))
            """;

    // function g() { class A { x = a || b; y = c ? d : e; static { if (z) {} } } }
    static final String CLASS_IN_FUNCTION = """
            (program
              (function_declaration
                name: (identifier "g")
                parameters: (formal_parameters)
                body: (statement_block
                  (class_declaration
                    name: (identifier "A")
                    body: (class_body
                      (field_definition
                        property: (property_identifier "x")
                        value: (binary_expression left: (identifier "a") operator: "||" right: (identifier "b")))
                      (field_definition
                        property: (property_identifier "y")
                        value: (ternary_expression
                          condition: (identifier "c")
                          consequence: (identifier "d")
                          alternative: (identifier "e")))
                      (class_static_block
                        body: (statement_block
                          (if_statement
                            condition: (parenthesized_expression (identifier "z"))
                            consequence: (statement_block)))))))))
            """;

    static FileContext context(String tree) {
        return new FileContext("test.ast", SyntaxTreeReader.read(tree));
    }

    static CodePathAnalyzer analyze(String tree, CodePathListener... listeners) {
        return CodePathAnalyzer.analyze(context(tree), listeners);
    }

    static List<String> arrows(String tree) {
        return analyze(tree).codePaths().stream().map(DotPrinter::arrows).toList();
    }

    static CodePathSegment segment(CodePath codePath, String id) {
        return codePath.segments().stream()
                .filter(segment -> segment.id().equals(id))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No segment " + id + " in " + codePath));
    }

    static List<String> ids(CodePath codePath, List<Integer> handles) {
        return handles.stream().map(handle -> codePath.segment(handle).id()).toList();
    }

    static List<String> ids(List<CodePathSegment> segments) {
        return segments.stream().map(CodePathSegment::id).toList();
    }
}
