package com.repo.codepath.tree;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SyntaxTreeReaderTest {

    @TempDir
    Path tempDir;

    private static final String LOGICAL_OR = """
            (program [0, 0] - [0, 7]
              (expression_statement [0, 0] - [0, 7]
                (binary_expression [0, 0] - [0, 6]
                  left: (identifier [0, 0] - [0, 1] "a")
                  operator: "||"
                  right: (number [0, 5] - [0, 6] "1"))))
            """;

    @Test
    void testReadsFieldsTokensAndPositions() {
        SyntaxNode root = SyntaxTreeReader.read(LOGICAL_OR);

        assertEquals("program", root.kind());
        assertNull(root.parent());
        SyntaxNode binary = root.namedChildren().get(0).namedChildren().get(0);
        assertEquals("binary_expression", binary.kind());

        SyntaxNode operator = binary.childByField("operator");
        assertFalse(operator.isNamed());
        assertEquals("||", operator.text());
        assertEquals(3, binary.children().size());
        assertEquals(2, binary.namedChildren().size());

        SyntaxNode right = binary.field("right");
        assertEquals("number", right.kind());
        assertEquals("1", right.text());
        assertEquals(new SyntaxNode.Position(0, 5), right.start());
        assertEquals("1:6", right.start().toString());
        assertEquals("a || 1", binary.text());
    }

    @Test
    void testIdsFollowPreOrder() {
        SyntaxNode root = SyntaxTreeReader.read(LOGICAL_OR);
        SyntaxNode binary = root.namedChildren().get(0).namedChildren().get(0);

        assertEquals(0, root.id());
        assertEquals(2, binary.id());
        assertEquals(3, binary.field("left").id());
        assertEquals(4, binary.field("operator").id());
        assertEquals(5, binary.field("right").id());
    }

    @Test
    void testNavigation() {
        SyntaxNode root = SyntaxTreeReader.read("""
                (program
                  (expression_statement (parenthesized_expression (parenthesized_expression (identifier "x"))))
                  ; a comment line of the dump
                  (comment "// note")
                  (expression_statement (identifier "y")))
                """);

        List<SyntaxNode> statements = root.namedChildren();
        assertEquals(2, statements.size(), "comments are not named children");
        assertTrue(statements.get(0).isFirstNamedChild());
        assertSame(statements.get(0), statements.get(1).previousNamedSibling());
        assertNull(statements.get(0).previousNamedSibling());

        SyntaxNode outer = statements.get(0).namedChildren().get(0);
        SyntaxNode x = outer.skipParentheses();
        assertEquals("identifier", x.kind());
        assertSame(statements.get(0), x.nextNonParenthesesAncestor());
        assertTrue(x.isSameOrDescendantOf(root));
        assertFalse(root.isSameOrDescendantOf(x));
        assertNull(outer.childByField("missing"));
        assertThrows(IllegalStateException.class, () -> outer.field("missing"));
    }

    @Test
    void testTokenBesideOtherChildrenStaysAChild() {
        SyntaxNode root = SyntaxTreeReader.read("(program (return_statement \"return\" (number \"1\")))");
        SyntaxNode ret = root.namedChildren().get(0);

        assertEquals(2, ret.children().size());
        assertEquals("return", ret.children().get(0).kind());
        assertFalse(ret.children().get(0).isNamed());
        assertEquals("return 1", ret.text());
    }

    @Test
    void testEscapesInStrings() {
        SyntaxNode root = SyntaxTreeReader.read("(program (expression_statement (string \"\\\"a\\tb\\\"\")))");
        SyntaxNode string = root.namedChildren().get(0).namedChildren().get(0);
        assertEquals("\"a\tb\"", string.text());
    }

    @Test
    void testMalformedInput() {
        TreeFormatException unterminated = assertThrows(TreeFormatException.class,
                () -> SyntaxTreeReader.read("(program (identifier \"x\")"));
        assertTrue(unterminated.getOffset() > 0);

        assertThrows(TreeFormatException.class, () -> SyntaxTreeReader.read("(program) (program)"));
        assertThrows(TreeFormatException.class, () -> SyntaxTreeReader.read("(program label (identifier))"));
        assertThrows(TreeFormatException.class, () -> SyntaxTreeReader.read("( )"));
        assertThrows(TreeFormatException.class, () -> SyntaxTreeReader.read("(program [0, x] - [0, 1])"));
    }

    @Test
    void testPositionOutOfRange() {
        TreeFormatException e = assertThrows(TreeFormatException.class,
                () -> SyntaxTreeReader.read("(program [99999999999, 0] - [0, 1])"));
        assertEquals(10, e.getOffset());
    }

    @Test
    void testDeeplyNestedTree() {
        int depth = 10_000;
        StringBuilder tree = new StringBuilder("(program (expression_statement ");
        tree.append("(parenthesized_expression ".repeat(depth));
        tree.append("(identifier \"a\")");
        tree.append(")".repeat(depth)).append("))");

        SyntaxNode root = SyntaxTreeReader.read(tree.toString());

        SyntaxNode node = root.namedChildren().get(0);
        for (int i = 0; i < depth; i++) {
            node = node.namedChildren().get(0);
            assertEquals("parenthesized_expression", node.kind());
            assertEquals(i + 2, node.id());
        }
        SyntaxNode leaf = node.namedChildren().get(0);
        assertEquals("a", leaf.text());
        assertEquals(depth + 2, leaf.id());
        assertEquals("a", root.text());
        assertTrue(leaf.isSameOrDescendantOf(root));
    }

    @Test
    void testReadFromFile() throws IOException {
        Path file = tempDir.resolve("sample.ast");
        Files.writeString(file, LOGICAL_OR);

        SyntaxNode root = SyntaxTreeReader.read(file);
        assertEquals(6, countNodes(root));
    }

    private static int countNodes(SyntaxNode node) {
        int count = 1;
        for (SyntaxNode child : node.children()) {
            count += countNodes(child);
        }
        return count;
    }
}
