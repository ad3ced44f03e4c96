package com.repo.codepath.codepath;

import com.repo.codepath.tree.FileContext;
import com.repo.codepath.tree.SyntaxNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.repo.codepath.codepath.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class CodePathAnalyzerTest {

    @Test
    void testIfWithoutElse() {
        assertEquals(List.of("initial->s1_1->s1_2->s1_3;\ns1_1->s1_3->final;"), arrows(IF));
    }

    @Test
    void testIfElse() {
        assertEquals(List.of("initial->s1_1->s1_2->s1_4;\ns1_1->s1_3->s1_4->final;"), arrows(IF_ELSE));
    }

    @Test
    void testLogicalOrSkipsRightOperand() {
        assertEquals(List.of("initial->s1_1->s1_2->s1_3;\ns1_1->s1_3->final;"), arrows(LOGICAL_OR));
    }

    @Test
    void testOptionalChainSkipsRestOfChain() {
        assertEquals(List.of("initial->s1_1->s1_2->s1_3;\ns1_1->s1_3->final;"), arrows(OPTIONAL_MEMBER));
    }

    @Test
    void testInfiniteWhileLoopMakesFollowingCodeUnreachable() {
        assertEquals(List.of("initial->s1_1->s1_2->s1_3->s1_2;\ns1_3->s1_4;"), arrows(WHILE_TRUE));

        CodePath program = analyze(WHILE_TRUE).codePaths().get(0);
        assertFalse(segment(program, "s1_4").isReachable());
        assertTrue(program.finalSegments().isEmpty(), "the program never completes");
    }

    @Test
    void testDoWhileLoopsBackToBody() {
        assertEquals(List.of("initial->s1_1->s1_2->s1_2->s1_3->final;"), arrows(DO_WHILE));

        CodePath program = analyze(DO_WHILE).codePaths().get(0);
        CodePathSegment body = segment(program, "s1_2");
        assertTrue(body.isLooped());
        assertEquals(List.of("s1_1", "s1_2"), ids(program, body.prevSegments()));
    }

    @Test
    void testForeverLoopWithBreak() {
        CodePath program = analyze(FOR_EVER_WITH_BREAK).codePaths().get(0);

        CodePathSegment body = segment(program, "s1_2");
        assertEquals(List.of("s1_1", "s1_5"), ids(program, body.prevSegments()));
        assertTrue(body.isLooped());
        assertTrue(body.isLoopedPrevSegment(segment(program, "s1_5").handle()));

        assertFalse(segment(program, "s1_4").isReachable(), "code right after break");
        assertEquals(List.of("s1_3"), ids(program, segment(program, "s1_6").prevSegments()));
        assertEquals(List.of("s1_6"), ids(program.finalSegments()));
    }

    @Test
    void testReturnStartsUnreachableSegment() {
        CodePathAnalyzer analyzer = analyze(RETURN_THEN_DEAD_CODE);

        assertEquals(List.of("initial->s1_1->final;", "initial->s2_1->s2_2;\ns2_1->final;"),
                analyzer.codePaths().stream().map(DotPrinter::arrows).toList());

        CodePath function = analyzer.codePaths().get(1);
        assertEquals(CodePathOrigin.FUNCTION, function.origin());
        assertEquals(List.of("s2_1"), ids(function.returnedSegments()));
        assertTrue(function.thrownSegments().isEmpty());

        CodePathSegment dead = segment(function, "s2_2");
        assertFalse(dead.isReachable());
        assertEquals("expression_statement", dead.enteredNodes().get(0).kind());
        assertEquals(List.of("s2_1"), ids(function, dead.allPrevSegments()));
        assertFalse(segment(function, "s2_1").nextSegments().contains(dead.handle()));
        assertTrue(segment(function, "s2_1").allNextSegments().contains(dead.handle()));
    }

    @Test
    void testFinallyRunsOnReturnPath() {
        CodePath function = analyze(TRY_FINALLY_RETURN).codePaths().get(1);

        assertEquals(List.of("s2_4"), ids(function.returnedSegments()));
        assertEquals(List.of("s2_4"), ids(function.finalSegments()));
        assertTrue(function.thrownSegments().isEmpty());

        CodePathSegment leaving = segment(function, "s2_4");
        assertTrue(leaving.isReachable());
        assertTrue(leaving.enteredNodes().stream().anyMatch(node -> node.kind().equals("finally_clause")));
        assertFalse(segment(function, "s2_3").isReachable(), "normal completion of the try block");
    }

    @Test
    void testBreakLeavesThroughFinally() {
        assertEquals(List.of("initial->s1_1->s1_2->s1_3->s1_4->s1_2->s1_5->s1_6;\ns1_3->s1_5;\ns1_6->final;"),
                arrows(BREAK_THROUGH_FINALLY));

        CodePath program = analyze(BREAK_THROUGH_FINALLY).codePaths().get(0);
        CodePathSegment leaving = segment(program, "s1_5");
        assertTrue(leaving.isReachable());
        assertEquals("finally_clause", leaving.enteredNodes().get(0).kind());
        assertEquals(List.of("s1_2"), ids(program, leaving.prevSegments()));
        assertFalse(segment(program, "s1_4").isReachable(), "normal completion of the try block");
        assertEquals(List.of("s1_5"), ids(program, segment(program, "s1_6").prevSegments()));
    }

    @Test
    void testContinueLeavesThroughFinally() {
        assertEquals(List.of("initial->s1_1->s1_2->s1_3->s1_4->s1_5->s1_2->s1_7;\n"
                        + "s1_3->s1_6->s1_2;\ns1_4->s1_6;\ns1_7->final;"),
                arrows(CONTINUE_THROUGH_FINALLY));

        CodePath program = analyze(CONTINUE_THROUGH_FINALLY).codePaths().get(0);
        CodePathSegment test = segment(program, "s1_2");
        assertEquals(List.of("s1_1", "s1_6"), ids(program, test.prevSegments()));
        assertTrue(test.isLoopedPrevSegment(segment(program, "s1_6").handle()));
        assertTrue(segment(program, "s1_6").isReachable());
        assertFalse(segment(program, "s1_5").isReachable(), "code after the try statement");
    }

    @Test
    void testSwitchWithDefaultInTheMiddle() {
        assertEquals(List.of("initial->s1_1->s1_2->s1_3->s1_5->s1_7->s1_8;\n"
                        + "s1_1->s1_4->s1_6->s1_7;\ns1_2->s1_8;\ns1_6->s1_5;\ns1_8->final;"),
                arrows(SWITCH_DEFAULT_IN_MIDDLE));

        // the default body is entered only once the last case test fails
        CodePath program = analyze(SWITCH_DEFAULT_IN_MIDDLE).codePaths().get(0);
        CodePathSegment defaultBody = segment(program, "s1_5");
        assertEquals(List.of("s1_6"), ids(program, defaultBody.prevSegments()));
        assertTrue(defaultBody.isLoopedPrevSegment(segment(program, "s1_6").handle()));
    }

    @Test
    void testTryCatch() {
        assertEquals(List.of("initial->s1_1->s1_2->s1_3->s1_4;\ns1_1->s1_3;\ns1_2->s1_4->final;"),
                arrows(TRY_CATCH));
    }

    @Test
    void testTryCatchFinallyWithoutAbruptExit() {
        assertEquals(List.of("initial->s1_1->s1_2->s1_3->s1_4;\ns1_1->s1_3;\ns1_2->s1_4->final;"),
                arrows(TRY_CATCH_FINALLY));

        CodePath program = analyze(TRY_CATCH_FINALLY).codePaths().get(0);
        assertTrue(program.thrownSegments().isEmpty(), "the catch clause handles every throw");
        assertTrue(segment(program, "s1_4").enteredNodes().stream()
                .anyMatch(node -> node.kind().equals("finally_clause")));
    }

    @Test
    void testLabeledBreakAndContinueLeaveNestedLoops() {
        assertEquals(List.of("initial->s1_1->s1_2->s1_3->s1_4->s1_5->s1_6->s1_2->s1_11;\n"
                        + "s1_4->s1_10->s1_2;\ns1_5->s1_8->s1_9->s1_4;\ns1_6->s1_7->s1_8->s1_11->final;"),
                arrows(LABELED_NESTED_LOOPS));

        CodePath program = analyze(LABELED_NESTED_LOOPS).codePaths().get(0);
        // continue outer goes back to the outer test, break outer leaves both loops
        assertTrue(segment(program, "s1_2").isLoopedPrevSegment(segment(program, "s1_6").handle()));
        assertEquals(List.of("s1_2", "s1_8"), ids(program, segment(program, "s1_11").prevSegments()));
    }

    @Test
    void testForOfLoop() {
        assertEquals(List.of("initial->s1_1->s1_3->s1_2->s1_4->s1_2;\ns1_3->s1_5;\ns1_4->s1_5->final;"),
                arrows(FOR_OF));
    }

    @Test
    void testNullishCoalescingSkipsRightOperand() {
        assertEquals(List.of("initial->s1_1->s1_2->s1_3;\ns1_1->s1_3->final;"), arrows(NULLISH_COALESCING));
    }

    @Test
    void testLogicalAssignmentSkipsRightOperand() {
        assertEquals(List.of("initial->s1_1->s1_2->s1_3;\ns1_1->s1_3->final;"), arrows(LOGICAL_AND_ASSIGNMENT));
    }

    @Test
    void testTernary() {
        assertEquals(List.of("initial->s1_1->s1_2->s1_4;\ns1_1->s1_3->s1_4->final;"), arrows(TERNARY));
    }

    @Test
    void testClassMembersGetTheirOwnCodePaths() {
        CodePathAnalyzer analyzer = analyze(CLASS_MEMBERS);

        List<CodePathOrigin> origins = analyzer.codePaths().stream().map(CodePath::origin).toList();
        assertEquals(List.of(CodePathOrigin.PROGRAM, CodePathOrigin.CLASS_FIELD_INITIALIZER,
                CodePathOrigin.CLASS_FIELD_INITIALIZER, CodePathOrigin.CLASS_STATIC_BLOCK), origins);

        CodePath program = analyzer.codePaths().get(0);
        assertEquals(3, program.childCodePaths().size());
        for (CodePath child : program.childCodePaths()) {
            assertSame(program, child.upper().orElseThrow());
            assertTrue(child.isFinished());
            assertEquals(1, child.finalSegments().size());
        }
        assertEquals("number", analyzer.codePaths().get(1).rootNode().kind());
        assertEquals("class_static_block", analyzer.codePaths().get(3).rootNode().kind());
    }

    @Test
    void testArrowFunctionFieldValue() {
        CodePathAnalyzer analyzer = analyze("""
                (program
                  (class_declaration
                    name: (identifier "A")
                    body: (class_body
                      (field_definition
                        property: (property_identifier "handler")
                        value: (arrow_function parameters: (formal_parameters) body: (identifier "z"))))))
                """);

        List<CodePath> codePaths = analyzer.codePaths();
        assertEquals(3, codePaths.size());
        assertEquals(CodePathOrigin.CLASS_FIELD_INITIALIZER, codePaths.get(1).origin());
        assertEquals(CodePathOrigin.FUNCTION, codePaths.get(2).origin());
        assertSame(codePaths.get(1), codePaths.get(2).upper().orElseThrow());
        assertSame(codePaths.get(1).rootNode(), codePaths.get(2).rootNode());
    }

    @Test
    void testInnermostCodePath() {
        FileContext context = context(RETURN_THEN_DEAD_CODE);
        CodePathAnalyzer analyzer = CodePathAnalyzer.forFile(context);

        SyntaxNode function = context.root().namedChildren().get(0);
        SyntaxNode returnStatement = function.field("body").namedChildren().get(0);

        assertSame(analyzer.codePaths().get(1), analyzer.getInnermostCodePath(returnStatement));
        assertSame(analyzer.codePaths().get(1), analyzer.getInnermostCodePath(function));
        assertSame(analyzer.codePaths().get(0), analyzer.getInnermostCodePath(context.root()));
        assertSame(analyzer.codePaths().get(1), analyzer.findByRootNode(function).orElseThrow());

        SyntaxNode foreign = context(IF).root();
        assertThrows(IllegalStateException.class, () -> analyzer.getInnermostCodePath(foreign));
    }

    @Test
    void testInnermostCodePathOfClassInsideFunction() {
        FileContext context = context(CLASS_IN_FUNCTION);
        CodePathAnalyzer analyzer = CodePathAnalyzer.forFile(context);
        List<CodePath> codePaths = analyzer.codePaths();
        assertEquals(List.of(CodePathOrigin.PROGRAM, CodePathOrigin.FUNCTION, CodePathOrigin.CLASS_FIELD_INITIALIZER,
                CodePathOrigin.CLASS_FIELD_INITIALIZER, CodePathOrigin.CLASS_STATIC_BLOCK),
                codePaths.stream().map(CodePath::origin).toList());

        SyntaxNode function = context.root().namedChildren().get(0);
        SyntaxNode classDeclaration = function.field("body").namedChildren().get(0);
        List<SyntaxNode> members = classDeclaration.field("body").namedChildren();
        SyntaxNode ternary = members.get(1).field("value");
        SyntaxNode staticIf = members.get(2).field("body").namedChildren().get(0);

        assertSame(codePaths.get(1), analyzer.getInnermostCodePath(classDeclaration));
        assertSame(codePaths.get(1), analyzer.getInnermostCodePath(members.get(0).field("property")));
        assertSame(codePaths.get(3), analyzer.getInnermostCodePath(ternary));
        assertSame(codePaths.get(3), analyzer.getInnermostCodePath(ternary.field("consequence")));
        assertSame(codePaths.get(4), analyzer.getInnermostCodePath(staticIf));
        assertSame(codePaths.get(3), analyzer.findByRootNode(ternary).orElseThrow());
        assertTrue(analyzer.findByRootNode(classDeclaration).isEmpty());

        for (CodePath member : codePaths.subList(2, 5)) {
            assertSame(codePaths.get(1), member.upper().orElseThrow());
        }
    }

    @Test
    void testFieldInitializerAndArrowFunctionShareRoot() {
        CodePathAnalyzer analyzer = analyze("""
                (program
                  (class_declaration
                    name: (identifier "A")
                    body: (class_body
                      (field_definition
                        property: (property_identifier "handler")
                        value: (arrow_function parameters: (formal_parameters) body: (identifier "z"))))))
                """);

        CodePath initializer = analyzer.codePaths().get(1);
        CodePath arrow = analyzer.codePaths().get(2);
        SyntaxNode root = arrow.rootNode();
        assertSame(initializer, analyzer.findByRootNode(root).orElseThrow());
        assertSame(arrow, analyzer.getInnermostCodePath(root));
        assertSame(arrow, analyzer.getInnermostCodePath(root.field("body")));
    }

    @Test
    void testAnalyzerIsSharedThroughFileContext() {
        FileContext context = context(IF);
        CodePathAnalyzer first = CodePathAnalyzer.forFile(context);
        assertSame(first, CodePathAnalyzer.forFile(context));
        assertSame(first, context.find(CodePathAnalyzer.class).orElseThrow());
    }

    @Test
    void testAnalysisIsDeterministic() {
        for (String tree : List.of(IF_ELSE, WHILE_TRUE, FOR_EVER_WITH_BREAK, TRY_FINALLY_RETURN, CLASS_MEMBERS)) {
            assertEquals(arrows(tree), arrows(tree));
        }
    }

    @Test
    void testSegmentIdsBelongToTheirCodePath() {
        CodePathAnalyzer analyzer = analyze(TRY_FINALLY_RETURN);
        for (CodePath codePath : analyzer.codePaths()) {
            assertFalse(codePath.segments().isEmpty());
            for (CodePathSegment segment : codePath.segments()) {
                assertEquals(codePath.id(), segment.codePathId());
                assertTrue(segment.id().startsWith(codePath.id() + "_"));
            }
            assertSame(codePath.initialSegment(), codePath.segments().get(0));
            assertTrue(codePath.currentSegments().isEmpty(), "finished code paths have no current segment");
        }
    }

    @Test
    void testRootMustStartACodePath() {
        assertThrows(IllegalStateException.class,
                () -> analyze("(expression_statement (identifier \"a\"))"));
    }

    @Test
    void testUnknownNodesPassThrough() {
        assertEquals(List.of("initial->s1_1->final;"),
                arrows("(program (expression_statement (jsx_element (jsx_opening_element (identifier \"div\")))))"));
    }
}
