package com.repo.codepath.rules;

import com.repo.codepath.codepath.CodePath;
import com.repo.codepath.codepath.CodePathAnalyzer;
import com.repo.codepath.codepath.CodePathSegment;
import com.repo.codepath.tree.FileContext;
import com.repo.codepath.tree.SyntaxNode;

import java.util.*;

import static com.repo.codepath.tree.NodeKinds.*;

/**
 * Reports statements that no execution can reach, such as code after a
 * {@code return} or after an infinite loop. A run of adjacent unreachable
 * statements gives a single report on its first statement.
 */
public class NoUnreachableRule implements LintRule {

    public static final String NAME = "no-unreachable";
    static final String MESSAGE = "Unreachable code.";

    private static final Set<String> TARGET_KINDS = Set.of(
            STATEMENT_BLOCK, BREAK_STATEMENT, CLASS_DECLARATION, CONTINUE_STATEMENT, DEBUGGER_STATEMENT,
            DO_STATEMENT, EXPRESSION_STATEMENT, FOR_IN_STATEMENT, FOR_STATEMENT, IF_STATEMENT,
            IMPORT_STATEMENT, LABELED_STATEMENT, RETURN_STATEMENT, SWITCH_STATEMENT, THROW_STATEMENT,
            TRY_STATEMENT, WHILE_STATEMENT, WITH_STATEMENT, EXPORT_STATEMENT, LEXICAL_DECLARATION);

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Violation> check(FileContext context) {
        CodePathAnalyzer analyzer = CodePathAnalyzer.forFile(context);

        Set<Integer> reachable = new HashSet<>();
        Map<Integer, SyntaxNode> maybeUnreachable = new HashMap<>();
        for (CodePath codePath : analyzer.codePaths()) {
            codePath.traverseAllSegments((segment, controller) -> collect(segment, reachable, maybeUnreachable));
        }

        List<SyntaxNode> unreachable = new ArrayList<>();
        for (SyntaxNode node : maybeUnreachable.values()) {
            if (!reachable.contains(node.id())) {
                unreachable.add(node);
            }
        }
        unreachable.sort(Comparator.comparingInt(SyntaxNode::id));

        List<Violation> violations = new ArrayList<>();
        for (Range range : merge(unreachable)) {
            violations.add(new Violation(NAME, MESSAGE, range.start()));
        }
        return violations;
    }

    private static void collect(CodePathSegment segment, Set<Integer> reachable,
            Map<Integer, SyntaxNode> maybeUnreachable) {
        for (SyntaxNode node : segment.enteredNodes()) {
            if (!isTarget(node)) {
                continue;
            }
            if (segment.isReachable()) {
                reachable.add(node.id());
            } else {
                maybeUnreachable.put(node.id(), node);
            }
        }
    }

    static boolean isTarget(SyntaxNode node) {
        if (TARGET_KINDS.contains(node.kind())) {
            return true;
        }
        // `var x;` does nothing at runtime
        return node.kind().equals(VARIABLE_DECLARATION)
                && node.namedChildren().stream().anyMatch(declarator -> declarator.hasField("value"));
    }

    /**
     * Statements from {@code start} through {@code end}, in source order.
     */
    record Range(SyntaxNode start, SyntaxNode end) {

        boolean contains(SyntaxNode node) {
            return node.id() <= lastDescendant(end).id();
        }

        /**
         * Whether nothing but the range lies between its end and the node.
         */
        boolean isFollowedBy(SyntaxNode node) {
            SyntaxNode tokenBefore = previousLeaf(node);
            return tokenBefore != null && contains(tokenBefore);
        }
    }

    static List<Range> merge(List<SyntaxNode> sortedNodes) {
        List<Range> ranges = new ArrayList<>();
        for (SyntaxNode node : sortedNodes) {
            if (ranges.isEmpty()) {
                ranges.add(new Range(node, node));
                continue;
            }
            Range last = ranges.get(ranges.size() - 1);
            if (last.contains(node)) {
                continue;
            }
            if (last.isFollowedBy(node)) {
                ranges.set(ranges.size() - 1, new Range(last.start(), node));
            } else {
                ranges.add(new Range(node, node));
            }
        }
        return ranges;
    }

    private static SyntaxNode lastDescendant(SyntaxNode node) {
        SyntaxNode current = node;
        while (!current.children().isEmpty()) {
            List<SyntaxNode> children = current.children();
            current = children.get(children.size() - 1);
        }
        return current;
    }

    /**
     * The last non-comment leaf before the node, or null at the start of the
     * tree.
     */
    private static SyntaxNode previousLeaf(SyntaxNode node) {
        SyntaxNode current = node;
        while (current.parent() != null) {
            List<SyntaxNode> siblings = current.parent().children();
            for (int i = siblings.indexOf(current) - 1; i >= 0; i--) {
                SyntaxNode leaf = lastNonCommentLeaf(siblings.get(i));
                if (leaf != null) {
                    return leaf;
                }
            }
            current = current.parent();
        }
        return null;
    }

    private static SyntaxNode lastNonCommentLeaf(SyntaxNode node) {
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        stack.push(node);
        while (!stack.isEmpty()) {
            SyntaxNode current = stack.pop();
            if (current.isComment()) {
                continue;
            }
            List<SyntaxNode> children = current.children();
            if (children.isEmpty()) {
                return current;
            }
            // the last child is popped first
            for (SyntaxNode child : children) {
                stack.push(child);
            }
        }
        return null;
    }
}
