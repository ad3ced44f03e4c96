package com.repo.codepath.rules;

import com.repo.codepath.codepath.CodePath;
import com.repo.codepath.codepath.CodePathAnalyzer;
import com.repo.codepath.codepath.CodePathOrigin;
import com.repo.codepath.codepath.CodePathSegment;
import com.repo.codepath.tree.FileContext;
import com.repo.codepath.tree.SyntaxNode;

import java.util.*;

import static com.repo.codepath.tree.NodeKinds.*;

/**
 * Cyclomatic complexity per function, class field initializer and class
 * static block.
 *
 * <p>Complexity is 1 plus the number of branching nodes of the unit that are
 * entered in a reachable segment: conditionals, loops, {@code case} clauses,
 * {@code catch} clauses and the short-circuit operators {@code &&}, {@code ||}
 * and {@code ??} (including their assignment forms). Dead code does not count.
 */
public class ComplexityRule implements LintRule {

    public static final String NAME = "complexity";
    public static final int DEFAULT_MAX = 20;

    private static final Set<String> BRANCH_KINDS = Set.of(
            IF_STATEMENT, TERNARY_EXPRESSION, SWITCH_CASE, CATCH_CLAUSE,
            WHILE_STATEMENT, DO_STATEMENT, FOR_STATEMENT, FOR_IN_STATEMENT);

    private static final Set<String> LOGICAL_OPERATORS = Set.of("&&", "||", "??");
    private static final Set<String> LOGICAL_ASSIGNMENT_OPERATORS = Set.of("&&=", "||=", "??=");

    /**
     * Complexity of one unit.
     */
    public record UnitComplexity(
            /** Code path of the unit */
            CodePath codePath,

            /** Display name, e.g. "function 'foo'" */
            String name,

            /** 1 + reachable branch count */
            int complexity) {

        public SyntaxNode node() {
            return codePath.rootNode();
        }
    }

    private final int max;

    public ComplexityRule() {
        this(DEFAULT_MAX);
    }

    public ComplexityRule(int max) {
        if (max < 0) {
            throw new IllegalArgumentException("max must not be negative: " + max);
        }
        this.max = max;
    }

    @Override
    public String name() {
        return NAME;
    }

    public int max() {
        return max;
    }

    @Override
    public List<Violation> check(FileContext context) {
        List<Violation> violations = new ArrayList<>();
        for (UnitComplexity unit : measure(context)) {
            if (unit.complexity() > max) {
                violations.add(new Violation(NAME,
                        "%s has a complexity of %d. Maximum allowed is %d.".formatted(
                                FunctionNames.upperCaseFirst(unit.name()), unit.complexity(), max),
                        unit.node()));
            }
        }
        return violations;
    }

    /**
     * Complexity of every unit of the file except the program itself, in
     * code path creation order.
     */
    public static List<UnitComplexity> measure(FileContext context) {
        CodePathAnalyzer analyzer = CodePathAnalyzer.forFile(context);
        List<UnitComplexity> result = new ArrayList<>();
        for (CodePath codePath : analyzer.codePaths()) {
            if (codePath.origin() == CodePathOrigin.PROGRAM) {
                continue;
            }
            result.add(new UnitComplexity(codePath, unitName(codePath), 1 + countBranches(analyzer, codePath)));
        }
        return result;
    }

    private static int countBranches(CodePathAnalyzer analyzer, CodePath codePath) {
        Set<Integer> counted = new HashSet<>();
        for (CodePathSegment segment : codePath.segments()) {
            if (!segment.isReachable()) {
                continue;
            }
            for (SyntaxNode node : segment.enteredNodes()) {
                if (isBranch(node) && !counted.contains(node.id())
                        && analyzer.getInnermostCodePath(node) == codePath) {
                    counted.add(node.id());
                }
            }
        }
        return counted.size();
    }

    static boolean isBranch(SyntaxNode node) {
        if (BRANCH_KINDS.contains(node.kind())) {
            return true;
        }
        SyntaxNode operator = node.childByField("operator");
        if (operator == null) {
            return false;
        }
        return switch (node.kind()) {
            case BINARY_EXPRESSION -> LOGICAL_OPERATORS.contains(operator.text());
            case AUGMENTED_ASSIGNMENT_EXPRESSION -> LOGICAL_ASSIGNMENT_OPERATORS.contains(operator.text());
            default -> false;
        };
    }

    private static String unitName(CodePath codePath) {
        return switch (codePath.origin()) {
            case CLASS_FIELD_INITIALIZER -> "class field initializer";
            case CLASS_STATIC_BLOCK -> "class static block";
            default -> FunctionNames.describe(codePath.rootNode());
        };
    }
}
