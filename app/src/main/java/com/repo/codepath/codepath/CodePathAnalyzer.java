package com.repo.codepath.codepath;

import com.repo.codepath.codepath.CodePathSegment.EventKind;
import com.repo.codepath.codepath.CodePathState.ChoiceKind;
import com.repo.codepath.codepath.CodePathState.LoopKind;
import com.repo.codepath.tree.FileContext;
import com.repo.codepath.tree.NodeListener;
import com.repo.codepath.tree.SyntaxNode;
import com.repo.codepath.tree.TreeWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.*;

import static com.repo.codepath.tree.NodeKinds.*;

/**
 * Builds the code paths of one file while its syntax tree is walked.
 *
 * <p>The analyzer is a {@link NodeListener}: every named node is handled on
 * entry (fork points, unit starts) and on exit (joins, abrupt completions,
 * unit ends). Node kinds it does not know pass through without forking.
 */
public class CodePathAnalyzer implements NodeListener {

    private static final Logger LOG = LoggerFactory.getLogger(CodePathAnalyzer.class);

    private final SegmentArena arena = new SegmentArena();
    private final IdGenerator idGenerator = new IdGenerator("s");
    private final List<CodePath> codePaths = new ArrayList<>();
    // A field initializer and the arrow function forming its value share a root node
    private final Map<SyntaxNode, List<CodePath>> codePathsByRoot = new IdentityHashMap<>();
    private final List<CodePathListener> listeners = new ArrayList<>();
    private CodePath activeCodePath;
    private SyntaxNode currentNode;

    /**
     * The analyzer registered for a file; the file is analyzed on first use.
     */
    public static CodePathAnalyzer forFile(FileContext context) {
        return context.retrieve(CodePathAnalyzer.class, () -> walk(context, List.of()));
    }

    /**
     * Analyzes the file with a fresh analyzer that reports to the given
     * listeners, and registers it in the file context.
     */
    public static CodePathAnalyzer analyze(FileContext context, CodePathListener... listeners) {
        CodePathAnalyzer analyzer = walk(context, List.of(listeners));
        context.register(CodePathAnalyzer.class, analyzer);
        return analyzer;
    }

    private static CodePathAnalyzer walk(FileContext context, List<CodePathListener> listeners) {
        CodePathAnalyzer analyzer = new CodePathAnalyzer();
        analyzer.listeners.addAll(listeners);
        new TreeWalker(List.of(analyzer)).walk(context);
        return analyzer;
    }

    public void addListener(CodePathListener listener) {
        listeners.add(listener);
    }

    /**
     * All code paths in creation order; the program comes first.
     */
    public List<CodePath> codePaths() {
        return Collections.unmodifiableList(codePaths);
    }

    public SegmentArena arena() {
        return arena;
    }

    public Optional<CodePath> findByRootNode(SyntaxNode rootNode) {
        List<CodePath> found = codePathsByRoot.get(rootNode);
        return found == null ? Optional.empty() : Optional.of(found.get(0));
    }

    /**
     * The code path of the innermost unit containing the node.
     */
    public CodePath getInnermostCodePath(SyntaxNode node) {
        for (SyntaxNode current = node; current != null; current = current.parent()) {
            List<CodePath> found = codePathsByRoot.get(current);
            if (found != null) {
                return found.get(found.size() - 1);
            }
        }
        throw new IllegalStateException("No code path contains " + node.describe());
    }

    // === Walk events ===

    @Override
    public void enterNode(SyntaxNode node) {
        if (!node.isNamed() || node.isComment()) {
            return;
        }
        currentNode = node;
        if (node.parent() != null) {
            preprocess(node);
        }
        processCodePathToEnter(node);
        currentNode = null;
    }

    @Override
    public void exitNode(SyntaxNode node) {
        if (!node.isNamed() || node.isComment()) {
            return;
        }
        currentNode = node;
        processCodePathToExit(node);
        postprocess(node);
        currentNode = null;
    }

    @Override
    public void onTraversalComplete(FileContext context) {
        if (activeCodePath != null) {
            throw new IllegalStateException("Traversal completed with open code path " + activeCodePath.id());
        }
        LOG.debug("{}: built {} code paths and {} segments", context.fileName(), codePaths.size(), arena.size());
    }

    // === Entering ===

    /**
     * Handles a node in relation to its parent, before the node itself.
     */
    private void preprocess(SyntaxNode node) {
        if (activeCodePath == null) {
            return;
        }
        CodePathState state = activeCodePath.state();
        SyntaxNode parent = node.parent();

        switch (parent.kind()) {
            case CALL_EXPRESSION -> {
                if (parent.hasField("optional_chain") && node.kind().equals(ARGUMENTS)
                        && node.hasNamedChildren()) {
                    state.makeOptionalRight();
                }
            }
            case MEMBER_EXPRESSION -> {
                if (parent.hasField("optional_chain") && parent.childByField("property") == node) {
                    state.makeOptionalRight();
                }
            }
            case SUBSCRIPT_EXPRESSION -> {
                if (parent.hasField("optional_chain") && parent.childByField("index") == node) {
                    state.makeOptionalRight();
                }
            }
            case BINARY_EXPRESSION -> {
                if (parent.childByField("right") == node && isHandledLogicalOperator(parent)) {
                    state.makeLogicalRight();
                }
            }
            case AUGMENTED_ASSIGNMENT_EXPRESSION -> {
                if (parent.childByField("right") == node && isLogicalAssignmentOperator(operatorOf(parent))) {
                    state.makeLogicalRight();
                }
            }
            case IF_STATEMENT, TERNARY_EXPRESSION -> {
                if (parent.childByField("consequence") == node) {
                    state.makeIfConsequent();
                } else if (parent.childByField("alternative") == node) {
                    state.makeIfAlternate();
                }
            }
            case SWITCH_CASE, SWITCH_DEFAULT -> {
                if (parent.childByField("body") == node) {
                    state.makeSwitchCaseBody(false, parent.kind().equals(SWITCH_DEFAULT));
                }
            }
            case TRY_STATEMENT -> {
                if (parent.childByField("handler") == node) {
                    state.makeCatchBlock();
                } else if (parent.childByField("finalizer") == node) {
                    state.makeFinallyBlock();
                }
            }
            case WHILE_STATEMENT -> {
                if (parent.childByField("condition") == node) {
                    state.makeWhileTest(getBooleanValueIfSimpleConstant(node.skipParentheses()));
                } else if (parent.childByField("body") == node) {
                    state.makeWhileBody();
                }
            }
            case DO_STATEMENT -> {
                if (parent.childByField("body") == node) {
                    state.makeDoWhileBody();
                } else if (parent.childByField("condition") == node) {
                    state.makeDoWhileTest(getBooleanValueIfSimpleConstant(node.skipParentheses()));
                }
            }
            case FOR_STATEMENT -> {
                if (parent.childByField("condition") == node && !node.kind().equals(EMPTY_STATEMENT)) {
                    state.makeForTest(getBooleanValueIfSimpleConstant(
                            node.skipParentheses().skipNodesOfKind(EXPRESSION_STATEMENT)));
                } else if (parent.childByField("increment") == node) {
                    state.makeForUpdate();
                } else if (parent.childByField("body") == node) {
                    state.makeForBody();
                }
            }
            case FOR_IN_STATEMENT -> {
                if (parent.childByField("left") == node) {
                    state.makeForInOfLeft();
                } else if (parent.childByField("right") == node) {
                    state.makeForInOfRight();
                } else if (parent.childByField("body") == node) {
                    state.makeForInOfBody();
                }
            }
            case ASSIGNMENT_PATTERN, OBJECT_ASSIGNMENT_PATTERN -> {
                // The default value is evaluated only when the value is undefined
                if (parent.childByField("right") == node) {
                    state.pushForkContext(false);
                    state.forkBypassPath();
                    state.forkPath();
                }
            }
            default -> {
            }
        }
    }

    private void processCodePathToEnter(SyntaxNode node) {
        if (isPropertyDefinitionValue(node)) {
            startCodePath(node, CodePathOrigin.CLASS_FIELD_INITIALIZER);
        }

        switch (node.kind()) {
            case PROGRAM -> startCodePath(node, CodePathOrigin.PROGRAM);
            case FUNCTION_DECLARATION, GENERATOR_FUNCTION_DECLARATION, FUNCTION, FUNCTION_EXPRESSION,
                    GENERATOR_FUNCTION, ARROW_FUNCTION, METHOD_DEFINITION ->
                    startCodePath(node, CodePathOrigin.FUNCTION);
            case CLASS_STATIC_BLOCK -> startCodePath(node, CodePathOrigin.CLASS_STATIC_BLOCK);
            default -> {
            }
        }

        CodePathState state = requireActiveCodePath(node).state();

        switch (node.kind()) {
            case CALL_EXPRESSION, MEMBER_EXPRESSION, SUBSCRIPT_EXPRESSION -> {
                if (isOutermostChainExpression(node)) {
                    state.pushChainContext();
                }
                if (node.hasField("optional_chain")) {
                    state.makeOptionalNode();
                }
            }
            case BINARY_EXPRESSION -> {
                ChoiceKind kind = logicalChoiceKind(operatorOf(node));
                if (kind != null) {
                    state.pushChoiceContext(kind, isForkingByTrueOrFalse(node));
                }
            }
            case AUGMENTED_ASSIGNMENT_EXPRESSION -> {
                String operator = operatorOf(node);
                if (isLogicalAssignmentOperator(operator)) {
                    state.pushChoiceContext(logicalChoiceKind(operator.substring(0, operator.length() - 1)),
                            isForkingByTrueOrFalse(node));
                }
            }
            case TERNARY_EXPRESSION, IF_STATEMENT -> state.pushChoiceContext(ChoiceKind.TEST, false);
            case SWITCH_STATEMENT -> {
                SyntaxNode body = node.childByField("body");
                state.pushSwitchContext(body != null && body.hasChildOfKind(SWITCH_CASE), getLabel(node));
            }
            case TRY_STATEMENT -> state.pushTryContext(node.hasField("finalizer"));
            case SWITCH_CASE, SWITCH_DEFAULT -> {
                if (!node.isFirstNamedChild()) {
                    state.forkPath();
                }
            }
            case WHILE_STATEMENT -> state.pushLoopContext(LoopKind.WHILE, getLabel(node));
            case DO_STATEMENT -> state.pushLoopContext(LoopKind.DO_WHILE, getLabel(node));
            case FOR_STATEMENT -> state.pushLoopContext(LoopKind.FOR, getLabel(node));
            case FOR_IN_STATEMENT -> state.pushLoopContext(LoopKind.FOR_IN, getLabel(node));
            case LABELED_STATEMENT -> {
                if (!isBreakableBody(node)) {
                    state.pushBreakContext(false, node.field("label").text());
                }
            }
            default -> {
            }
        }

        forwardCurrentToHead(node);
        recordEvent(activeCodePath, node, EventKind.ENTER);
    }

    private void startCodePath(SyntaxNode node, CodePathOrigin origin) {
        if (activeCodePath != null) {
            forwardCurrentToHead(node);
            recordEvent(activeCodePath, node, EventKind.ENTER);
        }

        CodePath codePath = new CodePath(idGenerator.next(), origin, activeCodePath, node, arena, this::onLooped);
        codePaths.add(codePath);
        codePathsByRoot.computeIfAbsent(node, root -> new ArrayList<>()).add(codePath);
        activeCodePath = codePath;

        LOG.debug("onCodePathStart {} ({} at {})", codePath.id(), origin, node.describe());
        for (CodePathListener listener : listeners) {
            listener.onCodePathStart(codePath, node);
        }
    }

    // === Exiting ===

    private void processCodePathToExit(SyntaxNode node) {
        CodePathState state = requireActiveCodePath(node).state();
        boolean dontForward = false;

        switch (node.kind()) {
            case IF_STATEMENT, TERNARY_EXPRESSION -> state.popChoice();
            case BINARY_EXPRESSION -> {
                if (isHandledLogicalOperator(node)) {
                    state.popChoice();
                }
            }
            case AUGMENTED_ASSIGNMENT_EXPRESSION -> {
                if (isLogicalAssignmentOperator(operatorOf(node))) {
                    state.popChoice();
                }
            }
            case SWITCH_STATEMENT -> state.popSwitchContext();
            case SWITCH_CASE, SWITCH_DEFAULT -> {
                // A case without statements still opens a body for fallthrough
                if (!node.hasField("body")) {
                    state.makeSwitchCaseBody(true, node.kind().equals(SWITCH_DEFAULT));
                }
                if (state.isReachable()) {
                    dontForward = true;
                }
            }
            case TRY_STATEMENT -> state.popTryContext();
            case BREAK_STATEMENT -> {
                forwardCurrentToHead(node);
                state.makeBreak(labelOf(node));
                dontForward = true;
            }
            case CONTINUE_STATEMENT -> {
                forwardCurrentToHead(node);
                state.makeContinue(labelOf(node));
                dontForward = true;
            }
            case RETURN_STATEMENT -> {
                forwardCurrentToHead(node);
                state.makeReturn();
                dontForward = true;
            }
            case THROW_STATEMENT -> {
                forwardCurrentToHead(node);
                state.makeThrow();
                dontForward = true;
            }
            case IDENTIFIER, PROPERTY_IDENTIFIER, SHORTHAND_PROPERTY_IDENTIFIER -> {
                if (isIdentifierReference(node)) {
                    state.makeFirstThrowablePathInTryBlock();
                    dontForward = true;
                }
            }
            case CALL_EXPRESSION, MEMBER_EXPRESSION, SUBSCRIPT_EXPRESSION, NEW_EXPRESSION, YIELD_EXPRESSION -> {
                state.makeFirstThrowablePathInTryBlock();
                if (isOutermostChainExpression(node)) {
                    state.popChainContext();
                }
            }
            case WHILE_STATEMENT, DO_STATEMENT, FOR_STATEMENT, FOR_IN_STATEMENT -> state.popLoopContext();
            case ASSIGNMENT_PATTERN, OBJECT_ASSIGNMENT_PATTERN -> state.popForkContext();
            case LABELED_STATEMENT -> {
                if (!isBreakableBody(node)) {
                    state.popBreakContext();
                }
            }
            case SWITCH_BODY, PARENTHESIZED_EXPRESSION -> dontForward = true;
            default -> {
            }
        }

        if (!dontForward) {
            forwardCurrentToHead(node);
        }
        recordEvent(activeCodePath, node, EventKind.EXIT);
    }

    private void postprocess(SyntaxNode node) {
        switch (node.kind()) {
            case PROGRAM, FUNCTION_DECLARATION, GENERATOR_FUNCTION_DECLARATION, FUNCTION, FUNCTION_EXPRESSION,
                    GENERATOR_FUNCTION, ARROW_FUNCTION, METHOD_DEFINITION, CLASS_STATIC_BLOCK -> endCodePath(node);
            case CALL_EXPRESSION -> {
                // a?.() has no argument to start the optional part
                if (node.hasField("optional_chain") && countArguments(node) == 0) {
                    activeCodePath.state().makeOptionalRight();
                }
            }
            default -> {
            }
        }

        if (isPropertyDefinitionValue(node)) {
            endCodePath(node);
        }
    }

    private void endCodePath(SyntaxNode node) {
        CodePath codePath = requireActiveCodePath(node);
        if (codePath.rootNode() != node) {
            throw new IllegalStateException("Exiting " + node.describe() + " while code path "
                    + codePath.id() + " of " + codePath.rootNode().describe() + " is open");
        }
        codePath.state().makeFinal();
        leaveFromCurrentSegment(node);
        codePath.finish();

        LOG.debug("onCodePathEnd {}", codePath.id());
        if (LOG.isTraceEnabled()) {
            LOG.trace("{}\n{}", codePath.id(), DotPrinter.dot(codePath));
        }
        for (CodePathListener listener : listeners) {
            listener.onCodePathEnd(codePath, node);
        }

        activeCodePath = codePath.upper().orElse(null);
        if (activeCodePath != null) {
            recordEvent(activeCodePath, node, EventKind.EXIT);
        }
    }

    // === Segment bookkeeping ===

    /**
     * Makes the head segments of the fork context current, ending the
     * segments that are left and starting the ones that are entered.
     */
    private void forwardCurrentToHead(SyntaxNode node) {
        CodePathState state = activeCodePath.state();
        int[] currentSegments = state.currentSegments();
        int[] headSegments = state.headSegments();
        int end = Math.max(currentSegments.length, headSegments.length);

        for (int i = 0; i < end; i++) {
            Integer current = i < currentSegments.length ? currentSegments[i] : null;
            Integer head = i < headSegments.length ? headSegments[i] : null;
            if (current != null && !current.equals(head) && arena.isReachable(current)) {
                LOG.debug("onCodePathSegmentEnd {}", arena.get(current).id());
                for (CodePathListener listener : listeners) {
                    listener.onSegmentEnd(arena.get(current), node);
                }
            }
        }

        state.setCurrentSegments(headSegments);

        for (int i = 0; i < end; i++) {
            Integer current = i < currentSegments.length ? currentSegments[i] : null;
            Integer head = i < headSegments.length ? headSegments[i] : null;
            if (head != null && !head.equals(current)) {
                arena.markUsed(head);
                if (arena.isReachable(head)) {
                    LOG.debug("onCodePathSegmentStart {}", arena.get(head).id());
                    for (CodePathListener listener : listeners) {
                        listener.onSegmentStart(arena.get(head), node);
                    }
                }
            }
        }
    }

    private void leaveFromCurrentSegment(SyntaxNode node) {
        CodePathState state = activeCodePath.state();
        for (int current : state.currentSegments()) {
            if (arena.isReachable(current)) {
                LOG.debug("onCodePathSegmentEnd {}", arena.get(current).id());
                for (CodePathListener listener : listeners) {
                    listener.onSegmentEnd(arena.get(current), node);
                }
            }
        }
        state.setCurrentSegments(new int[0]);
    }

    private void recordEvent(CodePath codePath, SyntaxNode node, EventKind kind) {
        for (int segment : codePath.state().currentSegments()) {
            arena.get(segment).nodes.add(new CodePathSegment.NodeEvent(kind, node));
        }
    }

    private void onLooped(int from, int to) {
        CodePathSegment fromSegment = arena.get(from);
        CodePathSegment toSegment = arena.get(to);
        if (fromSegment.isReachable() && toSegment.isReachable()) {
            LOG.debug("onCodePathSegmentLoop {} -> {}", fromSegment.id(), toSegment.id());
            for (CodePathListener listener : listeners) {
                listener.onSegmentLoop(fromSegment, toSegment, currentNode);
            }
        }
    }

    private CodePath requireActiveCodePath(SyntaxNode node) {
        if (activeCodePath == null) {
            throw new IllegalStateException("No open code path at " + node.describe()
                    + "; the tree root must be a program or a function");
        }
        return activeCodePath;
    }

    // === Node helpers ===

    private static boolean isPropertyDefinitionValue(SyntaxNode node) {
        SyntaxNode parent = node.parent();
        return parent != null && parent.kind().equals(FIELD_DEFINITION) && parent.childByField("value") == node;
    }

    private static String operatorOf(SyntaxNode node) {
        SyntaxNode operator = node.childByField("operator");
        return operator == null ? "" : operator.text();
    }

    private static ChoiceKind logicalChoiceKind(String operator) {
        return switch (operator) {
            case "&&" -> ChoiceKind.LOGICAL_AND;
            case "||" -> ChoiceKind.LOGICAL_OR;
            case "??" -> ChoiceKind.NULL_COALESCE;
            default -> null;
        };
    }

    static boolean isHandledLogicalOperator(SyntaxNode node) {
        return logicalChoiceKind(operatorOf(node)) != null;
    }

    static boolean isLogicalAssignmentOperator(String operator) {
        return operator.equals("&&=") || operator.equals("||=") || operator.equals("??=");
    }

    private static String getLabel(SyntaxNode node) {
        SyntaxNode parent = node.parent();
        if (parent != null && parent.kind().equals(LABELED_STATEMENT)) {
            return parent.field("label").text();
        }
        return null;
    }

    private static String labelOf(SyntaxNode jump) {
        SyntaxNode label = jump.childByField("label");
        return label == null ? null : label.text();
    }

    private static boolean isBreakableBody(SyntaxNode labeledStatement) {
        SyntaxNode body = labeledStatement.childByField("body");
        return body != null && BREAKABLE_STATEMENTS.contains(body.kind());
    }

    /**
     * Whether the value of a logical expression decides a fork of its parent,
     * like the test of an {@code if} or an operand of another logical operator.
     */
    private static boolean isForkingByTrueOrFalse(SyntaxNode node) {
        SyntaxNode parent = node.nextNonParenthesesAncestor();
        if (parent == null) {
            return false;
        }
        if (parent.kind().equals(EXPRESSION_STATEMENT)) {
            SyntaxNode grandParent = parent.parent();
            if (grandParent != null && grandParent.kind().equals(FOR_STATEMENT)
                    && grandParent.childByField("condition") == parent) {
                return true;
            }
        }

        return switch (parent.kind()) {
            case TERNARY_EXPRESSION, IF_STATEMENT, WHILE_STATEMENT, DO_STATEMENT, FOR_STATEMENT -> {
                SyntaxNode condition = parent.childByField("condition");
                yield condition != null && condition.skipParentheses() == node;
            }
            case BINARY_EXPRESSION -> isHandledLogicalOperator(parent);
            case AUGMENTED_ASSIGNMENT_EXPRESSION -> isLogicalAssignmentOperator(operatorOf(parent));
            default -> false;
        };
    }

    /**
     * Truth value of a literal, or null when the node is not a literal.
     */
    static Boolean getBooleanValueIfSimpleConstant(SyntaxNode node) {
        return switch (node.kind()) {
            case STRING -> !stringValueIsEmpty(node);
            case NUMBER -> numberIsTruthy(node.text());
            case REGEX, TRUE -> true;
            case NULL, FALSE -> false;
            default -> null;
        };
    }

    private static boolean stringValueIsEmpty(SyntaxNode node) {
        if (node.hasNamedChildren()) {
            return false;
        }
        String text = node.text();
        if (text.length() >= 2 && (text.startsWith("\"") || text.startsWith("'") || text.startsWith("`"))
                && text.charAt(text.length() - 1) == text.charAt(0)) {
            return text.length() == 2;
        }
        return text.isEmpty();
    }

    private static Boolean numberIsTruthy(String literal) {
        String text = literal.replace("_", "").toLowerCase(Locale.ROOT);
        if (text.endsWith("n")) {
            text = text.substring(0, text.length() - 1);
        }
        try {
            if (text.startsWith("0x")) {
                return new BigInteger(text.substring(2), 16).signum() != 0;
            }
            if (text.startsWith("0o")) {
                return new BigInteger(text.substring(2), 8).signum() != 0;
            }
            if (text.startsWith("0b")) {
                return new BigInteger(text.substring(2), 2).signum() != 0;
            }
            double value = Double.parseDouble(text);
            return value != 0 && !Double.isNaN(value);
        } catch (NumberFormatException e) {
            LOG.debug("Not a simple numeric constant: {}", literal);
            return null;
        }
    }

    /**
     * Whether an identifier is read, as opposed to being declared or used as a
     * label or property key.
     */
    private static boolean isIdentifierReference(SyntaxNode node) {
        SyntaxNode parent = node.parent();
        if (parent == null) {
            return false;
        }
        return switch (parent.kind()) {
            case LABELED_STATEMENT, BREAK_STATEMENT, CONTINUE_STATEMENT, ARRAY_PATTERN, REST_PATTERN,
                    IMPORT_CLAUSE, IMPORT_SPECIFIER, NAMESPACE_IMPORT, CATCH_CLAUSE -> false;
            case FUNCTION_DECLARATION, GENERATOR_FUNCTION_DECLARATION, FUNCTION, FUNCTION_EXPRESSION,
                    GENERATOR_FUNCTION, ARROW_FUNCTION, CLASS_DECLARATION, CLASS, VARIABLE_DECLARATOR,
                    METHOD_DEFINITION -> parent.childByField("name") != node;
            case FIELD_DEFINITION -> parent.childByField("property") != node;
            case PAIR, PAIR_PATTERN -> parent.childByField("key") != node;
            case ASSIGNMENT_PATTERN, OBJECT_ASSIGNMENT_PATTERN -> parent.childByField("left") != node;
            case FOR_IN_STATEMENT -> !(parent.childByField("left") == node && parent.hasField("kind"));
            default -> true;
        };
    }

    private static boolean isChainExpression(SyntaxNode node) {
        SyntaxNode current = node;
        while (current != null) {
            String link = switch (current.kind()) {
                case CALL_EXPRESSION -> "function";
                case MEMBER_EXPRESSION, SUBSCRIPT_EXPRESSION -> "object";
                default -> null;
            };
            if (link == null) {
                return false;
            }
            if (current.hasField("optional_chain")) {
                return true;
            }
            current = current.childByField(link);
        }
        return false;
    }

    private static boolean isOutermostChainExpression(SyntaxNode node) {
        return isChainExpression(node) && (node.parent() == null || !isChainExpression(node.parent()));
    }

    private static int countArguments(SyntaxNode call) {
        SyntaxNode arguments = call.childByField("arguments");
        if (arguments == null || !arguments.kind().equals(ARGUMENTS)) {
            return -1;
        }
        return arguments.namedChildren().size();
    }
}
