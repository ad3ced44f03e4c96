package com.repo.codepath.codepath;

import java.util.*;
import java.util.function.BiConsumer;

/**
 * Construction state of one code path: the current fork context and the
 * stacks of enclosing constructs (choices, switches, try blocks, loops,
 * breakable statements and optional chains).
 */
final class CodePathState {

    enum ChoiceKind {
        LOGICAL_AND, LOGICAL_OR, NULL_COALESCE, TEST, LOOP
    }

    enum TryPosition {
        TRY, CATCH, FINALLY
    }

    enum LoopKind {
        WHILE, DO_WHILE, FOR, FOR_IN
    }

    private static final class ChoiceContext {
        final ChoiceContext upper;
        final ChoiceKind kind;
        final boolean isForkingAsResult;
        final ForkContext trueForkContext;
        final ForkContext falseForkContext;
        final ForkContext qqForkContext;
        boolean processed;

        ChoiceContext(ChoiceContext upper, ChoiceKind kind, boolean isForkingAsResult, ForkContext forkContext) {
            this.upper = upper;
            this.kind = kind;
            this.isForkingAsResult = isForkingAsResult;
            this.trueForkContext = ForkContext.newEmpty(forkContext);
            this.falseForkContext = ForkContext.newEmpty(forkContext);
            this.qqForkContext = ForkContext.newEmpty(forkContext);
        }
    }

    private static final class ChainContext {
        final ChainContext upper;
        int countChoiceContexts;

        ChainContext(ChainContext upper) {
            this.upper = upper;
        }
    }

    private static final class SwitchContext {
        final SwitchContext upper;
        final boolean hasCase;
        int[] defaultSegments;
        int[] defaultBodySegments;
        boolean foundDefault;
        boolean lastIsDefault;
        int countForks;

        SwitchContext(SwitchContext upper, boolean hasCase) {
            this.upper = upper;
            this.hasCase = hasCase;
        }
    }

    private static final class TryContext {
        final TryContext upper;
        TryPosition position = TryPosition.TRY;
        final boolean hasFinalizer;
        final ForkContext returnedForkContext;
        ForkContext thrownForkContext;
        final BreakContext enclosingBreak;
        final LoopContext enclosingLoop;
        // break and continue statements that leave through the finally block
        final List<PendingJump> jumps = new ArrayList<>();

        TryContext(TryContext upper, boolean hasFinalizer, ForkContext forkContext,
                   BreakContext enclosingBreak, LoopContext enclosingLoop) {
            this.upper = upper;
            this.hasFinalizer = hasFinalizer;
            this.returnedForkContext = hasFinalizer ? ForkContext.newEmpty(forkContext) : null;
            this.thrownForkContext = ForkContext.newEmpty(forkContext);
            this.enclosingBreak = enclosingBreak;
            this.enclosingLoop = enclosingLoop;
        }

        boolean isInside(BreakContext target) {
            for (BreakContext context = enclosingBreak; context != null; context = context.upper) {
                if (context == target) {
                    return true;
                }
            }
            return false;
        }

        boolean isInside(LoopContext target) {
            for (LoopContext context = enclosingLoop; context != null; context = context.upper) {
                if (context == target) {
                    return true;
                }
            }
            return false;
        }

        ForkContext jumpSegments(BreakContext breakTarget, LoopContext continueTarget) {
            for (PendingJump jump : jumps) {
                if (jump.breakTarget == breakTarget && jump.continueTarget == continueTarget) {
                    return jump.segments;
                }
            }
            PendingJump jump = new PendingJump(breakTarget, continueTarget,
                    ForkContext.newEmpty(returnedForkContext.upper()));
            jumps.add(jump);
            return jump.segments;
        }

        boolean hasLeavingPaths() {
            return (returnedForkContext != null && !returnedForkContext.empty())
                    || !thrownForkContext.empty() || !jumps.isEmpty();
        }
    }

    /**
     * A break (with {@code breakTarget}) or continue (with {@code continueTarget})
     * waiting for a finally block to complete.
     */
    private record PendingJump(BreakContext breakTarget, LoopContext continueTarget, ForkContext segments) {
    }

    private static final class LoopContext {
        final LoopContext upper;
        final LoopKind kind;
        final String label;
        final ForkContext brokenForkContext;
        Boolean test;

        // while, for
        int[] continueDestSegments;
        // do-while
        int[] entrySegments;
        ForkContext continueForkContext;
        // for
        int[] endOfInitSegments;
        int[] testSegments;
        int[] endOfTestSegments;
        int[] updateSegments;
        int[] endOfUpdateSegments;
        // for-in, for-of
        int[] prevSegments;
        int[] leftSegments;
        int[] endOfLeftSegments;

        LoopContext(LoopContext upper, LoopKind kind, String label, ForkContext brokenForkContext) {
            this.upper = upper;
            this.kind = kind;
            this.label = label;
            this.brokenForkContext = brokenForkContext;
        }
    }

    private static final class BreakContext {
        final BreakContext upper;
        final boolean breakable;
        final String label;
        final ForkContext brokenForkContext;

        BreakContext(BreakContext upper, boolean breakable, String label, ForkContext brokenForkContext) {
            this.upper = upper;
            this.breakable = breakable;
            this.label = label;
            this.brokenForkContext = brokenForkContext;
        }
    }

    private final IdGenerator idGenerator;
    private final SegmentArena arena;
    private final BiConsumer<Integer, Integer> onLooped;
    private ForkContext forkContext;
    private ChoiceContext choiceContext;
    private ChainContext chainContext;
    private SwitchContext switchContext;
    private TryContext tryContext;
    private LoopContext loopContext;
    private BreakContext breakContext;

    private int[] currentSegments = new int[0];
    private final int initialSegment;
    private final List<Integer> finalSegments = new ArrayList<>();
    private final List<Integer> returnedSegments = new ArrayList<>();
    private final List<Integer> thrownSegments = new ArrayList<>();

    CodePathState(IdGenerator idGenerator, SegmentArena arena, BiConsumer<Integer, Integer> onLooped) {
        this.idGenerator = idGenerator;
        this.arena = arena;
        this.onLooped = onLooped;
        this.forkContext = ForkContext.newRoot(idGenerator, arena);
        this.initialSegment = forkContext.head()[0];
    }

    // === Accessors ===

    int initialSegment() {
        return initialSegment;
    }

    List<Integer> finalSegments() {
        return finalSegments;
    }

    List<Integer> returnedSegments() {
        return returnedSegments;
    }

    List<Integer> thrownSegments() {
        return thrownSegments;
    }

    int[] currentSegments() {
        return currentSegments;
    }

    void setCurrentSegments(int[] segments) {
        currentSegments = segments;
    }

    int[] headSegments() {
        return forkContext.head();
    }

    boolean isReachable() {
        return forkContext.reachable();
    }

    private ForkContext parentForkContext() {
        return forkContext.upper();
    }

    /**
     * Checks that every construct opened on this code path was closed.
     */
    void assertBalanced() {
        if (choiceContext != null || switchContext != null || tryContext != null
                || loopContext != null || breakContext != null || chainContext != null
                || forkContext.upper() != null) {
            throw new IllegalStateException("Code path finished with unclosed constructs");
        }
    }

    // === Fork contexts ===

    ForkContext pushForkContext(boolean forkLeavingPath) {
        forkContext = ForkContext.newEmpty(forkContext, forkLeavingPath);
        return forkContext;
    }

    ForkContext popForkContext() {
        ForkContext lastContext = forkContext;
        if (lastContext.upper() == null) {
            throw new IllegalStateException("Cannot pop the root fork context");
        }
        forkContext = lastContext.upper();
        forkContext.replaceHead(lastContext.makeNext(0, -1));
        return lastContext;
    }

    void forkPath() {
        forkContext.add(parentForkContext().makeNext(-1, -1));
    }

    void forkBypassPath() {
        forkContext.add(parentForkContext().head());
    }

    // === Choices: &&, ||, ??, if, ternary ===

    void pushChoiceContext(ChoiceKind kind, boolean isForkingAsResult) {
        choiceContext = new ChoiceContext(choiceContext, kind, isForkingAsResult, forkContext);
    }

    private ChoiceContext popChoiceContext() {
        ChoiceContext context = requireChoiceContext();
        choiceContext = context.upper;

        int[] headSegments = forkContext.head();

        switch (context.kind) {
            case LOGICAL_AND, LOGICAL_OR, NULL_COALESCE -> {
                if (!context.processed) {
                    context.trueForkContext.add(headSegments);
                    context.falseForkContext.add(headSegments);
                    context.qqForkContext.add(headSegments);
                }
                if (context.isForkingAsResult) {
                    ChoiceContext parent = requireChoiceContext();
                    parent.trueForkContext.addAll(context.trueForkContext);
                    parent.falseForkContext.addAll(context.falseForkContext);
                    parent.qqForkContext.addAll(context.qqForkContext);
                    parent.processed = true;
                    return context;
                }
            }
            case TEST -> {
                if (!context.processed) {
                    context.trueForkContext.clear();
                    context.trueForkContext.add(headSegments);
                } else {
                    context.falseForkContext.clear();
                    context.falseForkContext.add(headSegments);
                }
            }
            case LOOP -> {
                return context;
            }
        }

        ForkContext prevForkContext = context.trueForkContext;
        prevForkContext.addAll(context.falseForkContext);
        forkContext.replaceHead(prevForkContext.makeNext(0, -1));
        return context;
    }

    void popChoice() {
        popChoiceContext();
    }

    /**
     * Starts the right operand of a logical expression.
     */
    void makeLogicalRight() {
        ChoiceContext context = requireChoiceContext();

        if (context.processed) {
            // The left side was itself a logical expression that already forked
            ForkContext prevForkContext = switch (context.kind) {
                case LOGICAL_AND -> context.trueForkContext;
                case LOGICAL_OR -> context.falseForkContext;
                default -> context.qqForkContext;
            };
            forkContext.replaceHead(prevForkContext.makeNext(0, -1));
            prevForkContext.clear();
            context.processed = false;
        } else {
            switch (context.kind) {
                case LOGICAL_AND -> context.falseForkContext.add(forkContext.head());
                case LOGICAL_OR -> context.trueForkContext.add(forkContext.head());
                default -> {
                    context.trueForkContext.add(forkContext.head());
                    context.falseForkContext.add(forkContext.head());
                }
            }
            forkContext.replaceHead(forkContext.makeNext(-1, -1));
        }
    }

    void makeIfConsequent() {
        ChoiceContext context = requireChoiceContext();

        if (!context.processed) {
            context.trueForkContext.add(forkContext.head());
            context.falseForkContext.add(forkContext.head());
            context.qqForkContext.add(forkContext.head());
        }
        context.processed = false;
        forkContext.replaceHead(context.trueForkContext.makeNext(0, -1));
    }

    void makeIfAlternate() {
        ChoiceContext context = requireChoiceContext();

        context.trueForkContext.clear();
        context.trueForkContext.add(forkContext.head());
        context.processed = true;
        forkContext.replaceHead(context.falseForkContext.makeNext(0, -1));
    }

    private ChoiceContext requireChoiceContext() {
        if (choiceContext == null) {
            throw new IllegalStateException("No enclosing choice context");
        }
        return choiceContext;
    }

    // === Optional chains ===

    void pushChainContext() {
        chainContext = new ChainContext(chainContext);
    }

    void popChainContext() {
        ChainContext context = chainContext;
        if (context == null) {
            throw new IllegalStateException("No enclosing chain context");
        }
        chainContext = context.upper;
        for (int i = 0; i < context.countChoiceContexts; i++) {
            popChoiceContext();
        }
    }

    /**
     * Called at a {@code ?.} link; the rest of the chain may be skipped.
     */
    void makeOptionalNode() {
        if (chainContext != null) {
            chainContext.countChoiceContexts++;
            pushChoiceContext(ChoiceKind.NULL_COALESCE, false);
        }
    }

    void makeOptionalRight() {
        if (chainContext != null) {
            makeLogicalRight();
        }
    }

    // === switch ===

    void pushSwitchContext(boolean hasCase, String label) {
        switchContext = new SwitchContext(switchContext, hasCase);
        pushBreakContext(true, label);
    }

    void popSwitchContext() {
        SwitchContext context = switchContext;
        if (context == null) {
            throw new IllegalStateException("No enclosing switch context");
        }
        switchContext = context.upper;

        ForkContext currentForkContext = forkContext;
        ForkContext brokenForkContext = popBreakContext().brokenForkContext;

        if (context.countForks == 0) {
            // No case bodies; only the breaks need connecting
            if (!brokenForkContext.empty()) {
                brokenForkContext.add(currentForkContext.makeNext(-1, -1));
                currentForkContext.replaceHead(brokenForkContext.makeNext(0, -1));
            }
            return;
        }

        int[] lastSegments = currentForkContext.head();
        forkBypassPath();
        int[] lastCaseSegments = currentForkContext.head();

        brokenForkContext.add(lastSegments);

        if (!context.lastIsDefault) {
            if (context.defaultBodySegments != null) {
                // No case matched: control jumps to the default body, which is not last
                removeConnection(context.defaultSegments, context.defaultBodySegments);
                makeLooped(lastCaseSegments, context.defaultBodySegments);
            } else {
                brokenForkContext.add(lastCaseSegments);
            }
        }

        for (int i = 0; i < context.countForks; i++) {
            forkContext = forkContext.upper();
        }
        forkContext.replaceHead(brokenForkContext.makeNext(0, -1));
    }

    void makeSwitchCaseBody(boolean isEmpty, boolean isDefault) {
        SwitchContext context = switchContext;
        if (context == null) {
            throw new IllegalStateException("No enclosing switch context");
        }
        if (!context.hasCase) {
            return;
        }

        ForkContext parentContext = forkContext;
        ForkContext caseContext = pushForkContext(false);
        caseContext.add(parentContext.makeNext(0, -1));

        if (isDefault) {
            context.defaultSegments = parentContext.head();
            if (isEmpty) {
                context.foundDefault = true;
            } else {
                context.defaultBodySegments = caseContext.head();
            }
        } else if (!isEmpty && context.foundDefault) {
            context.foundDefault = false;
            context.defaultBodySegments = caseContext.head();
        }

        context.lastIsDefault = isDefault;
        context.countForks++;
    }

    // === try / catch / finally ===

    void pushTryContext(boolean hasFinalizer) {
        tryContext = new TryContext(tryContext, hasFinalizer, forkContext, breakContext, loopContext);
    }

    void popTryContext() {
        TryContext context = tryContext;
        if (context == null) {
            throw new IllegalStateException("No enclosing try context");
        }
        tryContext = context.upper;

        if (context.position == TryPosition.CATCH) {
            popForkContext();
            return;
        }

        ForkContext returned = context.returnedForkContext;
        ForkContext thrown = context.thrownForkContext;

        if (!context.hasLeavingPaths()) {
            return;
        }

        // The finally block ran with the normal path and the leaving path side by side
        int[] headSegments = forkContext.head();
        forkContext = forkContext.upper();
        int half = headSegments.length / 2;
        int[] normalSegments = Arrays.copyOfRange(headSegments, 0, half);
        int[] leavingSegments = Arrays.copyOfRange(headSegments, half, headSegments.length);

        if (returned != null && !returned.empty()) {
            addToReturnContext(leavingSegments);
        }
        if (!thrown.empty()) {
            addToThrowContext(leavingSegments);
        }
        for (PendingJump jump : context.jumps) {
            if (jump.breakTarget != null) {
                addToBreakTarget(jump.breakTarget, leavingSegments);
            } else {
                addToContinueTarget(jump.continueTarget, leavingSegments);
            }
        }

        forkContext.replaceHead(normalSegments);
    }

    void makeCatchBlock() {
        TryContext context = requireTryContext();
        ForkContext currentForkContext = forkContext;
        ForkContext thrown = context.thrownForkContext;

        context.position = TryPosition.CATCH;
        context.thrownForkContext = ForkContext.newEmpty(currentForkContext);

        // The end of the try block may also reach the catch block
        thrown.add(currentForkContext.head());
        int[] thrownSegments = thrown.makeNext(0, -1);

        pushForkContext(false);
        forkBypassPath();
        forkContext.add(thrownSegments);
    }

    void makeFinallyBlock() {
        TryContext context = requireTryContext();
        ForkContext currentForkContext = forkContext;
        ForkContext returned = context.returnedForkContext;
        ForkContext thrown = context.thrownForkContext;
        int[] headOfLeavingSegments = currentForkContext.head();

        if (context.position == TryPosition.CATCH) {
            popForkContext();
            currentForkContext = forkContext;
        }
        context.position = TryPosition.FINALLY;

        if (!context.hasLeavingPaths()) {
            return;
        }

        // Normal path first, then one leaving path merging every return, throw, break and continue
        int[] normal = currentForkContext.makeNext(-1, -1);
        int count = currentForkContext.count();
        int[] segments = Arrays.copyOf(normal, count * 2);
        for (int i = 0; i < count; i++) {
            List<Integer> prevs = new ArrayList<>();
            prevs.add(headOfLeavingSegments[i]);
            for (int[] returnedSegments : returned.segmentsList()) {
                prevs.add(returnedSegments[i]);
            }
            for (int[] thrownSegments : thrown.segmentsList()) {
                prevs.add(thrownSegments[i]);
            }
            for (PendingJump jump : context.jumps) {
                for (int[] jumpSegments : jump.segments.segmentsList()) {
                    prevs.add(jumpSegments[i]);
                }
            }
            segments[count + i] = newNextSegment(prevs);
        }

        pushForkContext(true);
        forkContext.add(segments);
    }

    private int newNextSegment(List<Integer> prevs) {
        return arena.newNext(idGenerator.next(), prevs.stream().mapToInt(Integer::intValue).toArray());
    }

    /**
     * Within a try block, the first node that may throw opens a path to the
     * catch handler.
     */
    void makeFirstThrowablePathInTryBlock() {
        ForkContext currentForkContext = forkContext;
        if (!currentForkContext.reachable()) {
            return;
        }

        TryContext context = getThrowContext();
        if (context == null || context.position != TryPosition.TRY || !context.thrownForkContext.empty()) {
            return;
        }

        context.thrownForkContext.add(currentForkContext.head());
        currentForkContext.replaceHead(currentForkContext.makeNext(-1, -1));
    }

    private TryContext requireTryContext() {
        if (tryContext == null) {
            throw new IllegalStateException("No enclosing try context");
        }
        return tryContext;
    }

    // === Loops ===

    void pushLoopContext(LoopKind kind, String label) {
        ForkContext brokenForkContext = pushBreakContext(true, label).brokenForkContext;

        if (kind != LoopKind.FOR_IN) {
            pushChoiceContext(ChoiceKind.LOOP, false);
        }
        LoopContext context = new LoopContext(loopContext, kind, label, brokenForkContext);
        if (kind == LoopKind.DO_WHILE) {
            context.continueForkContext = ForkContext.newEmpty(forkContext);
        }
        loopContext = context;
    }

    void popLoopContext() {
        LoopContext context = requireLoopContext();
        loopContext = context.upper;

        ForkContext currentForkContext = forkContext;
        ForkContext brokenForkContext = popBreakContext().brokenForkContext;

        switch (context.kind) {
            case WHILE, FOR -> {
                popChoiceContext();
                makeLooped(currentForkContext.head(), context.continueDestSegments);
            }
            case DO_WHILE -> {
                ChoiceContext choice = popChoiceContext();
                if (!choice.processed) {
                    choice.trueForkContext.add(currentForkContext.head());
                    choice.falseForkContext.add(currentForkContext.head());
                }
                if (!Boolean.TRUE.equals(context.test)) {
                    brokenForkContext.addAll(choice.falseForkContext);
                }
                // Every true path jumps back to the start of the body
                for (int[] segments : choice.trueForkContext.segmentsList()) {
                    makeLooped(segments, context.entrySegments);
                }
            }
            case FOR_IN -> {
                brokenForkContext.add(currentForkContext.head());
                makeLooped(currentForkContext.head(), context.leftSegments);
            }
        }

        if (brokenForkContext.empty()) {
            currentForkContext.replaceHead(currentForkContext.makeUnreachable(-1, -1));
        } else {
            currentForkContext.replaceHead(brokenForkContext.makeNext(0, -1));
        }
    }

    void makeWhileTest(Boolean test) {
        LoopContext context = requireLoopContext();
        int[] testSegments = forkContext.makeNext(0, -1);

        context.test = test;
        context.continueDestSegments = testSegments;
        forkContext.replaceHead(testSegments);
    }

    void makeWhileBody() {
        LoopContext context = requireLoopContext();
        ChoiceContext choice = requireChoiceContext();

        if (!choice.processed) {
            choice.trueForkContext.add(forkContext.head());
            choice.falseForkContext.add(forkContext.head());
        }
        if (!Boolean.TRUE.equals(context.test)) {
            context.brokenForkContext.addAll(choice.falseForkContext);
        }
        forkContext.replaceHead(choice.trueForkContext.makeNext(0, -1));
    }

    void makeDoWhileBody() {
        LoopContext context = requireLoopContext();
        int[] bodySegments = forkContext.makeNext(-1, -1);

        context.entrySegments = bodySegments;
        forkContext.replaceHead(bodySegments);
    }

    void makeDoWhileTest(Boolean test) {
        LoopContext context = requireLoopContext();
        context.test = test;

        // continue statements jump to the test
        if (!context.continueForkContext.empty()) {
            context.continueForkContext.add(forkContext.head());
            int[] testSegments = context.continueForkContext.makeNext(0, -1);
            forkContext.replaceHead(testSegments);
        }
    }

    void makeForTest(Boolean test) {
        LoopContext context = requireLoopContext();
        int[] endOfInitSegments = forkContext.head();
        int[] testSegments = forkContext.makeNext(-1, -1);

        context.test = test;
        context.endOfInitSegments = endOfInitSegments;
        context.testSegments = testSegments;
        context.continueDestSegments = testSegments;
        forkContext.replaceHead(testSegments);
    }

    void makeForUpdate() {
        LoopContext context = requireLoopContext();
        ChoiceContext choice = requireChoiceContext();

        if (context.testSegments != null) {
            finalizeTestSegmentsOfFor(context, choice, forkContext.head());
        } else {
            context.endOfInitSegments = forkContext.head();
        }

        int[] updateSegments = forkContext.makeDisconnected(-1, -1);
        context.updateSegments = updateSegments;
        context.continueDestSegments = updateSegments;
        forkContext.replaceHead(updateSegments);
    }

    void makeForBody() {
        LoopContext context = requireLoopContext();
        ChoiceContext choice = requireChoiceContext();

        if (context.updateSegments != null) {
            context.endOfUpdateSegments = forkContext.head();
            // update -> test
            if (context.testSegments != null) {
                makeLooped(context.endOfUpdateSegments, context.testSegments);
            }
        } else if (context.testSegments != null) {
            finalizeTestSegmentsOfFor(context, choice, forkContext.head());
        } else {
            context.endOfInitSegments = forkContext.head();
        }

        int[] bodySegments = context.endOfTestSegments;
        if (bodySegments == null) {
            // Without a test, the body follows the init and the update parts
            ForkContext prevForkContext = ForkContext.newEmpty(forkContext);
            prevForkContext.add(context.endOfInitSegments);
            if (context.endOfUpdateSegments != null) {
                prevForkContext.add(context.endOfUpdateSegments);
            }
            bodySegments = prevForkContext.makeNext(0, -1);
        }
        if (context.continueDestSegments == null) {
            context.continueDestSegments = bodySegments;
        }
        forkContext.replaceHead(bodySegments);
    }

    private void finalizeTestSegmentsOfFor(LoopContext context, ChoiceContext choice, int[] head) {
        if (!choice.processed) {
            choice.trueForkContext.add(head);
            choice.falseForkContext.add(head);
            choice.qqForkContext.add(head);
        }
        if (!Boolean.TRUE.equals(context.test)) {
            context.brokenForkContext.addAll(choice.falseForkContext);
        }
        context.endOfTestSegments = choice.trueForkContext.makeNext(0, -1);
    }

    void makeForInOfLeft() {
        LoopContext context = requireLoopContext();
        int[] leftSegments = forkContext.makeDisconnected(-1, -1);

        context.prevSegments = forkContext.head();
        context.leftSegments = leftSegments;
        context.continueDestSegments = leftSegments;
        forkContext.replaceHead(leftSegments);
    }

    void makeForInOfRight() {
        LoopContext context = requireLoopContext();
        ForkContext temp = ForkContext.newEmpty(forkContext);
        temp.add(context.prevSegments);
        int[] rightSegments = temp.makeNext(-1, -1);

        context.endOfLeftSegments = forkContext.head();
        forkContext.replaceHead(rightSegments);
    }

    void makeForInOfBody() {
        LoopContext context = requireLoopContext();
        ForkContext temp = ForkContext.newEmpty(forkContext);
        temp.add(context.endOfLeftSegments);
        int[] bodySegments = temp.makeNext(-1, -1);

        // right -> left, and leaving the loop when the iteration is exhausted
        makeLooped(forkContext.head(), context.leftSegments);
        context.brokenForkContext.add(forkContext.head());
        forkContext.replaceHead(bodySegments);
    }

    private LoopContext requireLoopContext() {
        if (loopContext == null) {
            throw new IllegalStateException("No enclosing loop context");
        }
        return loopContext;
    }

    // === break / continue / labels ===

    BreakContext pushBreakContext(boolean breakable, String label) {
        breakContext = new BreakContext(breakContext, breakable, label, ForkContext.newEmpty(forkContext));
        return breakContext;
    }

    BreakContext popBreakContext() {
        BreakContext context = breakContext;
        if (context == null) {
            throw new IllegalStateException("No enclosing break context");
        }
        breakContext = context.upper;

        // A labeled block joins its breaks here; loops and switches do it themselves
        if (!context.breakable) {
            ForkContext brokenForkContext = context.brokenForkContext;
            if (!brokenForkContext.empty()) {
                brokenForkContext.add(forkContext.head());
                forkContext.replaceHead(brokenForkContext.makeNext(0, -1));
            }
        }
        return context;
    }

    void makeBreak(String label) {
        if (!forkContext.reachable()) {
            return;
        }
        BreakContext context = getBreakContext(label);
        if (context != null) {
            addToBreakTarget(context, forkContext.head());
        }
        forkContext.replaceHead(forkContext.makeUnreachable(-1, -1));
    }

    void makeContinue(String label) {
        if (!forkContext.reachable()) {
            return;
        }
        LoopContext context = getContinueContext(label);
        if (context != null) {
            addToContinueTarget(context, forkContext.head());
        }
        forkContext.replaceHead(forkContext.makeUnreachable(-1, -1));
    }

    private void addToBreakTarget(BreakContext target, int[] segments) {
        TryContext finalizer = getJumpFinalizer(target, null);
        if (finalizer != null) {
            finalizer.jumpSegments(target, null).add(segments);
        } else {
            target.brokenForkContext.add(segments);
        }
    }

    private void addToContinueTarget(LoopContext target, int[] segments) {
        TryContext finalizer = getJumpFinalizer(null, target);
        if (finalizer != null) {
            finalizer.jumpSegments(null, target).add(segments);
        } else if (target.kind == LoopKind.DO_WHILE) {
            target.continueForkContext.add(segments);
        } else {
            makeLooped(segments, target.continueDestSegments);
            // continue in for-in/of also leaves the loop when the iteration is exhausted
            if (target.kind == LoopKind.FOR_IN) {
                target.brokenForkContext.add(segments);
            }
        }
    }

    /**
     * The innermost try block with a pending finally block between the
     * current position and a jump target, if any.
     */
    private TryContext getJumpFinalizer(BreakContext breakTarget, LoopContext continueTarget) {
        for (TryContext context = tryContext; context != null; context = context.upper) {
            boolean inside = breakTarget != null ? context.isInside(breakTarget) : context.isInside(continueTarget);
            if (!inside) {
                return null;
            }
            if (context.hasFinalizer && context.position != TryPosition.FINALLY) {
                return context;
            }
        }
        return null;
    }

    void makeReturn() {
        if (!forkContext.reachable()) {
            return;
        }
        addToReturnContext(forkContext.head());
        forkContext.replaceHead(forkContext.makeUnreachable(-1, -1));
    }

    void makeThrow() {
        if (!forkContext.reachable()) {
            return;
        }
        addToThrowContext(forkContext.head());
        forkContext.replaceHead(forkContext.makeUnreachable(-1, -1));
    }

    /**
     * Records the segments current at the end of the code path as returned.
     */
    void makeFinal() {
        if (currentSegments.length > 0 && arena.isReachable(currentSegments[0])) {
            addReturned(currentSegments);
        }
    }

    private BreakContext getBreakContext(String label) {
        for (BreakContext context = breakContext; context != null; context = context.upper) {
            if (label == null ? context.breakable : label.equals(context.label)) {
                return context;
            }
        }
        return null;
    }

    private LoopContext getContinueContext(String label) {
        if (label == null) {
            return loopContext;
        }
        for (LoopContext context = loopContext; context != null; context = context.upper) {
            if (label.equals(context.label)) {
                return context;
            }
        }
        return null;
    }

    private void addToReturnContext(int[] segments) {
        for (TryContext context = tryContext; context != null; context = context.upper) {
            if (context.hasFinalizer && context.position != TryPosition.FINALLY) {
                context.returnedForkContext.add(segments);
                return;
            }
        }
        addReturned(segments);
    }

    private TryContext getThrowContext() {
        for (TryContext context = tryContext; context != null; context = context.upper) {
            if (context.position == TryPosition.TRY
                    || (context.hasFinalizer && context.position == TryPosition.CATCH)) {
                return context;
            }
        }
        return null;
    }

    private void addToThrowContext(int[] segments) {
        TryContext context = getThrowContext();
        if (context != null) {
            context.thrownForkContext.add(segments);
        } else {
            addThrown(segments);
        }
    }

    private void addReturned(int[] segments) {
        for (int segment : segments) {
            returnedSegments.add(segment);
            if (!thrownSegments.contains(segment)) {
                finalSegments.add(segment);
            }
        }
    }

    private void addThrown(int[] segments) {
        for (int segment : segments) {
            thrownSegments.add(segment);
            if (!returnedSegments.contains(segment)) {
                finalSegments.add(segment);
            }
        }
    }

    // === Graph helpers ===

    private void removeConnection(int[] prevSegments, int[] nextSegments) {
        for (int i = 0; i < prevSegments.length && i < nextSegments.length; i++) {
            CodePathSegment prev = arena.get(prevSegments[i]);
            CodePathSegment next = arena.get(nextSegments[i]);
            Integer nextHandle = nextSegments[i];
            Integer prevHandle = prevSegments[i];
            prev.nextSegments.remove(nextHandle);
            prev.allNextSegments.remove(nextHandle);
            next.prevSegments.remove(prevHandle);
            next.allPrevSegments.remove(prevHandle);
        }
    }

    /**
     * Adds back-edges from the end of a loop body to its start.
     */
    private void makeLooped(int[] unflattenedFromSegments, int[] unflattenedToSegments) {
        List<Integer> fromSegments = arena.flattenUnusedSegments(unflattenedFromSegments);
        List<Integer> toSegments = arena.flattenUnusedSegments(unflattenedToSegments);

        int end = Math.min(fromSegments.size(), toSegments.size());
        for (int i = 0; i < end; i++) {
            int fromHandle = fromSegments.get(i);
            int toHandle = toSegments.get(i);
            CodePathSegment from = arena.get(fromHandle);
            CodePathSegment to = arena.get(toHandle);

            if (to.isReachable()) {
                from.nextSegments.add(toHandle);
            }
            if (from.isReachable()) {
                to.prevSegments.add(fromHandle);
            }
            from.allNextSegments.add(toHandle);
            to.allPrevSegments.add(fromHandle);

            if (to.allPrevSegments.size() >= 2) {
                arena.markPrevSegmentAsLooped(toHandle, fromHandle);
            }
            onLooped.accept(fromHandle, toHandle);
        }
    }
}
