package com.repo.codepath.codepath;

import com.repo.codepath.tree.SyntaxNode;

import java.util.*;
import java.util.function.BiConsumer;

/**
 * The control flow graph of one unit: the program, a function, a class field
 * initializer or a class static block.
 */
public final class CodePath {

    private final String id;
    private final CodePathOrigin origin;
    private final CodePath upper;
    private final SyntaxNode rootNode;
    private final SegmentArena arena;
    private final CodePathState state;
    private final List<CodePath> childCodePaths = new ArrayList<>();
    private boolean finished;

    CodePath(String id, CodePathOrigin origin, CodePath upper, SyntaxNode rootNode, SegmentArena arena,
            BiConsumer<Integer, Integer> onLooped) {
        this.id = id;
        this.origin = origin;
        this.upper = upper;
        this.rootNode = rootNode;
        this.arena = arena;
        this.state = new CodePathState(new IdGenerator(id + "_"), arena, onLooped);
        if (upper != null) {
            upper.childCodePaths.add(this);
        }
    }

    CodePathState state() {
        return state;
    }

    /** Label such as {@code s2}. */
    public String id() {
        return id;
    }

    public CodePathOrigin origin() {
        return origin;
    }

    public Optional<CodePath> upper() {
        return Optional.ofNullable(upper);
    }

    public SyntaxNode rootNode() {
        return rootNode;
    }

    public boolean isFinished() {
        return finished;
    }

    public List<CodePath> childCodePaths() {
        return Collections.unmodifiableList(childCodePaths);
    }

    public CodePathSegment initialSegment() {
        return arena.get(state.initialSegment());
    }

    /** Segments reached on completion, by return or by throw. */
    public List<CodePathSegment> finalSegments() {
        return resolve(state.finalSegments());
    }

    public List<CodePathSegment> returnedSegments() {
        return resolve(state.returnedSegments());
    }

    public List<CodePathSegment> thrownSegments() {
        return resolve(state.thrownSegments());
    }

    /**
     * Segments that are current at this point of the traversal; empty once
     * the code path is finished.
     */
    public List<CodePathSegment> currentSegments() {
        List<CodePathSegment> result = new ArrayList<>();
        for (int handle : state.currentSegments()) {
            result.add(arena.get(handle));
        }
        return result;
    }

    /**
     * Every segment owned by this code path, in creation order.
     */
    public List<CodePathSegment> segments() {
        List<CodePathSegment> result = new ArrayList<>();
        for (int handle = 0; handle < arena.size(); handle++) {
            CodePathSegment segment = arena.get(handle);
            if (segment.codePathId().equals(id)) {
                result.add(segment);
            }
        }
        return result;
    }

    public CodePathSegment segment(int handle) {
        return arena.get(handle);
    }

    /**
     * Visits reachable segments from the initial segment, each one after all
     * of its non-looping predecessors.
     */
    public void traverseSegments(TraversalController.SegmentVisitor visitor) {
        traverse(false, null, null, visitor);
    }

    /**
     * Like {@link #traverseSegments(TraversalController.SegmentVisitor)},
     * starting at {@code first} and not going past {@code last}. Either bound
     * may be null.
     */
    public void traverseSegments(CodePathSegment first, CodePathSegment last,
            TraversalController.SegmentVisitor visitor) {
        traverse(false, first == null ? null : first.handle(), last == null ? null : last.handle(), visitor);
    }

    /**
     * Visits every segment including unreachable ones.
     */
    public void traverseAllSegments(TraversalController.SegmentVisitor visitor) {
        traverse(true, null, null, visitor);
    }

    public void traverseAllSegments(CodePathSegment first, CodePathSegment last,
            TraversalController.SegmentVisitor visitor) {
        traverse(true, first == null ? null : first.handle(), last == null ? null : last.handle(), visitor);
    }

    private void traverse(boolean all, Integer first, Integer last, TraversalController.SegmentVisitor visitor) {
        int startSegment = first != null ? first : state.initialSegment();
        Set<Integer> visited = new HashSet<>();
        List<int[]> stack = new ArrayList<>();
        stack.add(new int[] {startSegment, 0});
        TraversalController controller = new TraversalController();

        while (!stack.isEmpty()) {
            int[] top = stack.get(stack.size() - 1);
            int handle = top[0];
            int index = top[1];
            CodePathSegment segment = arena.get(handle);
            List<Integer> prevs = all ? segment.allPrevSegments : segment.prevSegments;
            List<Integer> nexts = all ? segment.allNextSegments : segment.nextSegments;

            if (index == 0) {
                if (visited.contains(handle)) {
                    stack.remove(stack.size() - 1);
                    continue;
                }
                // Wait until every predecessor that is not a back-edge was visited
                if (handle != startSegment && !allVisited(segment, prevs, visited)) {
                    stack.remove(stack.size() - 1);
                    continue;
                }

                Integer skipped = controller.skippedSegment();
                if (skipped != null && prevs.contains(skipped)) {
                    controller.clearSkippedSegment();
                }
                visited.add(handle);

                if (controller.skippedSegment() == null) {
                    controller.prepare(stack.size() >= 2 ? stack.get(stack.size() - 2)[0] : null);
                    visitor.visit(segment, controller);
                    if (last != null && handle == last) {
                        controller.skip();
                    }
                    if (controller.isStopped()) {
                        break;
                    }
                }
            }

            int end = nexts.size() - 1;
            if (index < end) {
                top[1]++;
                stack.add(new int[] {nexts.get(index), 0});
            } else if (index == end) {
                top[0] = nexts.get(index);
                top[1] = 0;
            } else {
                stack.remove(stack.size() - 1);
            }
        }
    }

    private static boolean allVisited(CodePathSegment segment, List<Integer> prevs, Set<Integer> visited) {
        for (int prev : prevs) {
            if (!visited.contains(prev) && !segment.isLoopedPrevSegment(prev)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Finishes construction: marks segments that cannot be reached from the
     * initial segment as unreachable and unlinks them.
     */
    void finish() {
        state.assertBalanced();

        Set<Integer> live = new HashSet<>();
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(state.initialSegment());
        live.add(state.initialSegment());
        while (!queue.isEmpty()) {
            for (int next : arena.get(queue.poll()).nextSegments) {
                if (live.add(next)) {
                    queue.add(next);
                }
            }
        }

        Set<Integer> dead = new HashSet<>();
        List<CodePathSegment> owned = segments();
        for (CodePathSegment segment : owned) {
            if (segment.isUsed() && segment.isReachable() && !live.contains(segment.handle())) {
                segment.markUnreachable();
                dead.add(segment.handle());
            }
        }
        if (!dead.isEmpty()) {
            for (CodePathSegment segment : owned) {
                segment.prevSegments.removeAll(dead);
                segment.nextSegments.removeAll(dead);
            }
            state.finalSegments().removeAll(dead);
            state.returnedSegments().removeAll(dead);
            state.thrownSegments().removeAll(dead);
        }
        finished = true;
    }

    private List<CodePathSegment> resolve(List<Integer> handles) {
        List<CodePathSegment> result = new ArrayList<>(handles.size());
        for (int handle : handles) {
            result.add(arena.get(handle));
        }
        return result;
    }

    @Override
    public String toString() {
        return id + " (" + origin + ", " + rootNode.kind() + ")";
    }
}
