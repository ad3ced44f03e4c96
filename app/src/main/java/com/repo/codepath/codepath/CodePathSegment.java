package com.repo.codepath.codepath;

import com.repo.codepath.tree.SyntaxNode;

import java.util.*;

/**
 * A basic block of a code path. Segments live in a {@link SegmentArena} and
 * refer to each other by integer handle.
 */
public final class CodePathSegment {

    /** Whether a node event was recorded on entering or on exiting the node. */
    public enum EventKind {
        ENTER, EXIT
    }

    public record NodeEvent(EventKind kind, SyntaxNode node) {
    }

    private final int handle;
    private final String id;
    private boolean reachable;
    private boolean used;

    final List<Integer> nextSegments = new ArrayList<>();
    final List<Integer> prevSegments;
    final List<Integer> allNextSegments = new ArrayList<>();
    final List<Integer> allPrevSegments;
    final List<Integer> loopedPrevSegments = new ArrayList<>();
    final List<NodeEvent> nodes = new ArrayList<>();

    CodePathSegment(int handle, String id, List<Integer> allPrevSegments, List<Integer> prevSegments,
            boolean reachable) {
        this.handle = handle;
        this.id = id;
        this.allPrevSegments = allPrevSegments;
        this.prevSegments = prevSegments;
        this.reachable = reachable;
    }

    /** Arena handle; handles grow in creation order. */
    public int handle() {
        return handle;
    }

    /** Label such as {@code s1_3}. */
    public String id() {
        return id;
    }

    /** Id of the owning code path, {@code s1} for {@code s1_3}. */
    public String codePathId() {
        return id.substring(0, id.lastIndexOf('_'));
    }

    public boolean isReachable() {
        return reachable;
    }

    void markUnreachable() {
        reachable = false;
    }

    public boolean isUsed() {
        return used;
    }

    void setUsed() {
        used = true;
    }

    /** Successors reachable from this segment. */
    public List<Integer> nextSegments() {
        return Collections.unmodifiableList(nextSegments);
    }

    /** Reachable predecessors. */
    public List<Integer> prevSegments() {
        return Collections.unmodifiableList(prevSegments);
    }

    /** Successors including unreachable ones. */
    public List<Integer> allNextSegments() {
        return Collections.unmodifiableList(allNextSegments);
    }

    /** Predecessors including unreachable ones. */
    public List<Integer> allPrevSegments() {
        return Collections.unmodifiableList(allPrevSegments);
    }

    /**
     * True when this segment is the target of a loop back-edge.
     */
    public boolean isLooped() {
        return !loopedPrevSegments.isEmpty();
    }

    public boolean isLoopedPrevSegment(int segment) {
        return loopedPrevSegments.contains(segment);
    }

    /** Node enter/exit events recorded while this segment was current. */
    public List<NodeEvent> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public List<SyntaxNode> enteredNodes() {
        return nodes.stream()
                .filter(event -> event.kind() == EventKind.ENTER)
                .map(NodeEvent::node)
                .toList();
    }

    @Override
    public String toString() {
        return id + (reachable ? "" : " (unreachable)");
    }
}
