package com.repo.codepath.codepath;

/**
 * Handed to segment visitors to steer a traversal.
 */
public final class TraversalController {

    private Integer parentSegment;
    private Integer skippedSegment;
    private boolean stopped;

    TraversalController() {
    }

    /**
     * Functional callback of {@link CodePath#traverseSegments}.
     */
    @FunctionalInterface
    public interface SegmentVisitor {
        void visit(CodePathSegment segment, TraversalController controller);
    }

    void prepare(Integer parentSegment) {
        this.parentSegment = parentSegment;
    }

    /**
     * Does not visit the successors of the current segment.
     */
    public void skip() {
        if (parentSegment == null) {
            stopped = true;
        } else {
            skippedSegment = parentSegment;
        }
    }

    /**
     * Ends the traversal.
     */
    public void stop() {
        stopped = true;
    }

    boolean isStopped() {
        return stopped;
    }

    Integer skippedSegment() {
        return skippedSegment;
    }

    void clearSkippedSegment() {
        skippedSegment = null;
    }
}
