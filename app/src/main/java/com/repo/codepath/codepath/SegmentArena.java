package com.repo.codepath.codepath;

import java.util.*;

/**
 * Append-only store of every segment created while analyzing one file.
 * Segments are never removed, so handles stay valid for the whole lint pass.
 */
public final class SegmentArena {

    private final List<CodePathSegment> segments = new ArrayList<>();

    public CodePathSegment get(int handle) {
        if (handle < 0 || handle >= segments.size()) {
            throw new IllegalStateException("Unknown segment handle " + handle);
        }
        return segments.get(handle);
    }

    public int size() {
        return segments.size();
    }

    public boolean isReachable(int handle) {
        return get(handle).isReachable();
    }

    int newRoot(String id) {
        return create(id, List.of(), true);
    }

    /**
     * Segment following the given ones; reachable if any of them is.
     */
    int newNext(String id, int[] allPrevSegments) {
        return create(id, flattenUnusedSegments(allPrevSegments), anyReachable(allPrevSegments));
    }

    int newUnreachable(String id, int[] allPrevSegments) {
        int segment = create(id, flattenUnusedSegments(allPrevSegments), false);
        markUsed(segment);
        return segment;
    }

    /**
     * Segment with no predecessor links yet; reachability is taken from the
     * given segments. The links are added later through a loop.
     */
    int newDisconnected(String id, int[] allPrevSegments) {
        return create(id, new ArrayList<>(), anyReachable(allPrevSegments), new ArrayList<>());
    }

    private int create(String id, List<Integer> allPrevSegments, boolean reachable) {
        List<Integer> prevs = new ArrayList<>();
        for (int prev : allPrevSegments) {
            if (get(prev).isReachable()) {
                prevs.add(prev);
            }
        }
        return create(id, new ArrayList<>(allPrevSegments), reachable, prevs);
    }

    private int create(String id, List<Integer> allPrevSegments, boolean reachable, List<Integer> prevSegments) {
        int handle = segments.size();
        segments.add(new CodePathSegment(handle, id, allPrevSegments, prevSegments, reachable));
        return handle;
    }

    /**
     * Links a segment into its predecessors the first time it becomes current.
     */
    void markUsed(int handle) {
        CodePathSegment segment = get(handle);
        if (segment.isUsed()) {
            return;
        }
        segment.setUsed();

        if (segment.isReachable()) {
            for (int prev : segment.allPrevSegments) {
                CodePathSegment prevSegment = get(prev);
                prevSegment.allNextSegments.add(handle);
                prevSegment.nextSegments.add(handle);
            }
        } else {
            for (int prev : segment.allPrevSegments) {
                get(prev).allNextSegments.add(handle);
            }
        }
    }

    void markPrevSegmentAsLooped(int segment, int prevSegment) {
        get(segment).loopedPrevSegments.add(prevSegment);
    }

    /**
     * Replaces segments that were never used by their own predecessors, so no
     * link points at a segment that never became current.
     */
    List<Integer> flattenUnusedSegments(int[] segments) {
        Set<Integer> done = new LinkedHashSet<>();
        for (int handle : segments) {
            CodePathSegment segment = get(handle);
            if (segment.isUsed()) {
                done.add(handle);
            } else {
                done.addAll(segment.allPrevSegments);
            }
        }
        return new ArrayList<>(done);
    }

    private boolean anyReachable(int[] handles) {
        for (int handle : handles) {
            if (get(handle).isReachable()) {
                return true;
            }
        }
        return false;
    }
}
