package com.repo.codepath.codepath;

import java.util.*;

/**
 * A stack frame of segment groups used while a construct is being built.
 *
 * <p>Each entry of {@link #segmentsList()} is one group of parallel segments.
 * A group normally holds a single segment; inside {@code finally} blocks the
 * normal path and the leaving path are tracked side by side, doubling the
 * group size ({@link #count()}) per nesting level.
 */
final class ForkContext {

    @FunctionalInterface
    private interface SegmentFactory {
        int create(String id, int[] allPrevSegments);
    }

    private final IdGenerator idGenerator;
    private final SegmentArena arena;
    private final ForkContext upper;
    private final int count;
    private final List<int[]> segmentsList = new ArrayList<>();

    private ForkContext(IdGenerator idGenerator, SegmentArena arena, ForkContext upper, int count) {
        this.idGenerator = idGenerator;
        this.arena = arena;
        this.upper = upper;
        this.count = count;
    }

    static ForkContext newRoot(IdGenerator idGenerator, SegmentArena arena) {
        ForkContext context = new ForkContext(idGenerator, arena, null, 1);
        context.add(new int[] {arena.newRoot(idGenerator.next())});
        return context;
    }

    static ForkContext newEmpty(ForkContext parent, boolean forkLeavingPath) {
        return new ForkContext(parent.idGenerator, parent.arena, parent,
                (forkLeavingPath ? 2 : 1) * parent.count);
    }

    static ForkContext newEmpty(ForkContext parent) {
        return newEmpty(parent, false);
    }

    ForkContext upper() {
        return upper;
    }

    int count() {
        return count;
    }

    List<int[]> segmentsList() {
        return Collections.unmodifiableList(segmentsList);
    }

    /**
     * The last group of segments.
     */
    int[] head() {
        if (segmentsList.isEmpty()) {
            throw new IllegalStateException("Fork context has no head segments");
        }
        return segmentsList.get(segmentsList.size() - 1);
    }

    boolean empty() {
        return segmentsList.isEmpty();
    }

    boolean reachable() {
        if (segmentsList.isEmpty()) {
            return false;
        }
        for (int segment : head()) {
            if (arena.isReachable(segment)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Creates segments following the groups {@code begin..end}. Negative
     * indices count from the end, so {@code (-1, -1)} is the head alone and
     * {@code (0, -1)} is every group.
     */
    int[] makeNext(int begin, int end) {
        return makeSegments(begin, end, arena::newNext);
    }

    int[] makeUnreachable(int begin, int end) {
        return makeSegments(begin, end, arena::newUnreachable);
    }

    int[] makeDisconnected(int begin, int end) {
        return makeSegments(begin, end, arena::newDisconnected);
    }

    void add(int[] segments) {
        if (segments.length < count) {
            throw new IllegalStateException(
                    "Expected at least " + count + " segments but got " + segments.length);
        }
        segmentsList.add(mergeExtraSegments(segments));
    }

    void replaceHead(int[] segments) {
        if (segments.length < count) {
            throw new IllegalStateException(
                    "Expected at least " + count + " segments but got " + segments.length);
        }
        if (segmentsList.isEmpty()) {
            throw new IllegalStateException("Fork context has no head segments to replace");
        }
        segmentsList.set(segmentsList.size() - 1, mergeExtraSegments(segments));
    }

    void addAll(ForkContext context) {
        if (context.count != count) {
            throw new IllegalStateException(
                    "Cannot merge fork contexts of size " + context.count + " and " + count);
        }
        segmentsList.addAll(context.segmentsList);
    }

    void clear() {
        segmentsList.clear();
    }

    private int[] makeSegments(int begin, int end, SegmentFactory factory) {
        int normalizedBegin = begin >= 0 ? begin : segmentsList.size() + begin;
        int normalizedEnd = end >= 0 ? end : segmentsList.size() + end;
        int width = Math.max(0, normalizedEnd - normalizedBegin + 1);

        int[] segments = new int[count];
        for (int i = 0; i < count; i++) {
            int[] allPrevSegments = new int[width];
            for (int j = 0; j < width; j++) {
                allPrevSegments[j] = segmentsList.get(normalizedBegin + j)[i];
            }
            segments[i] = factory.create(idGenerator.next(), allPrevSegments);
        }
        return segments;
    }

    /**
     * Joins pairs {@code [i]} and {@code [i + half]} until the group fits
     * this context's count.
     */
    private int[] mergeExtraSegments(int[] segments) {
        int[] current = segments;
        while (current.length > count) {
            int half = current.length / 2;
            int[] merged = new int[half];
            for (int i = 0; i < half; i++) {
                merged[i] = arena.newNext(idGenerator.next(), new int[] {current[i], current[i + half]});
            }
            current = merged;
        }
        return current;
    }
}
