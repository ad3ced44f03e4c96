package com.repo.codepath.codepath;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ForkContextTest {

    private final SegmentArena arena = new SegmentArena();
    private final ForkContext root = ForkContext.newRoot(new IdGenerator("s1_"), arena);

    @Test
    void testRootHasInitialSegment() {
        assertEquals(1, root.count());
        assertEquals("s1_1", arena.get(root.head()[0]).id());
        assertTrue(root.reachable());
        assertFalse(root.empty());
    }

    @Test
    void testJoinOfUsedSegments() {
        ForkContext branches = ForkContext.newEmpty(root);
        int[] left = root.makeNext(-1, -1);
        int[] right = root.makeNext(-1, -1);
        arena.markUsed(left[0]);
        arena.markUsed(right[0]);
        branches.add(left);
        branches.add(right);

        int join = branches.makeNext(0, -1)[0];

        assertEquals(List.of(left[0], right[0]), arena.get(join).allPrevSegments());
        assertTrue(arena.get(join).isReachable());
    }

    @Test
    void testUnusedSegmentsAreFlattened() {
        ForkContext branches = ForkContext.newEmpty(root);
        branches.add(root.makeNext(-1, -1));
        branches.add(root.makeNext(-1, -1));

        int join = branches.makeNext(0, -1)[0];

        assertEquals(List.of(root.head()[0]), arena.get(join).allPrevSegments());
    }

    @Test
    void testUnreachableSegmentsStayUnreachable() {
        int[] dead = root.makeUnreachable(-1, -1);
        assertFalse(arena.get(dead[0]).isReachable());
        assertTrue(arena.get(dead[0]).isUsed());

        ForkContext context = ForkContext.newEmpty(root);
        context.add(dead);
        assertFalse(context.reachable());
        assertFalse(arena.get(context.makeNext(-1, -1)[0]).isReachable());
    }

    @Test
    void testLeavingPathDoublesGroupSize() {
        ForkContext finallyContext = ForkContext.newEmpty(root, true);
        assertEquals(2, finallyContext.count());
        assertThrows(IllegalStateException.class, () -> finallyContext.add(root.head()));

        int[] four = new int[4];
        for (int i = 0; i < four.length; i++) {
            four[i] = root.makeNext(-1, -1)[0];
            arena.markUsed(four[i]);
        }
        finallyContext.add(four);

        int[] head = finallyContext.head();
        assertEquals(2, head.length);
        assertEquals(List.of(four[0], four[2]), arena.get(head[0]).allPrevSegments());
        assertEquals(List.of(four[1], four[3]), arena.get(head[1]).allPrevSegments());
    }

    @Test
    void testContractViolations() {
        ForkContext empty = ForkContext.newEmpty(root);
        assertThrows(IllegalStateException.class, empty::head);
        assertThrows(IllegalStateException.class, () -> empty.replaceHead(root.head()));
        assertThrows(IllegalStateException.class, () -> root.addAll(ForkContext.newEmpty(root, true)));
        assertThrows(IllegalStateException.class, () -> arena.get(99));
    }
}
