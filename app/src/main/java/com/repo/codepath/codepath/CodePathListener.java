package com.repo.codepath.codepath;

import com.repo.codepath.tree.SyntaxNode;

/**
 * Observer of code path construction. Segment events are only fired for
 * reachable segments.
 */
public interface CodePathListener {

    default void onCodePathStart(CodePath codePath, SyntaxNode node) {
    }

    default void onCodePathEnd(CodePath codePath, SyntaxNode node) {
    }

    default void onSegmentStart(CodePathSegment segment, SyntaxNode node) {
    }

    default void onSegmentEnd(CodePathSegment segment, SyntaxNode node) {
    }

    /**
     * A back-edge was added from {@code from} to {@code to}.
     */
    default void onSegmentLoop(CodePathSegment from, CodePathSegment to, SyntaxNode node) {
    }
}
