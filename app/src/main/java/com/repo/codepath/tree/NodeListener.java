package com.repo.codepath.tree;

/**
 * Receives the enter/exit events of a {@link TreeWalker} walk.
 */
public interface NodeListener {

    default void enterNode(SyntaxNode node) {
    }

    default void exitNode(SyntaxNode node) {
    }

    /**
     * Called once after the last exit event of the walk.
     */
    default void onTraversalComplete(FileContext context) {
    }
}
