package com.repo.codepath.rules;

import com.repo.codepath.tree.SyntaxNode;

/**
 * A problem reported by a rule.
 */
public record Violation(
        /** Name of the reporting rule */
        String rule,

        /** User-facing message */
        String message,

        /** Node the problem is attached to */
        SyntaxNode node) {

    /**
     * {@code line:column} of the node, or "?" when the tree has no positions.
     */
    public String location() {
        return node.start() == null ? "?" : node.start().toString();
    }

    public int line() {
        return node.start() == null ? 0 : node.start().row() + 1;
    }

    @Override
    public String toString() {
        return location() + " " + message + " (" + rule + ")";
    }
}
