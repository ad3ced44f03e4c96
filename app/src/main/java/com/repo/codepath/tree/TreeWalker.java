package com.repo.codepath.tree;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Depth-first walk over a syntax tree. Every node, named or anonymous, is
 * entered before its children and exited after them.
 */
public class TreeWalker {

    private final List<NodeListener> listeners;

    public TreeWalker(List<NodeListener> listeners) {
        this.listeners = List.copyOf(listeners);
    }

    private record Frame(SyntaxNode node, int nextChild) {
    }

    public void walk(FileContext context) {
        Deque<Frame> stack = new ArrayDeque<>();
        enter(context.root());
        stack.push(new Frame(context.root(), 0));

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            List<SyntaxNode> children = frame.node().children();
            if (frame.nextChild() < children.size()) {
                SyntaxNode child = children.get(frame.nextChild());
                stack.push(new Frame(frame.node(), frame.nextChild() + 1));
                enter(child);
                stack.push(new Frame(child, 0));
            } else {
                for (NodeListener listener : listeners) {
                    listener.exitNode(frame.node());
                }
            }
        }

        for (NodeListener listener : listeners) {
            listener.onTraversalComplete(context);
        }
    }

    private void enter(SyntaxNode node) {
        for (NodeListener listener : listeners) {
            listener.enterNode(node);
        }
    }
}
