package com.repo.codepath.tree;

import java.util.*;

/**
 * A node of a pre-built syntax tree.
 * Kinds follow the tree-sitter JavaScript grammar (e.g. "if_statement",
 * "binary_expression"). Anonymous nodes are tokens such as operators and
 * keywords; their kind and text are the token itself.
 */
public final class SyntaxNode {

    private final int id;
    private final String kind;
    private final boolean named;
    private final String text;
    private final Position start;
    private final List<SyntaxNode> children = new ArrayList<>();
    private final List<String> fieldNames = new ArrayList<>();
    private SyntaxNode parent;

    SyntaxNode(int id, String kind, boolean named, String text, Position start) {
        this.id = id;
        this.kind = kind;
        this.named = named;
        this.text = text;
        this.start = start;
    }

    /**
     * Start position of a node in its source file (zero-based, as printed by
     * tree-sitter).
     */
    public record Position(int row, int column) {
        @Override
        public String toString() {
            return (row + 1) + ":" + (column + 1);
        }
    }

    void appendChild(String fieldName, SyntaxNode child) {
        child.parent = this;
        children.add(child);
        fieldNames.add(fieldName);
    }

    /**
     * Sequential id in pre-order, unique within one tree.
     */
    public int id() {
        return id;
    }

    public String kind() {
        return kind;
    }

    public boolean isNamed() {
        return named;
    }

    public boolean isComment() {
        return NodeKinds.COMMENT.equals(kind);
    }

    public SyntaxNode parent() {
        return parent;
    }

    /**
     * Start position, or null when the tree dump carried no positions.
     */
    public Position start() {
        return start;
    }

    public List<SyntaxNode> children() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Named, non-comment children in order.
     */
    public List<SyntaxNode> namedChildren() {
        return children.stream()
                .filter(child -> child.named && !child.isComment())
                .toList();
    }

    public boolean hasNamedChildren() {
        return !namedChildren().isEmpty();
    }

    /**
     * First child labelled with the given field name, or null.
     */
    public SyntaxNode childByField(String fieldName) {
        for (int i = 0; i < children.size(); i++) {
            if (fieldName.equals(fieldNames.get(i))) {
                return children.get(i);
            }
        }
        return null;
    }

    /**
     * All children labelled with the given field name.
     */
    public List<SyntaxNode> childrenByField(String fieldName) {
        List<SyntaxNode> result = new ArrayList<>();
        for (int i = 0; i < children.size(); i++) {
            if (fieldName.equals(fieldNames.get(i))) {
                result.add(children.get(i));
            }
        }
        return result;
    }

    /**
     * Like {@link #childByField(String)} but fails when the field is missing.
     */
    public SyntaxNode field(String fieldName) {
        SyntaxNode child = childByField(fieldName);
        if (child == null) {
            throw new IllegalStateException("Node " + describe() + " has no field '" + fieldName + "'");
        }
        return child;
    }

    public boolean hasField(String fieldName) {
        return childByField(fieldName) != null;
    }

    public boolean hasChildOfKind(String childKind) {
        return children.stream().anyMatch(child -> child.kind.equals(childKind));
    }

    /**
     * Source text of a leaf, or the leaf texts of the subtree joined by spaces.
     */
    public String text() {
        if (text != null) {
            return text;
        }
        StringJoiner joiner = new StringJoiner(" ");
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(children.get(i));
        }
        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            if (node.isComment()) {
                continue;
            }
            if (node.text != null) {
                if (!node.text.isEmpty()) {
                    joiner.add(node.text);
                }
                continue;
            }
            for (int i = node.children.size() - 1; i >= 0; i--) {
                stack.push(node.children.get(i));
            }
        }
        return joiner.toString();
    }

    public boolean isSameOrDescendantOf(SyntaxNode ancestor) {
        for (SyntaxNode node = this; node != null; node = node.parent) {
            if (node == ancestor) {
                return true;
            }
        }
        return false;
    }

    public boolean isFirstNamedChild() {
        if (parent == null) {
            return false;
        }
        List<SyntaxNode> siblings = parent.namedChildren();
        return !siblings.isEmpty() && siblings.get(0) == this;
    }

    /**
     * Previous named, non-comment sibling, or null.
     */
    public SyntaxNode previousNamedSibling() {
        if (parent == null) {
            return null;
        }
        SyntaxNode previous = null;
        for (SyntaxNode sibling : parent.namedChildren()) {
            if (sibling == this) {
                return previous;
            }
            previous = sibling;
        }
        return null;
    }

    /**
     * Unwraps nested nodes of the given kind down to their first named child.
     */
    public SyntaxNode skipNodesOfKind(String wrapperKind) {
        SyntaxNode node = this;
        while (node.kind.equals(wrapperKind)) {
            List<SyntaxNode> inner = node.namedChildren();
            if (inner.isEmpty()) {
                return node;
            }
            node = inner.get(0);
        }
        return node;
    }

    public SyntaxNode skipParentheses() {
        return skipNodesOfKind(NodeKinds.PARENTHESIZED_EXPRESSION);
    }

    /**
     * Closest ancestor that is not a parenthesized expression, or null.
     */
    public SyntaxNode nextNonParenthesesAncestor() {
        SyntaxNode node = parent;
        while (node != null && node.kind.equals(NodeKinds.PARENTHESIZED_EXPRESSION)) {
            node = node.parent;
        }
        return node;
    }

    public String describe() {
        String base = start == null ? kind : kind + "@" + start;
        return text != null && named ? base + " (" + text + ")" : base;
    }

    @Override
    public String toString() {
        return describe();
    }
}
