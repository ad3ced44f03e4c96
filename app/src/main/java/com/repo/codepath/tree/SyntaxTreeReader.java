package com.repo.codepath.tree;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Reads the S-expression tree dump printed by {@code tree-sitter parse}.
 *
 * <pre>
 * (program [0, 0] - [0, 12]
 *   (expression_statement
 *     (binary_expression left: (identifier "a") operator: "||" right: (number "1"))))
 * </pre>
 *
 * Positions are optional. A quoted string that is the only item of a node is
 * the node's text; quoted strings among other children are anonymous tokens.
 * {@code ;} starts a comment that runs to the end of the line.
 */
public class SyntaxTreeReader {

    private final String input;
    private int pos;

    private SyntaxTreeReader(String input) {
        this.input = input;
    }

    public static SyntaxNode read(String input) {
        SyntaxTreeReader reader = new SyntaxTreeReader(input);
        RawNode raw = reader.readTree();
        reader.skipBlank();
        if (reader.pos < input.length()) {
            throw new TreeFormatException("Unexpected trailing content", reader.pos);
        }
        return materialize(raw);
    }

    public static SyntaxNode read(Path file) throws IOException {
        return read(Files.readString(file));
    }

    private record RawNode(String kind, boolean named, String text, SyntaxNode.Position start,
            List<String> fields, List<RawNode> children) {
    }

    /**
     * A node whose closing parenthesis has not been read yet.
     */
    private static final class OpenNode {
        final String fieldInParent;
        final String kind;
        final SyntaxNode.Position start;
        final List<String> fields = new ArrayList<>();
        final List<RawNode> children = new ArrayList<>();

        OpenNode(String fieldInParent, String kind, SyntaxNode.Position start) {
            this.fieldInParent = fieldInParent;
            this.kind = kind;
            this.start = start;
        }

        void add(String field, RawNode child) {
            fields.add(field);
            children.add(child);
        }

        RawNode close() {
            // (identifier "x") carries its text rather than an anonymous child
            if (children.size() == 1 && fields.get(0) == null && !children.get(0).named()) {
                return new RawNode(kind, true, children.get(0).text(), start, List.of(), List.of());
            }
            return new RawNode(kind, true, null, start, fields, children);
        }
    }

    private record PendingChild(RawNode raw, SyntaxNode parent, String field) {
    }

    private static SyntaxNode materialize(RawNode rawRoot) {
        int nextId = 0;
        SyntaxNode root = null;
        Deque<PendingChild> stack = new ArrayDeque<>();
        stack.push(new PendingChild(rawRoot, null, null));
        while (!stack.isEmpty()) {
            PendingChild pending = stack.pop();
            RawNode raw = pending.raw();
            SyntaxNode node = new SyntaxNode(nextId++, raw.kind(), raw.named(), raw.text(), raw.start());
            if (pending.parent() == null) {
                root = node;
            } else {
                pending.parent().appendChild(pending.field(), node);
            }
            for (int i = raw.children().size() - 1; i >= 0; i--) {
                stack.push(new PendingChild(raw.children().get(i), node, raw.fields().get(i)));
            }
        }
        return root;
    }

    private RawNode readTree() {
        Deque<OpenNode> enclosing = new ArrayDeque<>();
        OpenNode current = openNode(null);
        while (true) {
            skipBlank();
            char c = peek();
            if (c == ')') {
                pos++;
                RawNode closed = current.close();
                if (enclosing.isEmpty()) {
                    return closed;
                }
                String field = current.fieldInParent;
                current = enclosing.pop();
                current.add(field, closed);
                continue;
            }
            String field = null;
            if (c != '(' && c != '"') {
                int fieldStart = pos;
                field = readWord();
                if (field.isEmpty() || peek() != ':') {
                    throw new TreeFormatException("Expected field label, node or token", fieldStart);
                }
                pos++;
                skipBlank();
                c = peek();
            }
            if (c == '(') {
                enclosing.push(current);
                current = openNode(field);
            } else if (c == '"') {
                String token = readString();
                current.add(field, new RawNode(token, false, token, null, List.of(), List.of()));
            } else {
                throw new TreeFormatException("Expected node or token after field '" + field + "'", pos);
            }
        }
    }

    private OpenNode openNode(String fieldInParent) {
        skipBlank();
        expect('(');
        skipBlank();
        String kind = readWord();
        if (kind.isEmpty()) {
            throw new TreeFormatException("Expected node kind", pos);
        }
        skipBlank();
        SyntaxNode.Position start = null;
        if (peek() == '[') {
            start = readPosition();
            skipBlank();
            expect('-');
            skipBlank();
            readPosition();
        }
        return new OpenNode(fieldInParent, kind, start);
    }

    private SyntaxNode.Position readPosition() {
        expect('[');
        skipBlank();
        int row = readInt();
        skipBlank();
        expect(',');
        skipBlank();
        int column = readInt();
        skipBlank();
        expect(']');
        return new SyntaxNode.Position(row, column);
    }

    private int readInt() {
        int begin = pos;
        while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
            pos++;
        }
        if (begin == pos) {
            throw new TreeFormatException("Expected number", pos);
        }
        try {
            return Integer.parseInt(input.substring(begin, pos));
        } catch (NumberFormatException e) {
            throw new TreeFormatException("Number out of range", begin);
        }
    }

    private String readWord() {
        int begin = pos;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_') {
                pos++;
            } else {
                break;
            }
        }
        return input.substring(begin, pos);
    }

    private String readString() {
        int begin = pos;
        expect('"');
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (pos >= input.length()) {
                throw new TreeFormatException("Unterminated string", begin);
            }
            char c = input.charAt(pos++);
            if (c == '"') {
                return sb.toString();
            }
            if (c == '\\') {
                if (pos >= input.length()) {
                    throw new TreeFormatException("Unterminated escape", pos);
                }
                char escaped = input.charAt(pos++);
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    default -> sb.append(escaped);
                }
            } else {
                sb.append(c);
            }
        }
    }

    private void skipBlank() {
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == ';') {
                while (pos < input.length() && input.charAt(pos) != '\n') {
                    pos++;
                }
            } else if (Character.isWhitespace(c)) {
                pos++;
            } else {
                return;
            }
        }
    }

    private char peek() {
        if (pos >= input.length()) {
            throw new TreeFormatException("Unexpected end of input", pos);
        }
        return input.charAt(pos);
    }

    private void expect(char expected) {
        if (peek() != expected) {
            throw new TreeFormatException("Expected '" + expected + "' but found '" + peek() + "'", pos);
        }
        pos++;
    }
}
