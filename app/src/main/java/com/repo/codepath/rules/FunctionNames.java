package com.repo.codepath.rules;

import com.repo.codepath.tree.SyntaxNode;

import static com.repo.codepath.tree.NodeKinds.*;

/**
 * Human-readable names of function-like nodes, e.g. "method 'run'",
 * "async arrow function" or "static getter 'size'".
 */
final class FunctionNames {

    private FunctionNames() {
    }

    static String describe(SyntaxNode node) {
        SyntaxNode parent = node.parent();
        String type;
        String name = null;
        boolean isStatic = false;
        boolean isPrivate = false;
        boolean isAsync = false;

        boolean objectLiteralMethod = parent != null && parent.kind().equals(PAIR)
                && (node.kind().equals(FUNCTION) || node.kind().equals(FUNCTION_EXPRESSION)
                        || node.kind().equals(ARROW_FUNCTION));

        if (node.kind().equals(METHOD_DEFINITION)) {
            type = "method";
            for (SyntaxNode child : node.children()) {
                if (child == node.childByField("name")) {
                    break;
                }
                switch (child.kind()) {
                    case "static" -> isStatic = true;
                    case "async" -> isAsync = true;
                    case "get" -> type = "getter";
                    case "set" -> type = "setter";
                    case "*" -> type = "generator method";
                    default -> {
                    }
                }
            }
            SyntaxNode key = node.childByField("name");
            if (key != null && key.kind().equals(PRIVATE_PROPERTY_IDENTIFIER)) {
                isPrivate = true;
                name = key.text();
            } else {
                String staticName = staticPropertyName(key);
                if ("constructor".equals(staticName) && !isStatic) {
                    return "constructor";
                }
                name = staticName == null ? null : quote(staticName);
            }
        } else {
            type = switch (node.kind()) {
                case GENERATOR_FUNCTION, GENERATOR_FUNCTION_DECLARATION -> "generator function";
                case ARROW_FUNCTION -> "arrow function";
                default -> "function";
            };
            isAsync = !node.children().isEmpty() && node.children().get(0).kind().equals("async");

            if (parent != null && parent.kind().equals(FIELD_DEFINITION)) {
                type = "method";
                isStatic = parent.hasChildOfKind("static");
                SyntaxNode key = parent.childByField("property");
                if (key != null && key.kind().equals(PRIVATE_PROPERTY_IDENTIFIER)) {
                    isPrivate = true;
                    name = key.text();
                } else {
                    String staticName = staticPropertyName(key);
                    name = staticName == null ? null : quote(staticName);
                }
            } else if (objectLiteralMethod) {
                type = "method";
                SyntaxNode key = parent.childByField("key");
                if (key != null && key.kind().equals(PRIVATE_PROPERTY_IDENTIFIER)) {
                    isPrivate = true;
                    name = key.text();
                } else {
                    String staticName = staticPropertyName(key);
                    name = staticName == null ? null : quote(staticName);
                }
            } else {
                SyntaxNode functionName = node.childByField("name");
                name = functionName == null ? null : quote(functionName.text());
            }
        }

        StringBuilder sb = new StringBuilder();
        if (isStatic) {
            sb.append("static ");
        }
        if (isPrivate) {
            sb.append("private ");
        }
        if (isAsync) {
            sb.append("async ");
        }
        sb.append(type);
        if (name != null) {
            sb.append(' ').append(name);
        }
        return sb.toString();
    }

    static String upperCaseFirst(String text) {
        if (text.isEmpty()) {
            return text;
        }
        return Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }

    private static String quote(String name) {
        return "'" + name + "'";
    }

    /**
     * Name of a non-computed property key, or of a computed key that is a
     * literal.
     */
    private static String staticPropertyName(SyntaxNode key) {
        if (key == null) {
            return null;
        }
        return switch (key.kind()) {
            case PROPERTY_IDENTIFIER, IDENTIFIER, NUMBER -> key.text();
            case STRING -> unquote(key.text());
            case "computed_property_name" -> {
                SyntaxNode inner = key.namedChildren().isEmpty() ? null : key.namedChildren().get(0);
                if (inner != null && (inner.kind().equals(STRING) || inner.kind().equals(NUMBER))) {
                    yield inner.kind().equals(STRING) ? unquote(inner.text()) : inner.text();
                }
                yield null;
            }
            default -> null;
        };
    }

    private static String unquote(String text) {
        if (text.length() >= 2 && (text.charAt(0) == '"' || text.charAt(0) == '\'')
                && text.charAt(text.length() - 1) == text.charAt(0)) {
            return text.substring(1, text.length() - 1);
        }
        return text;
    }
}
