package com.repo.codepath.codepath;

import com.repo.codepath.tree.NodeKinds;
import com.repo.codepath.tree.SyntaxNode;

import java.util.*;

/**
 * Renders code paths for debugging: as a compact edge list and as a
 * Graphviz digraph.
 */
public final class DotPrinter {

    private DotPrinter() {
    }

    /**
     * Edge list such as {@code initial->s1_1->s1_2->final;}. Chains are
     * continued while possible; every other edge starts a new line.
     */
    public static String arrows(CodePath codePath) {
        return arrows(codePath, new LinkedHashSet<>());
    }

    private static String arrows(CodePath codePath, Set<Integer> done) {
        CodePathSegment initial = codePath.initialSegment();
        List<int[]> stack = new ArrayList<>();
        stack.add(new int[] {initial.handle(), 0});
        String lastId = initial.id();
        StringBuilder text = new StringBuilder("initial->").append(initial.id());

        while (!stack.isEmpty()) {
            int[] item = stack.remove(stack.size() - 1);
            int handle = item[0];
            int index = item[1];

            if (done.contains(handle) && index == 0) {
                continue;
            }
            done.add(handle);

            CodePathSegment segment = codePath.segment(handle);
            if (index >= segment.allNextSegments.size()) {
                continue;
            }
            CodePathSegment next = codePath.segment(segment.allNextSegments.get(index));

            if (segment.id().equals(lastId)) {
                text.append("->").append(next.id());
            } else {
                text.append(";\n").append(segment.id()).append("->").append(next.id());
            }
            lastId = next.id();

            stack.add(0, new int[] {handle, index + 1});
            stack.add(new int[] {next.handle(), 0});
        }

        for (CodePathSegment segment : codePath.returnedSegments()) {
            appendTerminal(text, segment, lastId, "final");
            lastId = null;
        }
        for (CodePathSegment segment : codePath.thrownSegments()) {
            appendTerminal(text, segment, lastId, "thrown");
            lastId = null;
        }

        return text.append(';').toString();
    }

    private static void appendTerminal(StringBuilder text, CodePathSegment segment, String lastId, String terminal) {
        if (segment.id().equals(lastId)) {
            text.append("->").append(terminal);
        } else {
            text.append(";\n").append(segment.id()).append("->").append(terminal);
        }
    }

    /**
     * Graphviz source with one box per segment listing the node events
     * recorded in it. Unreachable segments are dashed and orange.
     */
    public static String dot(CodePath codePath) {
        StringBuilder text = new StringBuilder("""
                digraph {
                node[shape=box,style="rounded,filled",fillcolor=white];
                initial[label="",shape=circle,style=filled,fillcolor=black,width=0.25,height=0.25];
                """);
        if (!codePath.returnedSegments().isEmpty()) {
            text.append("final[label=\"\",shape=doublecircle,style=filled,fillcolor=black,width=0.25,height=0.25];\n");
        }
        if (!codePath.thrownSegments().isEmpty()) {
            text.append("thrown[label=\"✘\",shape=circle,width=0.3,height=0.3,fixedsize=true];\n");
        }

        Set<Integer> traced = new LinkedHashSet<>();
        String arrows = arrows(codePath, traced);

        for (int handle : traced) {
            CodePathSegment segment = codePath.segment(handle);
            text.append(segment.id()).append('[');
            if (segment.isReachable()) {
                text.append("label=\"");
            } else {
                text.append("style=\"rounded,dashed,filled\",fillcolor=\"#FF9800\",label=\"<<unreachable>>\\n");
            }
            if (segment.nodes.isEmpty()) {
                text.append("????");
            } else {
                StringJoiner joiner = new StringJoiner("\\n");
                for (CodePathSegment.NodeEvent event : segment.nodes) {
                    joiner.add(describe(event));
                }
                text.append(joiner);
            }
            text.append("\"];\n");
        }

        return text.append(arrows).append("\n}").toString();
    }

    private static String describe(CodePathSegment.NodeEvent event) {
        SyntaxNode node = event.node();
        String suffix = event.kind() == CodePathSegment.EventKind.ENTER ? ":enter" : ":exit";
        if (node.kind().equals(NodeKinds.IDENTIFIER) || NodeKinds.LITERALS.contains(node.kind())) {
            return node.kind() + suffix + " (" + node.text().replace("\"", "\\\"") + ")";
        }
        return node.kind() + suffix;
    }
}
