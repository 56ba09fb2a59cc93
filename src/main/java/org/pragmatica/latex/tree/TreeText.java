package org.pragmatica.latex.tree;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Rebuilds source text from a syntax tree.
 */
public final class TreeText {
    private TreeText() {}

    /**
     * Exact source text covered by the node. For the file root this is the whole input.
     */
    public static String render(LatexNode node) {
        var sb = new StringBuilder();
        Deque<LatexNode> pending = new ArrayDeque<>();
        pending.push(node);
        while (!pending.isEmpty()) {
            var current = pending.pop();
            sb.append(opening(current));
            current.subnodes()
                   .ifPresent(children -> {
                       for (int i = children.size() - 1; i >= 0; i--) {
                           pending.push(children.get(i));
                       }
                   });
        }
        return sb.toString();
    }

    /**
     * Text the node contributes before its children.
     */
    private static String opening(LatexNode node) {
        return switch (node.kind()) {
            case ENV -> "\\begin{" + node.text() + "}";
            case FILE -> "";
            default -> node.text();
        };
    }
}
