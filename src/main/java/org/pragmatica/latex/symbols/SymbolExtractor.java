package org.pragmatica.latex.symbols;

import org.pragmatica.latex.tree.LatexNode;
import org.pragmatica.latex.tree.NodeKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Collects command names, labels and references from a tree, at any depth.
 */
public final class SymbolExtractor {
    private static final String LABEL = "\\label";
    private static final String REF = "\\ref";

    private SymbolExtractor() {}

    public static DocumentSymbols extract(LatexNode root) {
        SortedSet<String> commands = new TreeSet<>();
        SortedSet<String> labels = new TreeSet<>();
        SortedSet<String> references = new TreeSet<>();

        Deque<LatexNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            var node = pending.pop();
            if (node.kind() == NodeKind.COMMAND_NAME) {
                commands.add(node.text());
            }
            var children = node.subnodes().orElse(List.of());
            for (int i = 0; i + 1 < children.size(); i++) {
                var command = children.get(i);
                if (command.kind() != NodeKind.COMMAND_NAME) {
                    continue;
                }
                if (command.text().equals(LABEL)) {
                    plainArgument(children.get(i + 1)).ifPresent(labels::add);
                } else if (command.text().equals(REF)) {
                    plainArgument(children.get(i + 1)).ifPresent(references::add);
                }
            }
            children.forEach(pending::push);
        }
        return new DocumentSymbols(new ArrayList<>(commands), new ArrayList<>(labels), new ArrayList<>(references));
    }

    /**
     * Text of a group holding nothing but plain text, e.g. the {@code {key}} of {@code \label{key}}.
     */
    private static Optional<String> plainArgument(LatexNode node) {
        if (node.kind() != NodeKind.GROUP) {
            return Optional.empty();
        }
        var children = node.subnodes().orElse(List.of());
        if (children.size() != 2 || children.get(0).kind() != NodeKind.PLAIN_TEXT) {
            return Optional.empty();
        }
        return Optional.of(children.get(0).text());
    }
}
