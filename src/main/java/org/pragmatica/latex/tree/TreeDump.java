package org.pragmatica.latex.tree;

import org.pragmatica.latex.util.Texts;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Depth-first listing of a tree, one node per line: {@code ooooo:llll-cc: <indent>KIND: 'text'}.
 * Line and column are shown 1-based.
 */
public final class TreeDump {
    private static final String INDENT = "    ";
    private static final int HALF_TEXT = 8;

    private TreeDump() {}

    public static List<String> lines(LatexNode root) {
        var lines = new ArrayList<String>();
        Deque<Entry> pending = new ArrayDeque<>();
        pending.push(new Entry(root, 0));
        while (!pending.isEmpty()) {
            var entry = pending.pop();
            lines.add(line(entry.node(), entry.depth()));
            entry.node()
                 .subnodes()
                 .ifPresent(children -> {
                     for (int i = children.size() - 1; i >= 0; i--) {
                         pending.push(new Entry(children.get(i), entry.depth() + 1));
                     }
                 });
        }
        return lines;
    }

    public static String line(LatexNode node, int depth) {
        var start = node.start();
        return String.format("%05d:%04d-%02d: %s%s: %s",
                             start.offset(),
                             start.line() + 1,
                             start.column() + 1,
                             INDENT.repeat(depth),
                             node.kind().display(),
                             Texts.quote(Texts.elide(node.text(), HALF_TEXT)));
    }

    private record Entry(LatexNode node, int depth) {}
}
