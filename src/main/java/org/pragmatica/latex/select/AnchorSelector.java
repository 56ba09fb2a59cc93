package org.pragmatica.latex.select;

import org.pragmatica.latex.tree.LatexNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Selects anchors among a flat list of nodes. Nested nodes are never inspected.
 */
public final class AnchorSelector {
    private AnchorSelector() {}

    /**
     * Indices, in ascending order, of the nodes matching any of the selectors.
     */
    public static List<Integer> select(List<LatexNode> nodes, List<Selector> selectors) {
        var indices = new ArrayList<Integer>();
        for (int i = 0; i < nodes.size(); i++) {
            var node = nodes.get(i);
            if (selectors.stream().anyMatch(selector -> selector.matches(node))) {
                indices.add(i);
            }
        }
        return List.copyOf(indices);
    }

    public static List<Anchor> anchors(List<LatexNode> nodes, List<Selector> selectors) {
        return select(nodes, selectors).stream()
                                       .map(index -> new Anchor(index, nodes.get(index)))
                                       .toList();
    }
}
