package org.pragmatica.latex.tree;

import java.util.List;
import java.util.Optional;

/**
 * Concrete syntax tree node. The tree is lossless: rendering it with {@link TreeText} gives back the source.
 */
public sealed interface LatexNode {
    NodeKind kind();

    /**
     * Literal text for atoms and sentinels, environment name for environments,
     * opening delimiter for math and groups.
     */
    String text();

    SourceLocation start();

    /**
     * Children of the node, empty for leaves. An existing children list is never empty.
     */
    Optional<List<LatexNode>> subnodes();

    /**
     * Leaf node: atoms, preamble, postamble and closing sentinels.
     */
    record Terminal(NodeKind kind, String text, SourceLocation start) implements LatexNode {
        @Override
        public Optional<List<LatexNode>> subnodes() {
            return Optional.empty();
        }
    }

    /**
     * Interior node: constructs and the file root. For constructs the last child is the {@link NodeKind#END} sentinel.
     */
    record NonTerminal(NodeKind kind, String text, SourceLocation start, List<LatexNode> children) implements LatexNode {
        public NonTerminal {
            children = List.copyOf(children);
        }

        @Override
        public Optional<List<LatexNode>> subnodes() {
            return Optional.of(children);
        }

        /**
         * The closing sentinel of a construct.
         */
        public LatexNode end() {
            return children.get(children.size() - 1);
        }
    }

    static LatexNode terminal(NodeKind kind, String text, SourceLocation start) {
        return new Terminal(kind, text, start);
    }

    static NonTerminal nonTerminal(NodeKind kind, String text, SourceLocation start, List<LatexNode> children) {
        return new NonTerminal(kind, text, start, children);
    }
}
