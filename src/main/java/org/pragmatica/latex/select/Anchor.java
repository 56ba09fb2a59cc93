package org.pragmatica.latex.select;

import org.pragmatica.latex.tree.LatexNode;
import org.pragmatica.latex.util.Texts;

/**
 * A selected top-level node and its index among the body's children.
 */
public record Anchor(int index, LatexNode node) {
    private static final int NAME_LENGTH = 32;

    /**
     * 1-based line of the anchor.
     */
    public int line() {
        return node.start().line() + 1;
    }

    public int offset() {
        return node.start().offset();
    }

    /**
     * Listing line: {@code line L char O kind K name T}.
     */
    public String describe() {
        return "line " + line() + " char " + offset() + " kind " + node.kind().display()
               + " name " + Texts.truncatedQuote(node.text(), NAME_LENGTH);
    }
}
