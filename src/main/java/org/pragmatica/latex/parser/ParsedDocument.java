package org.pragmatica.latex.parser;

import org.pragmatica.latex.tree.LatexNode;
import org.pragmatica.latex.tree.NodeKind;

import java.util.List;

/**
 * Result of parsing a document. The root has exactly three children: preamble, body environment, postamble.
 */
public record ParsedDocument(LatexNode.NonTerminal root) {

    public ParsedDocument {
        if (root.kind() != NodeKind.FILE || root.children().size() != 3) {
            throw new IllegalArgumentException("Document root must be a FILE node with three children");
        }
    }

    public LatexNode preamble() {
        return root.children().get(0);
    }

    public LatexNode.NonTerminal body() {
        return (LatexNode.NonTerminal) root.children().get(1);
    }

    public LatexNode postamble() {
        return root.children().get(2);
    }

    /**
     * Direct children of the body environment, ending with its closing sentinel.
     */
    public List<LatexNode> bodyNodes() {
        return body().children();
    }
}
