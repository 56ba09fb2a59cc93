package org.pragmatica.latex.chunk;

import org.pragmatica.latex.error.LatexError;
import org.pragmatica.latex.tree.LatexNode;
import org.pragmatica.latex.tree.NodeKind;
import org.pragmatica.latex.util.Result;
import org.pragmatica.latex.util.Texts;

import java.util.ArrayList;
import java.util.List;

/**
 * Cuts the document body into contiguous chunks at selected anchors.
 *
 * <p>Boundaries are the start of the body (right after the newline following the document
 * marker), every anchor in order, and the closing sentinel of the body. All of them except
 * the first must sit in column 0.
 */
public final class ChunkBoundaries {
    private static final int CONTEXT_LENGTH = 16;

    private ChunkBoundaries() {}

    /**
     * @param bodyEnv the body environment
     * @param anchors ascending indices of the anchors among its children
     */
    public static Result<List<Chunk>> compute(LatexNode.NonTerminal bodyEnv, List<Integer> anchors) {
        var body = bodyEnv.children();
        var first = body.get(0);
        if (first.kind() != NodeKind.PLAIN_TEXT || !first.text().startsWith("\n")) {
            return Result.failure(new LatexError.TrailingContentAfterDocumentBegin(
                first.start(),
                Texts.prefix(first.text(), CONTEXT_LENGTH)));
        }
        var end = bodyEnv.end();
        if (end.kind() != NodeKind.END) {
            throw new IllegalArgumentException("Body must end with a closing sentinel, found " + end.kind());
        }

        var boundaries = new ArrayList<LatexNode>(anchors.size() + 2);
        boundaries.add(LatexNode.terminal(first.kind(), first.text().substring(1), first.start().advance("\n")));
        for (var index : anchors) {
            boundaries.add(body.get(index));
        }
        boundaries.add(end);

        for (var boundary : boundaries.subList(1, boundaries.size())) {
            var location = boundary.start();
            if (location.column() != 0) {
                return Result.failure(new LatexError.AnchorNotAtLineStart(location.line(), location.column()));
            }
        }

        var chunks = new ArrayList<Chunk>(boundaries.size() - 1);
        for (int i = 0; i + 1 < boundaries.size(); i++) {
            var current = boundaries.get(i).start();
            var next = boundaries.get(i + 1).start();
            chunks.add(new Chunk(current.line() + 1, next.line(), current.offset(), next.offset() - current.offset()));
        }
        return Result.success(List.copyOf(chunks));
    }
}
