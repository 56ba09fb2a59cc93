package org.pragmatica.latex.lexer;

import org.pragmatica.latex.tree.SourceLocation;
import org.pragmatica.latex.tree.SourceSpan;

/**
 * A token. For environment delimiters {@code text} is the environment name only,
 * for verbatim blocks it is the captured content, otherwise it is the matched text.
 */
public record LatexToken(TokenKind kind, String text, SourceSpan span) {

    public SourceLocation start() {
        return span.start();
    }

    public SourceLocation end() {
        return span.end();
    }

    /**
     * The exact source text covered by the token.
     */
    public String literal() {
        return switch (kind) {
            case ENV_BEGIN -> "\\begin{" + text + "}";
            case ENV_END -> "\\end{" + text + "}";
            default -> text;
        };
    }

    /**
     * Whether this token closes a construct opened by a token of {@code openKind} with {@code openText}.
     */
    public boolean closes(TokenKind openKind, String openText) {
        return openKind.closedBy(openText, kind, text);
    }

    @Override
    public String toString() {
        return kind + "('" + text + "')@" + span.start();
    }
}
