package org.pragmatica.latex.lexer;

import org.pragmatica.latex.tree.NodeKind;

/**
 * Token kinds produced by {@link LatexLexer}.
 */
public enum TokenKind {
    // construct delimiters
    ENV_BEGIN,
    ENV_END,
    DISPLAY_MATH_BEGIN,
    DISPLAY_MATH_END,
    INLINE_MATH_BEGIN,
    INLINE_MATH_END,
    GROUP_BEGIN,
    GROUP_END,
    DOUBLE_DOLLAR,
    DOLLAR,
    // atoms
    COMMAND_NAME,
    COMMENT,
    PLAIN_TEXT,
    VERBATIM_BLOCK,
    END_OF_INPUT;

    /**
     * True for tokens that open a construct. Dollar signs open a construct when they are not closing one.
     */
    public boolean opensConstruct() {
        return switch (this) {
            case ENV_BEGIN, DISPLAY_MATH_BEGIN, INLINE_MATH_BEGIN, GROUP_BEGIN, DOUBLE_DOLLAR, DOLLAR -> true;
            default -> false;
        };
    }

    public boolean isAtom() {
        return switch (this) {
            case COMMAND_NAME, COMMENT, PLAIN_TEXT, VERBATIM_BLOCK -> true;
            default -> false;
        };
    }

    /**
     * Kind of the node built from a token of this kind.
     *
     * @throws IllegalStateException for closing delimiters and end of input
     */
    public NodeKind nodeKind() {
        return switch (this) {
            case ENV_BEGIN -> NodeKind.ENV;
            case DISPLAY_MATH_BEGIN, DOUBLE_DOLLAR -> NodeKind.DISPLAY_MATH;
            case INLINE_MATH_BEGIN, DOLLAR -> NodeKind.INLINE_MATH;
            case GROUP_BEGIN -> NodeKind.GROUP;
            case COMMAND_NAME -> NodeKind.COMMAND_NAME;
            case COMMENT -> NodeKind.COMMENT;
            case PLAIN_TEXT -> NodeKind.PLAIN_TEXT;
            case VERBATIM_BLOCK -> NodeKind.VERBATIM_BLOCK;
            default -> throw new IllegalStateException("No node kind for token " + this);
        };
    }

    /**
     * Whether a token of kind {@code candidate} with text {@code candidateText} closes a construct
     * opened by a token of this kind with text {@code openText}.
     */
    public boolean closedBy(String openText, TokenKind candidate, String candidateText) {
        return switch (this) {
            case ENV_BEGIN -> candidate == ENV_END && openText.equals(candidateText);
            case DISPLAY_MATH_BEGIN -> candidate == DISPLAY_MATH_END;
            case INLINE_MATH_BEGIN -> candidate == INLINE_MATH_END;
            case GROUP_BEGIN -> candidate == GROUP_END;
            case DOUBLE_DOLLAR -> candidate == DOUBLE_DOLLAR;
            case DOLLAR -> candidate == DOLLAR;
            default -> false;
        };
    }
}
