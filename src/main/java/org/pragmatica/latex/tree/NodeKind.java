package org.pragmatica.latex.tree;

/**
 * Kinds of syntax tree nodes.
 */
public enum NodeKind {
    // atoms
    COMMAND_NAME("CNAME"),
    COMMENT("COMMENT"),
    PLAIN_TEXT("TEXT"),
    VERBATIM_BLOCK("VERB"),
    // constructs
    ENV("ENV"),
    DISPLAY_MATH("DMATH"),
    INLINE_MATH("TMATH"),
    GROUP("GROUP"),
    // synthetic
    FILE("FILE"),
    PREAMBLE("PREAMBLE"),
    POSTAMBLE("POSTAMBLE"),
    END("END");

    private final String display;

    NodeKind(String display) {
        this.display = display;
    }

    /**
     * Short upper-case name used in listings.
     */
    public String display() {
        return display;
    }

    /**
     * True for environments, math and groups, i.e. nodes closed by an {@link #END} sentinel.
     */
    public boolean isConstruct() {
        return this == ENV || this == DISPLAY_MATH || this == INLINE_MATH || this == GROUP;
    }
}
