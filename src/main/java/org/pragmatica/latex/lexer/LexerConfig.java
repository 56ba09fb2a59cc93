package org.pragmatica.latex.lexer;

import java.util.List;

/**
 * Lexer configuration: names of environments whose body is captured verbatim, and whether capture is enabled.
 */
public record LexerConfig(List<String> verbatimEnvironments, boolean captureVerbatim) {

    public static final LexerConfig DEFAULT = new LexerConfig(
        List.of("verbatim", "Verbatim", "semiverbatim"),
        true
    );

    public LexerConfig {
        verbatimEnvironments = List.copyOf(verbatimEnvironments);
    }

    public boolean isVerbatim(String environment) {
        return captureVerbatim && verbatimEnvironments.contains(environment);
    }
}
