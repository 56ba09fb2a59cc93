package org.pragmatica.latex.parser;

import org.pragmatica.latex.lexer.LexerConfig;

/**
 * Parser configuration options.
 */
public record ParserConfig(
    LexerConfig lexerConfig,
    String documentEnvironment
) {
    public static final ParserConfig DEFAULT = new ParserConfig(
        LexerConfig.DEFAULT,
        "document"
    );

    /**
     * Literal text separating the preamble from the body.
     */
    public String documentMarker() {
        return "\\begin{" + documentEnvironment + "}";
    }
}
