package org.pragmatica.latex.parser;

import org.pragmatica.latex.lexer.LatexToken;
import org.pragmatica.latex.util.Result;

import java.util.List;

/**
 * Parser interface - parses LaTeX source text into a lossless syntax tree.
 */
public interface LatexParser {

    /**
     * Parse a complete document: preamble, body environment and postamble.
     */
    Result<ParsedDocument> parseDocument(String source);

    /**
     * Lex the whole source from its first character, preamble included.
     */
    Result<List<LatexToken>> tokenize(String source);

    ParserConfig config();
}
