package org.pragmatica.latex;

import org.pragmatica.latex.chunk.Chunk;
import org.pragmatica.latex.chunk.ChunkBoundaries;
import org.pragmatica.latex.lexer.LexerConfig;
import org.pragmatica.latex.parser.DocumentParser;
import org.pragmatica.latex.parser.LatexParser;
import org.pragmatica.latex.parser.ParsedDocument;
import org.pragmatica.latex.parser.ParserConfig;
import org.pragmatica.latex.select.Anchor;
import org.pragmatica.latex.select.AnchorSelector;
import org.pragmatica.latex.select.Selector;
import org.pragmatica.latex.util.Result;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for parsing LaTeX documents and cutting their body into chunks.
 *
 * <p>Example usage:
 * <pre>{@code
 * var parser = LatexChew.parser();
 * var chunks = parser.parseDocument(source)
 *                    .flatMap(document -> LatexChew.chunks(document, List.of("m:section")));
 * }</pre>
 */
public final class LatexChew {
    private LatexChew() {}

    /**
     * Parser with default configuration.
     */
    public static LatexParser parser() {
        return parser(ParserConfig.DEFAULT);
    }

    public static LatexParser parser(ParserConfig config) {
        return DocumentParser.create(config);
    }

    /**
     * Top-level anchors of the document body matching any of the selectors.
     */
    public static Result<List<Anchor>> anchors(ParsedDocument document, List<String> selectors) {
        return Selector.parseAll(selectors)
                       .map(compiled -> AnchorSelector.anchors(document.bodyNodes(), compiled));
    }

    /**
     * Chunks of the document body delimited by the anchors matching any of the selectors.
     */
    public static Result<List<Chunk>> chunks(ParsedDocument document, List<String> selectors) {
        return Selector.parseAll(selectors)
                       .flatMap(compiled -> ChunkBoundaries.compute(document.body(),
                                                                    AnchorSelector.select(document.bodyNodes(),
                                                                                          compiled)));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<String> verbatimEnvironments = new ArrayList<>(LexerConfig.DEFAULT.verbatimEnvironments());
        private boolean captureVerbatim = true;
        private String documentEnvironment = ParserConfig.DEFAULT.documentEnvironment();

        private Builder() {}

        /**
         * Add environments whose body is captured verbatim.
         */
        public Builder verbatim(String... environments) {
            verbatimEnvironments.addAll(List.of(environments));
            return this;
        }

        /**
         * Replace the list of verbatim environments.
         */
        public Builder verbatimEnvironments(List<String> environments) {
            verbatimEnvironments.clear();
            verbatimEnvironments.addAll(environments);
            return this;
        }

        public Builder captureVerbatim(boolean capture) {
            this.captureVerbatim = capture;
            return this;
        }

        public Builder documentEnvironment(String name) {
            this.documentEnvironment = name;
            return this;
        }

        public ParserConfig config() {
            return new ParserConfig(new LexerConfig(verbatimEnvironments, captureVerbatim), documentEnvironment);
        }

        public LatexParser build() {
            return parser(config());
        }
    }
}
