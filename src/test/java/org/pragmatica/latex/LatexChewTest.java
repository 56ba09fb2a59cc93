package org.pragmatica.latex;

import org.junit.jupiter.api.Test;
import org.pragmatica.latex.chunk.Chunk;
import org.pragmatica.latex.error.LatexError;
import org.pragmatica.latex.select.Anchor;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LatexChewTest {

    private static final String SECTIONS = "\\begin{document}\n\\section{A}\ntext\n\\section{B}\n\\end{document}\n";

    @Test
    void builder_defaults_matchDefaultConfig() {
        var config = LatexChew.builder().config();

        assertThat(config.documentEnvironment()).isEqualTo("document");
        assertThat(config.lexerConfig().verbatimEnvironments()).containsExactly("verbatim", "Verbatim", "semiverbatim");
        assertThat(config.lexerConfig().captureVerbatim()).isTrue();
    }

    @Test
    void builder_verbatim_appendsToDefaults() {
        var config = LatexChew.builder()
                              .verbatim("lstlisting", "minted")
                              .config();

        assertThat(config.lexerConfig().verbatimEnvironments())
            .containsExactly("verbatim", "Verbatim", "semiverbatim", "lstlisting", "minted");
    }

    @Test
    void builder_verbatimEnvironments_replacesDefaults() {
        var config = LatexChew.builder()
                              .verbatimEnvironments(List.of("code"))
                              .config();

        assertThat(config.lexerConfig().isVerbatim("code")).isTrue();
        assertThat(config.lexerConfig().isVerbatim("verbatim")).isFalse();
    }

    @Test
    void builder_documentEnvironment_changesMarker() {
        var parser = LatexChew.builder()
                              .documentEnvironment("body")
                              .build();

        var document = parser.parseDocument("pre\\begin{body}\nx\n\\end{body}").unwrap();

        assertThat(document.preamble().text()).isEqualTo("pre");
        assertThat(document.body().text()).isEqualTo("body");
        assertThat(parser.parseDocument("\\begin{document}\n\\end{document}").isFailure()).isTrue();
    }

    @Test
    void chunks_forSectionSelector() {
        var chunks = LatexChew.parser()
                              .parseDocument(SECTIONS)
                              .flatMap(document -> LatexChew.chunks(document, List.of("m:section")))
                              .unwrap();

        assertThat(chunks).containsExactly(new Chunk(2, 1, 17, 0),
                                           new Chunk(2, 3, 17, 17),
                                           new Chunk(4, 4, 34, 12));
    }

    @Test
    void anchors_forSectionSelector() {
        var anchors = LatexChew.parser()
                               .parseDocument(SECTIONS)
                               .flatMap(document -> LatexChew.anchors(document, List.of("\\section")))
                               .unwrap();

        assertThat(anchors).extracting(Anchor::line).containsExactly(2, 4);
    }

    @Test
    void anchors_invalidSelector_fails() {
        var document = LatexChew.parser().parseDocument(SECTIONS).unwrap();

        Object cause = LatexChew.anchors(document, List.of("m:section", "section"))
                                .fold(failure -> failure, value -> null);

        assertThat(cause).isEqualTo(new LatexError.InvalidSelectorSyntax("section"));
    }
}
