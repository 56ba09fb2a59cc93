package org.pragmatica.latex.chunk;

import org.junit.jupiter.api.Test;
import org.pragmatica.latex.LatexChew;
import org.pragmatica.latex.error.LatexError;
import org.pragmatica.latex.parser.ParsedDocument;
import org.pragmatica.latex.util.Result;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ChunkBoundariesTest {

    private static final String SECTIONS = "\\begin{document}\n\\section{A}\ntext\n\\section{B}\n\\end{document}";
    private static final String MIXED = "\\begin{document}\n% part intro\nIntro text.\n"
                                        + "\\begin{figure}\nX\n\\end{figure}\n\\section{One}\nBody.\n\\end{document}";

    private static ParsedDocument parse(String source) {
        return LatexChew.parser().parseDocument(source).unwrap();
    }

    private static Result<List<Chunk>> chunks(String source, String... selectors) {
        return LatexChew.chunks(parse(source), List.of(selectors));
    }

    private static Object failure(Result<?> result) {
        assertThat(result.isFailure()).isTrue();
        return result.fold(cause -> cause, value -> null);
    }

    @Test
    void compute_twoSections_emitsBoundaryToBoundaryRanges() {
        var chunks = chunks(SECTIONS, "m:section").unwrap();

        assertThat(chunks).containsExactly(new Chunk(2, 1, 17, 0),
                                           new Chunk(2, 3, 17, 17),
                                           new Chunk(4, 4, 34, 12));
        assertThat(chunks).extracting(Chunk::describe)
                          .containsExactly("lines 2 1 chars 17 0", "lines 2 3 chars 17 17", "lines 4 4 chars 34 12");
    }

    @Test
    void compute_bodyNode_endsAtClosingSentinel() {
        var body = parse(SECTIONS).body();

        var chunks = ChunkBoundaries.compute(body, List.of(1, 4)).unwrap();

        assertThat(chunks).containsExactly(new Chunk(2, 1, 17, 0),
                                           new Chunk(2, 3, 17, 17),
                                           new Chunk(4, 4, 34, 12));
        assertThat(chunks.get(chunks.size() - 1).endOffset()).isEqualTo(body.end().start().offset());
    }

    @Test
    void compute_noAnchors_emitsWholeBody() {
        var chunks = chunks(SECTIONS, "m:chapter").unwrap();

        assertThat(chunks).containsExactly(new Chunk(2, 4, 17, 29));
    }

    @Test
    void compute_mixedAnchors_tileTheBody() {
        var document = parse(MIXED);

        var chunks = LatexChew.chunks(document, List.of("c:part", "{figure}", "\\section")).unwrap();

        assertThat(chunks).containsExactly(new Chunk(2, 1, 17, 0),
                                           new Chunk(2, 3, 17, 25),
                                           new Chunk(4, 6, 42, 30),
                                           new Chunk(7, 8, 72, 20));
        for (int i = 0; i + 1 < chunks.size(); i++) {
            assertThat(chunks.get(i).endOffset()).isEqualTo(chunks.get(i + 1).startOffset());
        }
        int bodyEnd = document.body().end().start().offset();
        assertThat(chunks.stream().mapToInt(Chunk::length).sum()).isEqualTo(bodyEnd - 17);
        assertThat(chunks.get(chunks.size() - 1).endOffset()).isEqualTo(bodyEnd);
    }

    @Test
    void compute_contentRightAfterDocumentBegin_fails() {
        var result = chunks("\\begin{document}x\n\\end{document}", "m:section");

        assertThat(failure(result)).isInstanceOf(LatexError.TrailingContentAfterDocumentBegin.class);
    }

    @Test
    void compute_emptyBody_fails() {
        var result = chunks("\\begin{document}\\end{document}", "m:section");

        assertThat(failure(result)).isInstanceOfSatisfying(LatexError.TrailingContentAfterDocumentBegin.class,
                                                           error -> assertThat(error.found()).isEqualTo("\\end{document}"));
    }

    @Test
    void compute_anchorInsideLine_fails() {
        var result = chunks("\\begin{document}\ntext \\section{a}\n\\end{document}", "m:section");

        assertThat(failure(result)).isEqualTo(new LatexError.AnchorNotAtLineStart(1, 5));
    }

    @Test
    void compute_documentEndInsideLine_fails() {
        var result = chunks("\\begin{document}\n\\section{a} tail\\end{document}", "m:section");

        assertThat(failure(result)).isEqualTo(new LatexError.AnchorNotAtLineStart(1, 16));
    }

    @Test
    void compute_invalidSelector_fails() {
        var result = chunks(SECTIONS, "section");

        assertThat(failure(result)).isEqualTo(new LatexError.InvalidSelectorSyntax("section"));
    }
}
