package org.pragmatica.latex.symbols;

import org.junit.jupiter.api.Test;
import org.pragmatica.latex.LatexChew;

import static org.assertj.core.api.Assertions.assertThat;

class SymbolExtractorTest {

    @Test
    void extract_collectsCommandsLabelsAndReferences() {
        var document = LatexChew.parser()
                                .parseDocument("\\begin{document}\n\\section{Intro}\\label{sec:intro}\n"
                                               + "See \\ref{sec:intro} and $\\frac{1}{2}$, {\\ref{eq:one}}.\n"
                                               + "\\section{Next}\n\\end{document}")
                                .unwrap();

        var symbols = SymbolExtractor.extract(document.body());

        assertThat(symbols.commands()).containsExactly("\\frac", "\\label", "\\ref", "\\section");
        assertThat(symbols.labels()).containsExactly("sec:intro");
        assertThat(symbols.references()).containsExactly("eq:one", "sec:intro");
    }

    @Test
    void extract_labelWithStructuredArgument_isSkipped() {
        var document = LatexChew.parser()
                                .parseDocument("\\begin{document}\n\\label{a\\b}\\label x\n\\end{document}")
                                .unwrap();

        var symbols = SymbolExtractor.extract(document.body());

        assertThat(symbols.labels()).isEmpty();
        assertThat(symbols.commands()).containsExactly("\\b", "\\label");
    }
}
