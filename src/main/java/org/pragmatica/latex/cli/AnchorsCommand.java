package org.pragmatica.latex.cli;

import org.pragmatica.latex.LatexChew;
import org.pragmatica.latex.parser.LatexParser;
import org.pragmatica.latex.select.Anchor;
import org.pragmatica.latex.util.Result;
import picocli.CommandLine;

import java.util.List;

@CommandLine.Command(name = "anchors", mixinStandardHelpOptions = true,
    description = "List top-level nodes matching any selector: \\NAME or m:NAME, {NAME} or e:NAME, %WORD or c:WORD")
class AnchorsCommand extends ChewSubcommand {

    @CommandLine.Parameters(index = "1..*", arity = "1..*", paramLabel = "SELECTOR", description = "Anchor selectors")
    private List<String> selectors;

    @Override
    Result<List<String>> run(LatexParser parser, String source) {
        return parser.parseDocument(source)
                     .flatMap(document -> LatexChew.anchors(document, selectors))
                     .map(anchors -> anchors.stream()
                                            .map(Anchor::describe)
                                            .toList());
    }
}
