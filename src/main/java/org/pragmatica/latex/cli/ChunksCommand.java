package org.pragmatica.latex.cli;

import org.pragmatica.latex.LatexChew;
import org.pragmatica.latex.chunk.Chunk;
import org.pragmatica.latex.parser.LatexParser;
import org.pragmatica.latex.util.Result;
import picocli.CommandLine;

import java.util.List;

@CommandLine.Command(name = "chunks", mixinStandardHelpOptions = true,
    description = "List the line and character ranges between consecutive anchors of the document body")
class ChunksCommand extends ChewSubcommand {

    @CommandLine.Parameters(index = "1..*", arity = "1..*", paramLabel = "SELECTOR", description = "Anchor selectors")
    private List<String> selectors;

    @Override
    Result<List<String>> run(LatexParser parser, String source) {
        return parser.parseDocument(source)
                     .flatMap(document -> LatexChew.chunks(document, selectors))
                     .map(chunks -> chunks.stream()
                                          .map(Chunk::describe)
                                          .toList());
    }
}
