package org.pragmatica.latex.cli;

import org.pragmatica.latex.parser.LatexParser;
import org.pragmatica.latex.symbols.SymbolExtractor;
import org.pragmatica.latex.util.Result;
import picocli.CommandLine;

import java.util.ArrayList;
import java.util.List;

@CommandLine.Command(name = "symbols", mixinStandardHelpOptions = true,
    description = "List the commands, labels and references used in the document body")
class SymbolsCommand extends ChewSubcommand {

    @Override
    Result<List<String>> run(LatexParser parser, String source) {
        return parser.parseDocument(source)
                     .map(document -> {
                         var symbols = SymbolExtractor.extract(document.body());
                         var lines = new ArrayList<String>();
                         symbols.commands().forEach(name -> lines.add("command " + name));
                         symbols.labels().forEach(key -> lines.add("label " + key));
                         symbols.references().forEach(key -> lines.add("ref " + key));
                         return lines;
                     });
    }
}
