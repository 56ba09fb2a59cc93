package org.pragmatica.latex.cli;

import org.pragmatica.latex.parser.LatexParser;
import org.pragmatica.latex.tree.TreeDump;
import org.pragmatica.latex.util.Result;
import picocli.CommandLine;

import java.util.List;

@CommandLine.Command(name = "tree", mixinStandardHelpOptions = true, description = "Print the syntax tree, one node per line")
class TreeCommand extends ChewSubcommand {

    @Override
    Result<List<String>> run(LatexParser parser, String source) {
        return parser.parseDocument(source)
                     .map(document -> TreeDump.lines(document.root()));
    }
}
