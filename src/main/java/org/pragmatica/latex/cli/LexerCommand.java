package org.pragmatica.latex.cli;

import org.pragmatica.latex.lexer.LatexToken;
import org.pragmatica.latex.lexer.TokenKind;
import org.pragmatica.latex.parser.LatexParser;
import org.pragmatica.latex.util.Result;
import org.pragmatica.latex.util.Texts;
import picocli.CommandLine;

import java.util.List;

@CommandLine.Command(name = "lexer", mixinStandardHelpOptions = true, description = "Print the token stream of the whole input")
class LexerCommand extends ChewSubcommand {
    private static final int TEXT_LENGTH = 16;

    @Override
    Result<List<String>> run(LatexParser parser, String source) {
        return parser.tokenize(source)
                     .map(tokens -> tokens.stream()
                                          .filter(token -> token.kind() != TokenKind.END_OF_INPUT)
                                          .map(LexerCommand::describe)
                                          .toList());
    }

    static String describe(LatexToken token) {
        var start = token.start();
        var text = Texts.length(token.text()) < TEXT_LENGTH
                   ? token.text()
                   : Texts.prefix(token.text(), TEXT_LENGTH) + "...";
        return start.offset() + " " + start.line() + " " + start.column() + " " + token.kind() + " : " + Texts.quote(text);
    }
}
