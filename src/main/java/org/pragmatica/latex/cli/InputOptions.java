package org.pragmatica.latex.cli;

import org.pragmatica.latex.LatexChew;
import org.pragmatica.latex.parser.LatexParser;
import picocli.CommandLine;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Options shared by all subcommands: the input and the lexer configuration.
 */
public class InputOptions {

    @CommandLine.Parameters(index = "0", paramLabel = "INPUT", description = "LaTeX file to read, or - for standard input")
    private String input;

    @CommandLine.Option(names = "--verbatim", paramLabel = "ENV", description = "Additional environment whose body is captured verbatim (repeatable)")
    private List<String> verbatim = new ArrayList<>();

    @CommandLine.Option(names = "--no-verbatim", description = "Disable verbatim capture; verbatim bodies must follow the general grammar")
    private boolean noVerbatim;

    @CommandLine.Option(names = "--verbose", description = "Log parser diagnostics to standard error")
    private boolean verbose;

    public String input() {
        return input;
    }

    public boolean verbose() {
        return verbose;
    }

    public LatexParser parser() {
        return LatexChew.builder()
                        .verbatim(verbatim.toArray(String[]::new))
                        .captureVerbatim(!noVerbatim)
                        .build();
    }

    public String readSource(InputStream stdin) throws IOException {
        if ("-".equals(input)) {
            return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
        }
        return Files.readString(Path.of(input), StandardCharsets.UTF_8);
    }
}
