package org.pragmatica.latex.cli;

import org.pragmatica.latex.parser.LatexParser;
import org.pragmatica.latex.util.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Common flow of a subcommand: read the input, run, print the listing or the error.
 */
abstract class ChewSubcommand implements Callable<Integer> {
    private static final Logger LOG = LoggerFactory.getLogger(ChewSubcommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_SYNTAX_ERROR = 1;
    static final int EXIT_IO_ERROR = 2;

    @CommandLine.Mixin
    InputOptions options;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    /**
     * Lines to print for the given source.
     */
    abstract Result<List<String>> run(LatexParser parser, String source);

    @Override
    public Integer call() {
        LoggingConfigurator.configure(options.verbose());
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        String source;
        try {
            source = options.readSource(System.in);
        } catch (IOException e) {
            LOG.debug("Cannot read {}", options.input(), e);
            err.println("error: cannot read " + options.input() + ": " + e.getMessage());
            err.flush();
            return EXIT_IO_ERROR;
        }

        return run(options.parser(), source)
            .fold(cause -> {
                      err.println("error: " + cause.message());
                      err.flush();
                      return EXIT_SYNTAX_ERROR;
                  },
                  lines -> {
                      lines.forEach(out::println);
                      out.flush();
                      return EXIT_OK;
                  });
    }
}
