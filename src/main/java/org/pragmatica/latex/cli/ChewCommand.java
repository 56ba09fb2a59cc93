package org.pragmatica.latex.cli;

import picocli.CommandLine;

import java.io.PrintWriter;

/**
 * Command-line entry point.
 */
@CommandLine.Command(name = "latex-chew", mixinStandardHelpOptions = true, version = "latex-chew 0.1.0",
    description = "Parses a LaTeX file purely syntactically and selects top-level elements of its body",
    subcommands = {
        TreeCommand.class,
        LexerCommand.class,
        AnchorsCommand.class,
        ChunksCommand.class,
        SymbolsCommand.class
    })
public final class ChewCommand implements Runnable {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        System.exit(new CommandLine(new ChewCommand()).execute(args));
    }

    /**
     * Run with explicit output streams, returning the exit status.
     */
    public static int run(String[] args, PrintWriter out, PrintWriter err) {
        return new CommandLine(new ChewCommand())
            .setOut(out)
            .setErr(err)
            .execute(args);
    }

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
