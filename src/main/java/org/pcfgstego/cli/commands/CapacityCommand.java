package org.pcfgstego.cli.commands;

import org.pcfgstego.api.CapacityReport;
import org.pcfgstego.api.StegoCodec;
import org.pcfgstego.cli.CommandLineInterface;
import org.pcfgstego.grammar.api.GrammarException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "capacity",
    description = "Reports the maximum number of bits a grammar can embed."
)
public class CapacityCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(CapacityCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-g", "--grammar"}, required = true, description = "Grammar file.")
    private Path grammarFile;

    @Option(names = {"-v", "--verbose"}, description = "List the contribution of every symbol.")
    private boolean verbose;

    @Override
    public Integer call() {
        final CapacityReport report;
        try {
            report = StegoCodec.fromFile(grammarFile, parent.getSettings()).capacity();
        } catch (GrammarException e) {
            LOGGER.error("Cannot load grammar: {}", e.getMessage());
            return CommandLineInterface.EXIT_GRAMMAR_ERROR;
        }
        final PrintWriter out = spec.commandLine().getOut();
        out.println("max bits: " + report.maxBits());
        if (verbose) {
            report.bitsPerSymbol().forEach((symbol, bits) -> out.printf("  %s: %d%n", symbol, bits));
        }
        out.flush();
        return 0;
    }
}
