package org.pcfgstego.cli.commands;

import org.pcfgstego.api.DetectOptions;
import org.pcfgstego.api.DetectionReport;
import org.pcfgstego.api.StegoCodec;
import org.pcfgstego.cli.CommandLineInterface;
import org.pcfgstego.codec.detect.SlotMatch;
import org.pcfgstego.codec.search.KeyCandidate;
import org.pcfgstego.grammar.api.GrammarException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "detect",
    description = "Reads the hidden bits from a text and optionally ranks candidate keys."
)
public class DetectCommand implements Callable<Integer> {

    /** Exit code when the text carries no detectable payload. */
    public static final int EXIT_NOT_DETECTED = 1;

    private static final Logger LOGGER = LoggerFactory.getLogger(DetectCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-g", "--grammar"}, required = true, description = "Grammar file.")
    private Path grammarFile;

    @ArgGroup(exclusive = true, multiplicity = "1")
    private Input input;

    static class Input {
        @Option(names = {"-t", "--text"}, description = "Text to analyse.")
        String text;

        @Option(names = {"-i", "--input"}, description = "File containing the text to analyse.")
        Path file;
    }

    @Option(names = {"-k", "--key"}, description = "Candidate key; repeat for several.")
    private List<String> keys = new ArrayList<>();

    @Option(names = {"-w", "--wordlist"}, description = "File of candidate messages, one per line.")
    private Path wordlist;

    @Option(names = {"-s", "--slots"}, split = ",", description = "Slot symbols in payload order.")
    private List<String> slots = new ArrayList<>();

    @Override
    public Integer call() {
        final StegoCodec codec;
        try {
            codec = StegoCodec.fromFile(grammarFile, parent.getSettings(), true);
        } catch (GrammarException e) {
            LOGGER.error("Cannot load grammar: {}", e.getMessage());
            return CommandLineInterface.EXIT_GRAMMAR_ERROR;
        }

        final String text;
        final DetectOptions.Builder options = DetectOptions.builder().withKeys(keys).withSlotSymbols(slots);
        try {
            text = input.text != null ? input.text : Files.readString(input.file, StandardCharsets.UTF_8);
            if (wordlist != null) {
                options.withWordlist(wordlist);
            }
        } catch (IOException e) {
            LOGGER.error("Cannot read input: {}", e.toString());
            return CommandLineInterface.EXIT_IO_ERROR;
        }

        final DetectionReport report = codec.detect(text, options.build());
        final PrintWriter out = spec.commandLine().getOut();
        if (!report.detected()) {
            out.println("detected: false");
            out.flush();
            return EXIT_NOT_DETECTED;
        }

        out.println("detected: true");
        out.println("bits: " + report.bits());
        out.printf("naturality: %.3f%n", report.detection().naturality());
        for (SlotMatch match : report.detection().matches()) {
            out.printf("  %s = %s -> %s [%d,%d)%n", match.symbol(), match.alternative(), match.codeword(),
                    match.start(), match.end());
        }
        for (KeyCandidate candidate : report.recoveries()) {
            out.printf("key %s: %s (%.2f)%n", candidate.key(), candidate.messageOrNote(), candidate.confidence());
        }
        out.flush();
        return 0;
    }
}
