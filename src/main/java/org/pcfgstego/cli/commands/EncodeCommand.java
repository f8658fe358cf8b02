package org.pcfgstego.cli.commands;

import org.pcfgstego.api.StegoCodec;
import org.pcfgstego.cli.CommandLineInterface;
import org.pcfgstego.codec.encode.EncodeResult;
import org.pcfgstego.config.CodecSettings;
import org.pcfgstego.grammar.Grammar;
import org.pcfgstego.grammar.GrammarLoader;
import org.pcfgstego.grammar.api.GrammarException;
import org.pcfgstego.internal.services.SeededRandomProvider;
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
    name = "encode",
    description = "Generates a sentence that carries the payload derived from a message and key."
)
public class EncodeCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(EncodeCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-g", "--grammar"}, required = true, description = "Grammar file.")
    private Path grammarFile;

    @Option(names = {"-m", "--message"}, required = true, description = "Secret message.")
    private String message;

    @Option(names = {"-k", "--key"}, required = true, description = "Key.")
    private String key;

    @Option(names = "--bits", description = "Payload length (default: configured, 96).")
    private Integer bits;

    @Option(names = "--max-bits", description = "Upper bound on embedded bits, 0 for none.")
    private Integer maxBits;

    @Option(names = "--seed", description = "Seed for reproducible output.")
    private Long seed;

    @Override
    public Integer call() {
        final CodecSettings settings = parent.getSettings();
        final Grammar grammar;
        try {
            grammar = new GrammarLoader(settings.grammar().createParser()).load(grammarFile);
        } catch (GrammarException e) {
            LOGGER.error("Cannot load grammar: {}", e.getMessage());
            return CommandLineInterface.EXIT_GRAMMAR_ERROR;
        }

        final StegoCodec codec = seed != null
                ? new StegoCodec(grammar, settings, settings.naturalness().createEvaluator(), new SeededRandomProvider(seed))
                : StegoCodec.create(grammar, settings);
        final int payloadBits = bits != null ? bits : settings.encoder().payloadBits();
        final int cap = maxBits != null ? maxBits : settings.encoder().maxBits();

        final EncodeResult result = codec.encode(message, key, payloadBits, cap);
        final PrintWriter out = spec.commandLine().getOut();
        out.println(result.text());
        out.flush();
        LOGGER.info("Embedded {}/{} bits in {} attempt(s)", result.bitsEmbedded(), result.payload().length(), result.attempts());
        return 0;
    }
}
