package org.pcfgstego.cli;

import com.typesafe.config.Config;
import org.pcfgstego.cli.commands.CapacityCommand;
import org.pcfgstego.cli.commands.DetectCommand;
import org.pcfgstego.cli.commands.EncodeCommand;
import org.pcfgstego.config.CodecSettings;
import org.pcfgstego.config.ConfigLoader;
import org.pcfgstego.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "pcfg-stego",
    mixinStandardHelpOptions = true,
    version = "pcfg-stego 1.0",
    description = "Hides key-derived bit payloads in grammar-generated sentences and recovers them.",
    subcommands = {
        EncodeCommand.class,
        DetectCommand.class,
        CapacityCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    /** Exit code for an unreadable or invalid grammar. */
    public static final int EXIT_GRAMMAR_ERROR = 2;

    /** Exit code for an input or wordlist file that cannot be read. */
    public static final int EXIT_IO_ERROR = 3;

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + " if present)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("pcfg-stego");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging section.
     *
     * @return The resolved configuration.
     */
    public Config getConfig() {
        if (config == null) {
            config = configFile != null ? ConfigLoader.load(configFile) : ConfigLoader.load();
            LoggingConfigurator.configure(config);
        }
        return config;
    }

    public CodecSettings getSettings() {
        return CodecSettings.fromConfig(getConfig());
    }
}
