package org.scallopsim.cli;

import com.typesafe.config.Config;
import org.scallopsim.cli.commands.RunCommand;
import org.scallopsim.cli.commands.SummaryCommand;
import org.scallopsim.config.ConfigLoader;
import org.scallopsim.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "scallopsim",
    mixinStandardHelpOptions = true,
    version = "scallopsim 1.0",
    description = "Hydrodynamic simulation of a hinged two-filament scallop at zero Reynolds number",
    subcommands = {
        RunCommand.class,
        SummaryCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
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
        final int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * @return a command line bound to a fresh root command.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("scallopsim");
        return commandLine;
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @return the resolved configuration.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed.
     * @throws IllegalArgumentException if {@code --config} names a missing file.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
