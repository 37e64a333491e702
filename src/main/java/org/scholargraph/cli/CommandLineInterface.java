package org.scholargraph.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.scholargraph.ScholarGraphEngine;
import org.scholargraph.cli.commands.ExportSampleCommand;
import org.scholargraph.cli.commands.FilterCommand;
import org.scholargraph.cli.commands.GraphCommand;
import org.scholargraph.cli.commands.QueryCommand;
import org.scholargraph.config.ConfigLoader;
import org.scholargraph.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "scholargraph",
    mixinStandardHelpOptions = true,
    version = "ScholarGraph 1.0",
    description = "ScholarGraph - institutional citation and collaboration network analysis",
    subcommands = {
        FilterCommand.class,
        GraphCommand.class,
        QueryCommand.class,
        ExportSampleCommand.class,
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
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("scholargraph");
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        System.exit(commandLine.execute(args));
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @throws ConfigException if the configuration cannot be parsed or resolved.
     * @throws IllegalArgumentException if {@code --config} names a missing file.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
        }
        return config;
    }

    /**
     * @return A new engine over the loaded configuration; the caller must close it.
     */
    public ScholarGraphEngine openEngine() {
        return ScholarGraphEngine.create(getConfig());
    }
}
