package org.tensorscript.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.tensorscript.cli.commands.CompileCommand;
import org.tensorscript.config.ConfigLoader;
import org.tensorscript.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "tensorscript",
    mixinStandardHelpOptions = true,
    version = "TensorScript 0.1",
    description = "TensorScript - compiles restricted scripts to computation graphs",
    subcommands = {
        CompileCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("tensorscript");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use: the file given via {@code --config}, otherwise
     * {@value ConfigLoader#CONFIG_FILE_NAME} in the working directory, over the classpath defaults.
     *
     * @return The resolved configuration.
     * @throws CommandLine.ParameterException if the file given via {@code --config} does not exist.
     * @throws ConfigException if the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }
        if (configFile != null) {
            if (!configFile.exists()) {
                throw new CommandLine.ParameterException(spec != null ? spec.commandLine() : new CommandLine(this),
                        "Configuration file specified via --config was not found: " + configFile.getAbsolutePath());
            }
            LOG.info("Using configuration file specified via --config: {}", configFile.getAbsolutePath());
            config = ConfigLoader.load(configFile);
        } else {
            config = ConfigLoader.load();
        }
        LoggingConfigurator.configure(config);
        return config;
    }
}
