package org.pivotspec.cli;

import java.io.File;
import java.net.URL;
import java.util.concurrent.Callable;

import org.pivotspec.cli.commands.CompileCommand;
import org.pivotspec.cli.commands.RangeCommand;
import org.pivotspec.cli.config.ConfigLoader;
import org.pivotspec.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "pivotspec",
    mixinStandardHelpOptions = true,
    version = "PivotSpec 1.0",
    description = "PivotSpec - compiles analytics widget definitions into backend query specs",
    subcommands = {
        CompileCommand.class,
        RangeCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/pivotspec.conf)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates a fully configured CommandLine instance.
     * <p>
     * Use this method in tests to get the same configuration as the CLI entry point.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("pivotspec");
        return commandLine;
    }

    /**
     * Resolves the configuration on first use and applies its logging settings.
     *
     * @return the resolved configuration
     * @throws IllegalArgumentException               if an explicit config file does not exist
     * @throws com.typesafe.config.ConfigException    if the configuration cannot be parsed
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }
        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);
        final Config resolved = ConfigLoader.resolve(configFile, (level, message) -> {
            switch (level) {
                case INFO -> logger.info(message);
                case WARN -> logger.warn(message);
            }
        });

        if (resolved.hasPath("pivotspec.logging.format")
            && "PLAIN".equalsIgnoreCase(resolved.getString("pivotspec.logging.format"))) {
            System.setProperty("pivotspec.logging.appender", "STDOUT_PLAIN");
            reconfigureLogback();
        }
        if (resolved.hasPath("pivotspec.logging")) {
            LoggingConfigurator.configure(resolved.getConfig("pivotspec.logging"));
        }
        this.config = resolved;
        return resolved;
    }

    private void reconfigureLogback() {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        final URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }
}
