package org.cachegrid.cli;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.cachegrid.cli.commands.InspectCommand;
import org.cachegrid.cli.commands.PlayCommand;
import org.cachegrid.cli.config.ConfigLoader;
import org.cachegrid.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.net.URL;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "cachegrid",
    mixinStandardHelpOptions = true,
    version = "CacheGrid 1.0",
    description = "CacheGrid - collect and merge tokens on an endless procedural grid",
    subcommands = {
        PlayCommand.class,
        InspectCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: cachegrid.conf)"
    )
    private File configFile;

    @Option(
        names = "-D",
        mapFallbackValue = "",
        description = "Override a HOCON configuration value. For example: -Dcachegrid.seed=42"
    )
    private Map<String, String> overrides;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("cachegrid");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private void initialize() {
        if (initialized) {
            return;
        }
        try {
            this.config = ConfigLoader.load(configFile, overrides);
        } catch (ConfigException | IllegalArgumentException e) {
            LOG.error("Failed to load configuration: {}", e.getMessage());
            throw e;
        }

        // Logging setup; logback.xml is only reloaded when the appender actually changes
        if (config.hasPath("logging.format")) {
            final String appender = LoggingConfigurator.appenderFor(config.getString("logging.format"));
            final String current = System.getProperty(LoggingConfigurator.FORMAT_PROPERTY, LoggingConfigurator.appenderFor("PLAIN"));
            if (!appender.equals(current)) {
                System.setProperty(LoggingConfigurator.FORMAT_PROPERTY, appender);
                reconfigureLogback();
            }
        }
        LoggingConfigurator.configure(config);
        initialized = true;
    }

    private void reconfigureLogback() {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        final URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        try {
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            LOG.error("Failed to reconfigure Logback from {}", configUrl, e);
        }
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @return The merged configuration.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
