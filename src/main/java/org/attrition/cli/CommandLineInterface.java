package org.attrition.cli;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.attrition.cli.commands.TickCommand;
import org.attrition.cli.commands.node.NodeCommand;
import org.attrition.node.config.ConfigLoader;
import org.attrition.node.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.net.URL;
import java.util.concurrent.Callable;

@Command(
    name = "attrition",
    mixinStandardHelpOptions = true,
    version = "Attrition Engine 1.0",
    description = "Attrition - queue, energy and scheduling engine",
    subcommands = {
        NodeCommand.class,
        TickCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to the configuration file (default: attrition.conf)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    /**
     * Command line whose failures are logged and mapped to exit code 1.
     */
    public static CommandLine newCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setExecutionExceptionHandler((e, cmd, parseResult) -> {
            LOGGER.error("{} failed: {}", cmd.getCommandName(), e.getMessage());
            LOGGER.debug("Command failure details:", e);
            return 1;
        });
        return commandLine;
    }

    /**
     * Loads the configuration on first use. The file is taken from {@code --config}, then
     * {@code -Dconfig.file}, then {@code ./attrition.conf}; classpath defaults apply beneath it.
     *
     * @throws IllegalArgumentException if an explicitly named file does not exist
     */
    public synchronized Config getConfig() {
        if (config != null) {
            return config;
        }
        File file = configFile;
        if (file == null && System.getProperty("config.file") != null && !System.getProperty("config.file").isBlank()) {
            file = new File(System.getProperty("config.file")).getAbsoluteFile();
        }
        if (file != null && !file.isFile()) {
            throw new IllegalArgumentException("Configuration file not found: " + file.getAbsolutePath());
        }
        try {
            config = file != null ? ConfigLoader.load(file) : ConfigLoader.load();
        } catch (final ConfigException e) {
            throw new IllegalArgumentException("Failed to load configuration: " + e.getMessage(), e);
        }
        if (config.hasPath("logging.format")) {
            System.setProperty(LoggingConfigurator.FORMAT_PROPERTY,
                "PLAIN".equalsIgnoreCase(config.getString("logging.format")) ? "STDOUT_PLAIN" : "STDOUT");
            reloadLogback();
        }
        LoggingConfigurator.configure(config);
        return config;
    }

    private static void reloadLogback() {
        final URL logbackXml = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (logbackXml == null) {
            return;
        }
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(logbackXml);
        } catch (final JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }
}
