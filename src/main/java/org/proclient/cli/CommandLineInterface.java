package org.proclient.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.proclient.cli.commands.AttachCommand;
import org.proclient.cli.commands.DetachCommand;
import org.proclient.cli.commands.DisableCommand;
import org.proclient.cli.commands.EnableCommand;
import org.proclient.cli.commands.HelpCommand;
import org.proclient.cli.commands.RefreshCommand;
import org.proclient.cli.commands.StatusCommand;
import org.proclient.config.ConfigLoader;
import org.proclient.config.LoggingConfigurator;
import org.proclient.spi.IPrivilegeChecker;
import org.proclient.spi.ServiceRegistry;
import org.proclient.system.UnixPrivilegeChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "pro",
    mixinStandardHelpOptions = true,
    version = "pro 1.0",
    description = "Manage Ubuntu Pro services on this machine.",
    subcommands = {
        AttachCommand.class,
        DetachCommand.class,
        RefreshCommand.class,
        EnableCommand.class,
        DisableCommand.class,
        StatusCommand.class,
        HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to a custom configuration file (default: /etc/ubuntu-advantage/pro.conf)"
    )
    private File configFile;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private final IPrivilegeChecker privilegeChecker;
    private Config config;
    private ServiceRegistry registry;

    public CommandLineInterface() {
        this(new UnixPrivilegeChecker());
    }

    /**
     * Creates a CLI that builds its collaborators from configuration on first use.
     *
     * @param privilegeChecker Decides whether the caller may run commands; consulted before configuration is loaded.
     */
    public CommandLineInterface(final IPrivilegeChecker privilegeChecker) {
        this.privilegeChecker = privilegeChecker;
    }

    /**
     * Creates a CLI with preconfigured collaborators instead of the ones built from configuration.
     *
     * @param config   The configuration to use.
     * @param registry The collaborators commands look up, including the {@link IPrivilegeChecker}.
     */
    public CommandLineInterface(final Config config, final ServiceRegistry registry) {
        this.config = config;
        this.registry = registry;
        this.privilegeChecker = registry.get(IPrivilegeChecker.class);
    }

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final int exitCode = createCommandLine(new CommandLineInterface()).execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates the picocli command line with the client's exit code conventions: any invalid
     * input or failed execution ends with exit code 1 and a message on stderr.
     *
     * @param cli The root command.
     * @return The configured command line.
     */
    public static CommandLine createCommandLine(final CommandLineInterface cli) {
        final CommandLine commandLine = new CommandLine(cli);
        commandLine.setCommandName("pro");
        commandLine.setParameterExceptionHandler((ex, args) -> {
            final CommandLine failed = ex.getCommandLine();
            failed.getErr().println(ex.getMessage());
            failed.usage(failed.getErr());
            return 1;
        });
        commandLine.setExecutionExceptionHandler((ex, failed, parseResult) -> {
            LOGGER.debug("Command failed", ex);
            failed.getErr().println(ex.getMessage());
            return 1;
        });
        return commandLine;
    }

    /**
     * Returns the client configuration, loading it and applying the logging settings on first use.
     *
     * @return The resolved configuration.
     */
    public Config getConfig() {
        if (config == null) {
            try {
                config = ConfigLoader.load(configFile);
            } catch (final ConfigException e) {
                throw new IllegalStateException("Failed to load or parse configuration: " + e.getMessage(), e);
            }
            LoggingConfigurator.configure(config);
        }
        return config;
    }

    public IPrivilegeChecker getPrivilegeChecker() {
        return privilegeChecker;
    }

    public ServiceRegistry getRegistry() {
        if (registry == null) {
            registry = ClientServiceFactory.create(getConfig());
        }
        return registry;
    }
}
