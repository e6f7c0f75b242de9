package io.logictree.cli.commands;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.logging.LogManager;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/// Main entry point for the logic tree CLI.
///
/// Registers the subcommands:
/// - `import` - Read a logic tree XML document into a dataset file
/// - `show` - Print branch-sets and realization counts
/// - `rlzs` - Enumerate or sample realizations
/// - `leaves` - List the leaves reachable from a branch
///
/// @see ImportCommand
/// @see ShowCommand
/// @see RealizationsCommand
/// @see LeavesCommand
@Command(
        name = "logictree",
        description = "Logic tree import, inspection and realization tool",
        mixinStandardHelpOptions = true,
        version = "logictree 0.1.0",
        subcommands = {
            ImportCommand.class,
            ShowCommand.class,
            RealizationsCommand.class,
            LeavesCommand.class
        })
public class LogicTreeCLI {

    static final String LOGGING_CONFIG = "/logging.properties";
    static final String DEFAULTS = "/logictree-cli.properties";

    public static void main(String[] args) {
        configureLogging();
        System.exit(commandLine().execute(args));
    }

    /// Creates the command line with defaults loaded from the classpath.
    ///
    /// @return configured command line, never null
    static CommandLine commandLine() {
        CommandLine commandLine = new CommandLine(new LogicTreeCLI());
        commandLine.setDefaultValueProvider(
                new CommandLine.PropertiesDefaultProvider(loadDefaults()));
        return commandLine;
    }

    static Properties loadDefaults() {
        Properties defaults = new Properties();
        try (InputStream in = LogicTreeCLI.class.getResourceAsStream(DEFAULTS)) {
            if (in != null) {
                defaults.load(in);
            }
        } catch (IOException e) {
            System.err.println(" [WARN] Could not read " + DEFAULTS + ": " + e.getMessage());
        }
        return defaults;
    }

    private static void configureLogging() {
        try (InputStream in = LogicTreeCLI.class.getResourceAsStream(LOGGING_CONFIG)) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println(" [WARN] Could not read " + LOGGING_CONFIG + ": " + e.getMessage());
        }
    }
}
