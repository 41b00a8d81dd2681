package com.hexarchitect;

import ch.qos.logback.classic.Level;
import com.hexarchitect.cli.ExportCommand;
import com.hexarchitect.cli.ListCommand;
import com.hexarchitect.cli.QueryCommand;
import com.hexarchitect.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Main CLI entry point for HexArchitect.
 *
 * <p>HexArchitect builds a hexagonal architecture graph from registered components, checks it
 * against layering rules and exports it as diagrams or documents.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code validate} - Build the graph and report findings</li>
 *   <li>{@code export} - Write the graph in one or more formats</li>
 *   <li>{@code query} - Print nodes or edges matching filters</li>
 *   <li>{@code list} - List available exporters, rules, or contributors</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Validate the components declared in a manifest
 * hexarchitect validate components.yaml
 *
 * # Export Mermaid and DOT diagrams
 * hexarchitect export components.yaml -f mermaid -f dot -o docs/architecture
 *
 * # Show all domain entities
 * hexarchitect query components.yaml --layer domain --role entity
 * }</pre>
 */
@Command(
    name = "hexarchitect",
    mixinStandardHelpOptions = true,
    version = "HexArchitect 1.0.0-SNAPSHOT",
    description = "Hexagonal architecture graph builder and validator",
    subcommands = {
        ValidateCommand.class,
        ExportCommand.class,
        QueryCommand.class,
        ListCommand.class
    }
)
public class HexArchitectCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(HexArchitectCLI.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return; // Suppress banner in quiet mode
        }

        spec.commandLine().getOut().println("HexArchitect - Hexagonal Architecture Graph");
        spec.commandLine().getOut().println("Version: 1.0.0-SNAPSHOT");
        spec.commandLine().getOut().println();
        spec.commandLine().getOut().println("Use 'hexarchitect --help' to see available commands");
        spec.commandLine().getOut().println("Use 'hexarchitect <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose={}, quiet={})", verbose, quiet);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with global options applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine createCommandLine() {
        HexArchitectCLI cli = new HexArchitectCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}
