package com.hexarchitect.cli;

import com.hexarchitect.core.config.ConfigLoader;
import com.hexarchitect.core.export.ExporterRegistry;
import com.hexarchitect.core.export.GraphExporter;
import com.hexarchitect.core.registry.ComponentContributor;
import com.hexarchitect.core.registry.ContributorDiscovery;
import com.hexarchitect.core.validation.ValidationEngine;
import com.hexarchitect.core.validation.ValidationRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to list available exporters, validation rules, or component contributors.
 *
 * <p>Discovers plugins via Java Service Provider Interface (SPI) and displays them.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * hexarchitect list exporters
 * hexarchitect list rules
 * hexarchitect list contributors
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available exporters, rules, or contributors",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Type to list: exporters, rules, or contributors")
    private String type;

    @Option(names = {"-c", "--config"}, description = "Configuration file used to list enabled rules",
        defaultValue = ConfigLoader.DEFAULT_FILE_NAME)
    private Path configFile;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "exporters", "exporter" -> listExporters();
            case "rules", "rule" -> listRules();
            case "contributors", "contributor" -> listContributors();
            default -> {
                log.error("Unknown type: {}. Use: exporters, rules, or contributors", type);
                yield 1;
            }
        };
    }

    private int listExporters() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Available Exporters:");
        out.println();

        List<GraphExporter> exporters = ExporterRegistry.discover().getExporters();
        for (GraphExporter exporter : exporters) {
            out.printf("  • %s (ID: %s)%n", exporter.getDisplayName(), exporter.getId());
            out.printf("    File Extension: .%s%n", exporter.getFileExtension());
            out.println();
        }
        if (exporters.isEmpty()) {
            out.println("  No exporters found.");
        }
        out.flush();
        return 0;
    }

    private int listRules() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Enabled Validation Rules:");
        out.println();

        ValidationEngine engine = ValidationEngine.fromConfig(ConfigLoader.load(configFile).validation());
        for (ValidationRule rule : engine.getRules()) {
            out.printf("  • %s%n", rule.getId());
            out.printf("    %s%n", rule.getDescription());
            out.println();
        }
        if (engine.getRules().isEmpty()) {
            out.println("  No rules enabled.");
        }
        out.flush();
        return 0;
    }

    private int listContributors() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Available Contributors:");
        out.println();

        List<ComponentContributor> contributors = ContributorDiscovery.discover();
        for (ComponentContributor contributor : contributors) {
            out.printf("  • %s (%s)%n", contributor.getId(), contributor.getClass().getName());
        }
        if (contributors.isEmpty()) {
            out.println("  No contributors found on the class path.");
        }
        out.flush();
        return 0;
    }
}
