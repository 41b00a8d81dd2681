package com.hexarchitect.cli;

import com.hexarchitect.core.ArchitectureEngine;
import com.hexarchitect.core.EngineSnapshot;
import com.hexarchitect.core.config.EngineConfig;
import com.hexarchitect.core.export.DocumentWriter;
import com.hexarchitect.core.export.ExportException;
import com.hexarchitect.core.export.ExporterRegistry;
import com.hexarchitect.core.export.GraphExporter;
import com.hexarchitect.core.graph.DuplicateNodeIdException;
import com.hexarchitect.core.registry.ManifestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command to export the architecture graph as documents.
 *
 * <p>Formats and output directory default to the {@code export} section of the configuration.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * hexarchitect export components.yaml
 * hexarchitect export components.yaml -f dot -f json -o build/architecture
 * }</pre>
 */
@Command(
    name = "export",
    description = "Export the architecture graph (mermaid, dot, json, markdown)",
    mixinStandardHelpOptions = true
)
public class ExportCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExportCommand.class);

    @Spec
    private CommandSpec spec;

    @Mixin
    private SourceOptions source;

    @Option(names = {"-f", "--format"}, description = "Exporter id; repeatable (default: from config)")
    private List<String> formats;

    @Option(names = {"-o", "--output"}, description = "Output directory (default: from config)")
    private Path outputDirectory;

    @Override
    public Integer call() {
        EngineConfig config = source.loadConfig();
        ExporterRegistry registry = ExporterRegistry.discover();

        List<String> selected = formats == null || formats.isEmpty() ? config.export().formats() : formats;
        List<GraphExporter> exporters = new ArrayList<>();
        for (String format : selected) {
            Optional<GraphExporter> exporter = registry.find(format);
            if (exporter.isEmpty()) {
                log.error("Unknown export format: {}. Available: {}", format, registry.ids());
                return 1;
            }
            exporters.add(exporter.get());
        }

        EngineSnapshot snapshot;
        try {
            snapshot = new ArchitectureEngine(config, source::contributors).rebuild();
        } catch (ManifestException | DuplicateNodeIdException e) {
            log.error("Failed to build architecture graph: {}", e.getMessage());
            return ValidateCommand.EXIT_BUILD_FAILED;
        }

        Path directory = outputDirectory != null ? outputDirectory : Paths.get(config.export().directory());
        DocumentWriter writer = new DocumentWriter(directory);
        try {
            for (GraphExporter exporter : exporters) {
                Path written = writer.write(exporter.export(snapshot.graph()));
                spec.commandLine().getOut().printf("%s: %s%n", exporter.getDisplayName(), written);
            }
        } catch (ExportException e) {
            log.error("Export failed: {}", e.getMessage(), e);
            return 1;
        }
        spec.commandLine().getOut().flush();

        log.info("Exported {} documents to {}", exporters.size(), directory);
        return 0;
    }
}
