package com.hexarchitect.cli;

import com.hexarchitect.core.ArchitectureEngine;
import com.hexarchitect.core.EngineSnapshot;
import com.hexarchitect.core.config.EngineConfig;
import com.hexarchitect.core.graph.ArchitecturalPattern;
import com.hexarchitect.core.graph.DuplicateNodeIdException;
import com.hexarchitect.core.model.Finding;
import com.hexarchitect.core.model.FindingSeverity;
import com.hexarchitect.core.registry.ManifestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Command to build the architecture graph and report every finding.
 *
 * <p>Exit codes: {@code 0} without violations, {@code 1} with at least one violation,
 * {@code 2} when the graph could not be built.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * hexarchitect validate components.yaml
 * hexarchitect validate components.yaml --strict
 * }</pre>
 */
@Command(
    name = "validate",
    description = "Build the architecture graph and report findings",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    static final int EXIT_VIOLATIONS = 1;
    static final int EXIT_BUILD_FAILED = 2;

    @Spec
    private CommandSpec spec;

    @Mixin
    private SourceOptions source;

    @Option(names = "--strict", description = "Treat dangling dependencies as violations")
    private boolean strict;

    @Override
    public Integer call() {
        EngineConfig config = source.loadConfig();
        if (strict) {
            EngineConfig.ValidationSettings validation = config.validation();
            config = new EngineConfig(config.graph(),
                new EngineConfig.ValidationSettings(true, validation.rules(),
                    validation.expectedLayers(), validation.godComponentThreshold()),
                config.export());
        }

        EngineSnapshot snapshot;
        try {
            snapshot = new ArchitectureEngine(config, source::contributors).rebuild();
        } catch (ManifestException | DuplicateNodeIdException e) {
            log.error("Failed to build architecture graph: {}", e.getMessage());
            return EXIT_BUILD_FAILED;
        }

        PrintWriter out = spec.commandLine().getOut();
        out.printf("Architecture graph: %d components, %d dependencies, %d layers%n",
            snapshot.graph().nodeCount(), snapshot.graph().edgeCount(), snapshot.graph().layerCount());
        List<ArchitecturalPattern> patterns = snapshot.graph().analysis().identifyPatterns();
        if (!patterns.isEmpty()) {
            out.println("Patterns: " + patterns.stream().map(ArchitecturalPattern::toString)
                .collect(Collectors.joining(", ")));
        }

        List<Finding> findings = snapshot.allFindings();
        if (findings.isEmpty()) {
            out.println("No findings.");
        }
        for (FindingSeverity severity : new FindingSeverity[] {
                FindingSeverity.VIOLATION, FindingSeverity.WARNING, FindingSeverity.INFO}) {
            List<Finding> group = findings.stream().filter(f -> f.severity() == severity).toList();
            if (group.isEmpty()) {
                continue;
            }
            out.println();
            out.printf("%s (%d):%n", severity, group.size());
            group.forEach(f -> out.printf("  - %s: %s%n", f.ruleId(), f.explanation()));
        }
        out.flush();

        if (snapshot.hasViolations()) {
            log.error("Architecture validation failed");
            return EXIT_VIOLATIONS;
        }
        log.info("Architecture validation passed");
        return 0;
    }
}
