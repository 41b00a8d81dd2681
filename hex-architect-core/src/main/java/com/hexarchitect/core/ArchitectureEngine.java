package com.hexarchitect.core;

import com.hexarchitect.core.config.EngineConfig;
import com.hexarchitect.core.graph.BuildResult;
import com.hexarchitect.core.graph.GraphBuilder;
import com.hexarchitect.core.model.Finding;
import com.hexarchitect.core.registry.ComponentContributor;
import com.hexarchitect.core.registry.ComponentRegistry;
import com.hexarchitect.core.registry.ContributorDiscovery;
import com.hexarchitect.core.validation.ValidationEngine;
import com.hexarchitect.core.validation.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Composition root tying registration, graph construction and validation together.
 *
 * <p>The engine owns no graph. Each {@link #rebuild()} collects entries into a fresh
 * {@link ComponentRegistry}, seals it, builds a new graph and validates it. Earlier snapshots
 * stay valid and unchanged; callers decide when to rebuild.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ArchitectureEngine engine = new ArchitectureEngine(ConfigLoader.load(configPath),
 *     ContributorDiscovery::discover);
 * EngineSnapshot snapshot = engine.rebuild();
 * snapshot.allFindings().forEach(System.out::println);
 * }</pre>
 */
public class ArchitectureEngine {

    private static final Logger log = LoggerFactory.getLogger(ArchitectureEngine.class);

    private final Supplier<? extends List<? extends ComponentContributor>> contributors;
    private final GraphBuilder graphBuilder;
    private final ValidationEngine validationEngine;

    /**
     * Creates an engine from configuration.
     *
     * @param config engine configuration
     * @param contributors supplies the contributors to run on every rebuild
     */
    public ArchitectureEngine(EngineConfig config, Supplier<? extends List<? extends ComponentContributor>> contributors) {
        this(contributors,
            new GraphBuilder(config.graph().duplicatePolicy(), config.graph().description(), Clock.systemUTC()),
            ValidationEngine.fromConfig(config.validation()));
    }

    /**
     * Creates an engine from explicit collaborators.
     *
     * @param contributors supplies the contributors to run on every rebuild
     * @param graphBuilder graph builder
     * @param validationEngine validation engine
     */
    public ArchitectureEngine(Supplier<? extends List<? extends ComponentContributor>> contributors,
                              GraphBuilder graphBuilder,
                              ValidationEngine validationEngine) {
        this.contributors = Objects.requireNonNull(contributors, "contributors must not be null");
        this.graphBuilder = Objects.requireNonNull(graphBuilder, "graphBuilder must not be null");
        this.validationEngine = Objects.requireNonNull(validationEngine, "validationEngine must not be null");
    }

    /**
     * Creates an engine with default configuration over all contributors on the class path.
     *
     * @return engine using SPI discovery
     */
    public static ArchitectureEngine withDiscoveredContributors() {
        return new ArchitectureEngine(EngineConfig.defaults(), ContributorDiscovery::discover);
    }

    public GraphBuilder getGraphBuilder() {
        return graphBuilder;
    }

    public ValidationEngine getValidationEngine() {
        return validationEngine;
    }

    /**
     * Re-runs collection, construction and validation.
     *
     * @return a new snapshot
     * @throws com.hexarchitect.core.graph.DuplicateNodeIdException if duplicates exist under the FAIL policy
     */
    public EngineSnapshot rebuild() {
        ComponentRegistry registry = new ComponentRegistry();
        int registered = ContributorDiscovery.contributeAll(registry, contributors.get());
        registry.seal();

        BuildResult result = graphBuilder.build(registry.collectAll());
        List<Finding> buildFindings = validationEngine.escalate(result.findings());
        ValidationReport report = validationEngine.validate(result.graph());

        log.info("Rebuilt architecture graph: {} entries, {} nodes, {} edges, {} build findings, {} violations",
            registered, result.graph().nodeCount(), result.graph().edgeCount(),
            buildFindings.size(), report.violations().size());

        return new EngineSnapshot(result.graph(), buildFindings, report);
    }
}
