package com.hexarchitect.cli;

import com.hexarchitect.core.ArchitectureEngine;
import com.hexarchitect.core.graph.ArchitectureGraph;
import com.hexarchitect.core.graph.DuplicateNodeIdException;
import com.hexarchitect.core.graph.GraphQuery;
import com.hexarchitect.core.model.GraphEdge;
import com.hexarchitect.core.model.GraphNode;
import com.hexarchitect.core.model.Layer;
import com.hexarchitect.core.model.Role;
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
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command to print graph nodes matching filters, or the outgoing edges of one node.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * hexarchitect query components.yaml --layer domain --role entity
 * hexarchitect query components.yaml --name Repository
 * hexarchitect query components.yaml --edges-from InMemoryUserRepository
 * }</pre>
 */
@Command(
    name = "query",
    description = "Print components or dependencies matching filters",
    mixinStandardHelpOptions = true
)
public class QueryCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(QueryCommand.class);

    @Spec
    private CommandSpec spec;

    @Mixin
    private SourceOptions source;

    @Option(names = "--layer", description = "Layer filter: ${COMPLETION-CANDIDATES}")
    private Layer layer;

    @Option(names = "--role", description = "Role filter: ${COMPLETION-CANDIDATES}")
    private Role role;

    @Option(names = "--name", description = "Type name substring filter")
    private String name;

    @Option(names = "--module", description = "Module path substring filter")
    private String module;

    @Option(names = "--edges-from", description = "Print the dependencies of this component instead")
    private String edgesFrom;

    @Override
    public Integer call() {
        ArchitectureGraph graph;
        try {
            graph = new ArchitectureEngine(source.loadConfig(), source::contributors).rebuild().graph();
        } catch (ManifestException | DuplicateNodeIdException e) {
            log.error("Failed to build architecture graph: {}", e.getMessage());
            return ValidateCommand.EXIT_BUILD_FAILED;
        }

        PrintWriter out = spec.commandLine().getOut();
        if (edgesFrom != null) {
            Optional<GraphNode> node = graph.node(edgesFrom);
            if (node.isEmpty()) {
                log.error("Component not found: {}", edgesFrom);
                return 1;
            }
            for (GraphEdge edge : graph.edgesFrom(node.get().id())) {
                out.printf("%s -> %s%n", edge.from(), edge.to());
            }
            out.flush();
            return 0;
        }

        GraphQuery query = graph.query();
        if (layer != null) {
            query.layer(layer);
        }
        if (role != null) {
            query.role(role);
        }
        if (name != null) {
            query.typeNameContains(name);
        }
        if (module != null) {
            query.modulePathContains(module);
        }

        List<GraphNode> matches = query.execute();
        for (GraphNode node : matches) {
            out.printf("%s [%s/%s]%s%n", node.typeName(), node.layer(), node.role(),
                node.modulePath().isEmpty() ? "" : " " + node.modulePath());
        }
        out.flush();
        log.debug("Query matched {} of {} components", matches.size(), graph.nodeCount());
        return 0;
    }
}
