package com.hexarchitect.core.graph;

import com.hexarchitect.core.model.GraphNode;
import com.hexarchitect.core.model.Layer;
import com.hexarchitect.core.model.Role;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Fluent node filter over an {@link ArchitectureGraph}.
 *
 * <p>All filters must match for a node to be selected. A query without filters selects every
 * node.
 *
 * <pre>{@code
 * List<GraphNode> repositories = graph.query()
 *     .layer(Layer.PORT)
 *     .role(Role.REPOSITORY)
 *     .typeNameContains("User")
 *     .execute();
 * }</pre>
 */
public class GraphQuery {

    private final ArchitectureGraph graph;
    private final List<Predicate<GraphNode>> filters = new ArrayList<>();

    GraphQuery(ArchitectureGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph must not be null");
    }

    public GraphQuery layer(Layer layer) {
        Objects.requireNonNull(layer, "layer must not be null");
        filters.add(node -> node.layer() == layer);
        return this;
    }

    public GraphQuery role(Role role) {
        Objects.requireNonNull(role, "role must not be null");
        filters.add(node -> node.role() == role);
        return this;
    }

    public GraphQuery typeNameContains(String substring) {
        Objects.requireNonNull(substring, "substring must not be null");
        filters.add(node -> node.typeName().contains(substring));
        return this;
    }

    public GraphQuery modulePathContains(String substring) {
        Objects.requireNonNull(substring, "substring must not be null");
        filters.add(node -> node.modulePath().contains(substring));
        return this;
    }

    /**
     * Returns the matching nodes in registration order.
     *
     * @return matching nodes
     */
    public List<GraphNode> execute() {
        return graph.allNodes().stream()
            .filter(this::matchesAll)
            .toList();
    }

    public long count() {
        return graph.allNodes().stream()
            .filter(this::matchesAll)
            .count();
    }

    public Optional<GraphNode> first() {
        return graph.allNodes().stream()
            .filter(this::matchesAll)
            .findFirst();
    }

    private boolean matchesAll(GraphNode node) {
        return filters.stream().allMatch(filter -> filter.test(node));
    }
}
