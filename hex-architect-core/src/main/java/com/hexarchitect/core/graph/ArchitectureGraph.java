package com.hexarchitect.core.graph;

import com.hexarchitect.core.model.GraphEdge;
import com.hexarchitect.core.model.GraphNode;
import com.hexarchitect.core.model.Layer;
import com.hexarchitect.core.model.NodeId;
import com.hexarchitect.core.model.Role;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable dependency graph of an application's components.
 *
 * <p>A graph is produced by {@link GraphBuilder} and never changes afterwards: no node or
 * edge is added, removed or altered, and every collection returned by a query method is
 * unmodifiable. Instances can therefore be shared by reference between any number of
 * threads without coordination.
 *
 * <p>Adjacency ({@link #edgesFrom(NodeId)}, {@link #edgesTo(NodeId)}) and the layer and role
 * indices are computed once at construction.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ArchitectureGraph graph = new GraphBuilder().build(registry.collectAll()).graph();
 *
 * Set<GraphNode> ports = graph.nodesByLayer(Layer.PORT);
 * for (GraphNode port : ports) {
 *     List<GraphEdge> implementors = graph.edgesTo(port.id());
 * }
 * }</pre>
 *
 * @see GraphBuilder
 * @see GraphQuery
 * @see GraphAnalysis
 */
public final class ArchitectureGraph {

    private final Map<NodeId, GraphNode> nodes;
    private final List<GraphEdge> edges;
    private final Map<NodeId, List<GraphEdge>> outgoing;
    private final Map<NodeId, List<GraphEdge>> incoming;
    private final Map<Layer, Set<GraphNode>> nodesByLayer;
    private final Map<Role, Set<GraphNode>> nodesByRole;
    private final GraphMetadata metadata;

    private ArchitectureGraph(
            Map<NodeId, GraphNode> nodes,
            List<GraphEdge> edges,
            Map<NodeId, List<GraphEdge>> outgoing,
            Map<NodeId, List<GraphEdge>> incoming,
            Map<Layer, Set<GraphNode>> nodesByLayer,
            Map<Role, Set<GraphNode>> nodesByRole,
            GraphMetadata metadata
    ) {
        this.nodes = nodes;
        this.edges = edges;
        this.outgoing = outgoing;
        this.incoming = incoming;
        this.nodesByLayer = nodesByLayer;
        this.nodesByRole = nodesByRole;
        this.metadata = metadata;
    }

    /**
     * Freezes nodes and edges into a graph, computing all indices.
     *
     * @param nodes node index in insertion order
     * @param edges edges in declaration order
     * @param metadata graph metadata
     * @return immutable graph
     * @throws IllegalArgumentException if an edge references a node not in {@code nodes}
     */
    static ArchitectureGraph freeze(Map<NodeId, GraphNode> nodes, List<GraphEdge> edges, GraphMetadata metadata) {
        Objects.requireNonNull(nodes, "nodes must not be null");
        Objects.requireNonNull(edges, "edges must not be null");
        Objects.requireNonNull(metadata, "metadata must not be null");

        Map<NodeId, GraphNode> nodeIndex = new LinkedHashMap<>(nodes);
        Map<NodeId, List<GraphEdge>> out = new HashMap<>();
        Map<NodeId, List<GraphEdge>> in = new HashMap<>();

        for (GraphEdge edge : edges) {
            if (!nodeIndex.containsKey(edge.from()) || !nodeIndex.containsKey(edge.to())) {
                throw new IllegalArgumentException("Edge references a node outside the graph: " + edge);
            }
            out.computeIfAbsent(edge.from(), k -> new ArrayList<>()).add(edge);
            in.computeIfAbsent(edge.to(), k -> new ArrayList<>()).add(edge);
        }

        Map<Layer, Set<GraphNode>> byLayer = new EnumMap<>(Layer.class);
        Map<Role, Set<GraphNode>> byRole = new EnumMap<>(Role.class);
        for (GraphNode node : nodeIndex.values()) {
            byLayer.computeIfAbsent(node.layer(), k -> new LinkedHashSet<>()).add(node);
            byRole.computeIfAbsent(node.role(), k -> new LinkedHashSet<>()).add(node);
        }

        return new ArchitectureGraph(
            Collections.unmodifiableMap(nodeIndex),
            List.copyOf(edges),
            freezeLists(out),
            freezeLists(in),
            freezeSets(byLayer),
            freezeSets(byRole),
            metadata
        );
    }

    /**
     * Returns a graph without nodes or edges.
     *
     * @return empty graph
     */
    public static ArchitectureGraph empty() {
        return freeze(Map.of(), List.of(), GraphMetadata.of(GraphMetadata.DEFAULT_DESCRIPTION, Instant.EPOCH));
    }

    /**
     * Looks up a node by identifier.
     *
     * @param id node identifier
     * @return the node, or empty if absent
     */
    public Optional<GraphNode> node(NodeId id) {
        return Optional.ofNullable(nodes.get(id));
    }

    /**
     * Looks up a node by component type name.
     *
     * @param typeName component type name
     * @return the node, or empty if absent or blank
     */
    public Optional<GraphNode> node(String typeName) {
        if (typeName == null || typeName.isBlank()) {
            return Optional.empty();
        }
        return node(NodeId.of(typeName));
    }

    /**
     * Checks whether a node is present.
     *
     * @param id node identifier
     * @return true if the graph contains the node
     */
    public boolean contains(NodeId id) {
        return nodes.containsKey(id);
    }

    /**
     * Returns exactly the nodes whose layer matches.
     *
     * @param layer layer to select
     * @return unmodifiable set, empty if no node is in the layer
     */
    public Set<GraphNode> nodesByLayer(Layer layer) {
        return nodesByLayer.getOrDefault(layer, Set.of());
    }

    /**
     * Returns exactly the nodes whose role matches.
     *
     * @param role role to select
     * @return unmodifiable set, empty if no node has the role
     */
    public Set<GraphNode> nodesByRole(Role role) {
        return nodesByRole.getOrDefault(role, Set.of());
    }

    /**
     * Returns the outgoing edges of a node in declaration order.
     *
     * @param id source node
     * @return unmodifiable list, empty for unknown nodes
     */
    public List<GraphEdge> edgesFrom(NodeId id) {
        return outgoing.getOrDefault(id, List.of());
    }

    /**
     * Returns the incoming edges of a node in declaration order.
     *
     * @param id target node
     * @return unmodifiable list, empty for unknown nodes
     */
    public List<GraphEdge> edgesTo(NodeId id) {
        return incoming.getOrDefault(id, List.of());
    }

    /**
     * Returns all nodes in registration order.
     *
     * @return unmodifiable view of all nodes
     */
    public Collection<GraphNode> allNodes() {
        return nodes.values();
    }

    /**
     * Returns all edges in declaration order.
     *
     * @return unmodifiable list of all edges
     */
    public List<GraphEdge> allEdges() {
        return edges;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    /**
     * Returns the number of distinct layers populated by at least one node.
     *
     * @return populated layer count
     */
    public int layerCount() {
        return nodesByLayer.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public GraphMetadata metadata() {
        return metadata;
    }

    /**
     * Starts a filtered node query.
     *
     * @return new query over this graph
     */
    public GraphQuery query() {
        return new GraphQuery(this);
    }

    /**
     * Returns structural analysis over this graph.
     *
     * @return analysis view
     */
    public GraphAnalysis analysis() {
        return new GraphAnalysis(this);
    }

    @Override
    public String toString() {
        return "ArchitectureGraph[nodes=" + nodes.size() + ", edges=" + edges.size() + "]";
    }

    private static Map<NodeId, List<GraphEdge>> freezeLists(Map<NodeId, List<GraphEdge>> index) {
        Map<NodeId, List<GraphEdge>> frozen = new HashMap<>();
        index.forEach((id, list) -> frozen.put(id, List.copyOf(list)));
        return Collections.unmodifiableMap(frozen);
    }

    private static <K extends Enum<K>> Map<K, Set<GraphNode>> freezeSets(Map<K, Set<GraphNode>> index) {
        Map<K, Set<GraphNode>> frozen = new HashMap<>();
        index.forEach((key, set) -> frozen.put(key, Collections.unmodifiableSet(set)));
        return Collections.unmodifiableMap(frozen);
    }
}
