package com.hexarchitect.core.graph;

import com.hexarchitect.core.model.GraphEdge;
import com.hexarchitect.core.model.GraphNode;
import com.hexarchitect.core.model.NodeId;
import com.hexarchitect.core.model.Role;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Structural analysis over an {@link ArchitectureGraph}: cycles, coupling, roots, leaves and
 * inferred patterns.
 *
 * <p>All methods are pure functions of the graph.
 */
public class GraphAnalysis {

    private final ArchitectureGraph graph;

    GraphAnalysis(ArchitectureGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph must not be null");
    }

    /**
     * Detects dependency cycles with a depth-first search.
     *
     * <p>Each cycle is reported once, as the path from the first node of the cycle reached by
     * the search back to the node that closes it. A self-dependency is a cycle of one node.
     * The search keeps its own stack, so chain length is bounded only by the heap.
     *
     * @return cycles in discovery order
     */
    public List<List<NodeId>> detectCycles() {
        List<List<NodeId>> cycles = new ArrayList<>();
        Set<NodeId> visited = new HashSet<>();
        Map<NodeId, Integer> pathIndex = new HashMap<>();
        List<NodeId> path = new ArrayList<>();
        Deque<Frame> stack = new ArrayDeque<>();

        for (GraphNode node : graph.allNodes()) {
            if (visited.contains(node.id())) {
                continue;
            }
            enter(node.id(), visited, pathIndex, path, stack);

            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (frame.next < frame.edges.size()) {
                    NodeId target = frame.edges.get(frame.next++).to();
                    if (!visited.contains(target)) {
                        enter(target, visited, pathIndex, path, stack);
                    } else if (pathIndex.containsKey(target)) {
                        cycles.add(List.copyOf(path.subList(pathIndex.get(target), path.size())));
                    }
                } else {
                    stack.pop();
                    path.remove(path.size() - 1);
                    pathIndex.remove(frame.id);
                }
            }
        }
        return cycles;
    }

    private void enter(NodeId id, Set<NodeId> visited, Map<NodeId, Integer> pathIndex,
                       List<NodeId> path, Deque<Frame> stack) {
        visited.add(id);
        pathIndex.put(id, path.size());
        path.add(id);
        stack.push(new Frame(id, graph.edgesFrom(id)));
    }

    /**
     * A node on the search path and the position of the next outgoing edge to follow.
     */
    private static final class Frame {
        private final NodeId id;
        private final List<GraphEdge> edges;
        private int next;

        private Frame(NodeId id, List<GraphEdge> edges) {
            this.id = id;
            this.edges = edges;
        }
    }

    /**
     * Computes afferent and efferent coupling of a node.
     *
     * @param id node identifier
     * @return metrics, or empty if the node is not in the graph
     */
    public Optional<CouplingMetrics> coupling(NodeId id) {
        if (!graph.contains(id)) {
            return Optional.empty();
        }
        return Optional.of(CouplingMetrics.of(graph.edgesTo(id).size(), graph.edgesFrom(id).size()));
    }

    /**
     * Returns nodes without dependencies.
     *
     * @return nodes with no outgoing edge
     */
    public List<GraphNode> leafNodes() {
        return graph.allNodes().stream()
            .filter(node -> graph.edgesFrom(node.id()).isEmpty())
            .toList();
    }

    /**
     * Returns nodes nothing depends on.
     *
     * @return nodes with no incoming edge
     */
    public List<GraphNode> rootNodes() {
        return graph.allNodes().stream()
            .filter(node -> graph.edgesTo(node.id()).isEmpty())
            .toList();
    }

    /**
     * Infers architectural patterns from the roles present in the graph.
     *
     * <ul>
     *   <li>{@link PatternKind#REPOSITORY}: at least one repository</li>
     *   <li>{@link PatternKind#CQRS}: at least one directive or query</li>
     *   <li>{@link PatternKind#EVENT_SOURCING}: domain events together with at least one aggregate</li>
     * </ul>
     *
     * @return detected patterns in the order above
     */
    public List<ArchitecturalPattern> identifyPatterns() {
        List<ArchitecturalPattern> patterns = new ArrayList<>();

        List<NodeId> repositories = ids(graph.nodesByRole(Role.REPOSITORY));
        if (!repositories.isEmpty()) {
            patterns.add(new ArchitecturalPattern(PatternKind.REPOSITORY, repositories,
                repositories.size() + " repositories"));
        }

        List<NodeId> directives = ids(graph.nodesByRole(Role.DIRECTIVE));
        List<NodeId> queries = ids(graph.nodesByRole(Role.QUERY));
        if (!directives.isEmpty() || !queries.isEmpty()) {
            List<NodeId> members = new ArrayList<>(directives);
            members.addAll(queries);
            patterns.add(new ArchitecturalPattern(PatternKind.CQRS, members,
                directives.size() + " directives, " + queries.size() + " queries"));
        }

        int events = graph.nodesByRole(Role.DOMAIN_EVENT).size();
        List<NodeId> aggregates = ids(graph.nodesByRole(Role.AGGREGATE));
        if (events > 0 && !aggregates.isEmpty()) {
            patterns.add(new ArchitecturalPattern(PatternKind.EVENT_SOURCING, aggregates,
                events + " domain events, " + aggregates.size() + " aggregates"));
        }
        return patterns;
    }

    private static List<NodeId> ids(Collection<GraphNode> nodes) {
        return nodes.stream().map(GraphNode::id).toList();
    }
}
