package com.hexarchitect.core.model;

import java.util.Objects;

/**
 * Directed relationship between two nodes of the same graph.
 *
 * @param from source node (the dependent)
 * @param to target node (the dependency)
 * @param relation relationship type
 */
public record GraphEdge(
    NodeId from,
    NodeId to,
    Relationship relation
) {
    /**
     * Compact constructor with validation.
     */
    public GraphEdge {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        Objects.requireNonNull(relation, "relation must not be null");
    }

    /**
     * Creates a {@link Relationship#DEPENDS_ON} edge.
     *
     * @param from dependent node
     * @param to dependency node
     * @return a new edge
     */
    public static GraphEdge dependsOn(NodeId from, NodeId to) {
        return new GraphEdge(from, to, Relationship.DEPENDS_ON);
    }
}
