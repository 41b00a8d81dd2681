package com.hexarchitect.core.graph;

import com.hexarchitect.core.model.NodeId;

import java.util.List;
import java.util.Objects;

/**
 * A pattern inferred from component roles.
 *
 * @param kind pattern kind
 * @param nodes components that make up the pattern
 * @param summary human-readable counts
 */
public record ArchitecturalPattern(
    PatternKind kind,
    List<NodeId> nodes,
    String summary
) {
    public ArchitecturalPattern {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(summary, "summary must not be null");
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
    }

    @Override
    public String toString() {
        return kind + " (" + summary + ")";
    }
}
