package com.hexarchitect.core.model;

import java.util.Objects;

/**
 * A component as it appears in a built graph.
 *
 * @param id node identifier
 * @param layer architectural layer
 * @param role structural role
 * @param modulePath informational module path
 */
public record GraphNode(
    NodeId id,
    Layer layer,
    Role role,
    String modulePath
) {
    /**
     * Compact constructor with validation.
     */
    public GraphNode {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(layer, "layer must not be null");
        Objects.requireNonNull(role, "role must not be null");
        if (modulePath == null) {
            modulePath = "";
        }
    }

    /**
     * Returns the component type name this node was built from.
     *
     * @return type name
     */
    public String typeName() {
        return id.value();
    }
}
