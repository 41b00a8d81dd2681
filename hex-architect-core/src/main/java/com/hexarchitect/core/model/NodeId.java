package com.hexarchitect.core.model;

import com.hexarchitect.core.util.IdGenerator;

import java.util.Objects;

/**
 * Stable identifier of a graph node, derived deterministically from a component's type name.
 *
 * <p>Surrounding whitespace is not significant: {@code NodeId.of("User")} and
 * {@code NodeId.of(" User ")} denote the same node.
 *
 * @param value normalized type name
 */
public record NodeId(String value) implements Comparable<NodeId> {

    /**
     * Compact constructor with validation.
     */
    public NodeId {
        Objects.requireNonNull(value, "value must not be null");
        value = value.strip();
        if (value.isEmpty()) {
            throw new IllegalArgumentException("value must not be blank");
        }
    }

    /**
     * Derives the node identifier for a type name.
     *
     * @param typeName fully-qualified or simple type name
     * @return node identifier
     * @throws IllegalArgumentException if the type name is blank
     */
    public static NodeId of(String typeName) {
        return new NodeId(typeName);
    }

    /**
     * Returns a short hash of the identifier, safe to use as an identifier in diagram syntaxes.
     *
     * @return 16 lowercase hexadecimal characters
     */
    public String key() {
        return IdGenerator.generateFromString(value);
    }

    @Override
    public int compareTo(NodeId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
