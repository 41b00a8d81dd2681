package com.hexarchitect.core.graph;

import java.time.Instant;
import java.util.Objects;

/**
 * Descriptive metadata attached to a built graph.
 *
 * @param description graph description
 * @param version metadata format version
 * @param createdAt build timestamp
 */
public record GraphMetadata(
    String description,
    int version,
    Instant createdAt
) {
    /** Description used when none is configured. */
    public static final String DEFAULT_DESCRIPTION = "Hexagonal Architecture Graph";

    /**
     * Compact constructor with validation.
     */
    public GraphMetadata {
        if (description == null || description.isBlank()) {
            description = DEFAULT_DESCRIPTION;
        }
        Objects.requireNonNull(createdAt, "createdAt must not be null");
    }

    /**
     * Creates version 1 metadata.
     *
     * @param description graph description
     * @param createdAt build timestamp
     * @return metadata
     */
    public static GraphMetadata of(String description, Instant createdAt) {
        return new GraphMetadata(description, 1, createdAt);
    }
}
