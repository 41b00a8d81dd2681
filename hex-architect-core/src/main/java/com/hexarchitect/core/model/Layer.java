package com.hexarchitect.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Architectural tiers of a hexagonal application.
 *
 * <p>Each layer carries an inward {@link #rank()}: the lower the rank, the closer the layer
 * sits to the core business logic. Dependencies must point toward equal or lower ranks.
 */
public enum Layer {
    /** Core business model: entities, value objects, aggregates */
    DOMAIN("Domain", 0),

    /** Interfaces the domain exposes or requires (repositories, use case boundaries) */
    PORT("Port", 1),

    /** Orchestration of use cases, directives and queries */
    APPLICATION("Application", 2),

    /** Implementations of ports against concrete technologies */
    ADAPTER("Adapter", 3),

    /** Wiring, configuration and runtime plumbing */
    INFRASTRUCTURE("Infrastructure", 4);

    private final String displayName;
    private final int rank;

    Layer(String displayName, int rank) {
        this.displayName = displayName;
        this.rank = rank;
    }

    /**
     * Returns the human-readable layer name (e.g., "Domain").
     *
     * @return display name
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Returns the inward rank of this layer, {@code 0} for Domain up to {@code 4} for
     * Infrastructure.
     *
     * @return inward rank
     */
    public int rank() {
        return rank;
    }

    /**
     * Parses a layer from text, ignoring case, surrounding whitespace, underscores and dashes.
     *
     * @param text layer name such as "domain", "Domain" or "INFRASTRUCTURE"
     * @return matching layer, or empty if the text names no layer
     */
    public static Optional<Layer> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String normalized = normalize(text);
        for (Layer layer : values()) {
            if (normalize(layer.name()).equals(normalized)) {
                return Optional.of(layer);
            }
        }
        return Optional.empty();
    }

    private static String normalize(String text) {
        return text.trim().replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return displayName;
    }
}
