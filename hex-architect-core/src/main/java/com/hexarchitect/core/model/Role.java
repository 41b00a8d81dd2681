package com.hexarchitect.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Structural category of a component within its layer.
 */
public enum Role {
    /** Domain object with identity */
    ENTITY("Entity"),

    /** Immutable domain value without identity */
    VALUE_OBJECT("ValueObject"),

    /** Persistence abstraction for aggregates or entities */
    REPOSITORY("Repository"),

    /** Concrete implementation of a port */
    ADAPTER("Adapter"),

    /** Command that changes state */
    DIRECTIVE("Directive"),

    /** Read-only request */
    QUERY("Query"),

    /** Application use case */
    USE_CASE("UseCase"),

    /** Stateless service */
    SERVICE("Service"),

    /** Consistency boundary grouping entities */
    AGGREGATE("Aggregate"),

    /** Fact recorded by an aggregate */
    DOMAIN_EVENT("DomainEvent"),

    /** Anything else */
    OTHER("Other");

    private final String displayName;

    Role(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Returns the human-readable role name (e.g., "ValueObject").
     *
     * @return display name
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Parses a role from text, ignoring case, surrounding whitespace, underscores and dashes,
     * so that "value_object", "ValueObject" and "value-object" all match {@link #VALUE_OBJECT}.
     *
     * @param text role name
     * @return matching role, or empty if the text names no role
     */
    public static Optional<Role> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String normalized = normalize(text);
        for (Role role : values()) {
            if (normalize(role.name()).equals(normalized)) {
                return Optional.of(role);
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
