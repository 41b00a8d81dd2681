package com.hexarchitect.core.graph;

/**
 * Architectural patterns recognized by {@link GraphAnalysis#identifyPatterns()}.
 */
public enum PatternKind {
    REPOSITORY("Repository"),
    CQRS("CQRS"),
    EVENT_SOURCING("Event Sourcing");

    private final String displayName;

    PatternKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
