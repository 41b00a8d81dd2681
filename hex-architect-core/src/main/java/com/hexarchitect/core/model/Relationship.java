package com.hexarchitect.core.model;

/**
 * Types of relationships between graph nodes.
 */
public enum Relationship {
    /** Source component references the target component by name */
    DEPENDS_ON
}
