package com.hexarchitect.core.model;

/**
 * Severity level of a {@link Finding}.
 *
 * @since 1.0.0
 */
public enum FindingSeverity {
    /**
     * Informational - a structural observation, no action required.
     */
    INFO,

    /**
     * Warning - an irregularity that should be reviewed.
     */
    WARNING,

    /**
     * Violation - an architectural rule is broken.
     */
    VIOLATION
}
