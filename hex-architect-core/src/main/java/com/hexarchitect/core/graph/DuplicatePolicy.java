package com.hexarchitect.core.graph;

/**
 * How {@link GraphBuilder} resolves two entries that map to the same node identifier.
 *
 * <p>Both policies report every duplicate as a {@code duplicate-node-id} finding.
 */
public enum DuplicatePolicy {
    /** Keep the first registered entry, discard later ones */
    FIRST_WINS,

    /** Abort the build with a {@link DuplicateNodeIdException} */
    FAIL
}
