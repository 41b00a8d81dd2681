package com.hexarchitect.core.graph;

/**
 * Coupling of a single node.
 *
 * @param afferent number of incoming edges (dependents)
 * @param efferent number of outgoing edges (dependencies)
 * @param instability {@code efferent / (afferent + efferent)}, or 0 for an isolated node
 */
public record CouplingMetrics(
    int afferent,
    int efferent,
    double instability
) {
    /**
     * Computes metrics from edge counts.
     *
     * @param afferent incoming edge count
     * @param efferent outgoing edge count
     * @return coupling metrics
     */
    public static CouplingMetrics of(int afferent, int efferent) {
        int total = afferent + efferent;
        double instability = total == 0 ? 0.0 : (double) efferent / total;
        return new CouplingMetrics(afferent, efferent, instability);
    }

    public int total() {
        return afferent + efferent;
    }
}
