package com.hexarchitect.core.graph;

import com.hexarchitect.core.model.Finding;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a graph build: the best graph constructible from well-formed entries plus
 * everything irregular observed on the way.
 *
 * @param graph the frozen graph
 * @param findings malformed entries, duplicates and dangling dependencies, in discovery order
 */
public record BuildResult(
    ArchitectureGraph graph,
    List<Finding> findings
) {
    /**
     * Compact constructor with validation.
     */
    public BuildResult {
        Objects.requireNonNull(graph, "graph must not be null");
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    /**
     * Returns the findings produced by one build step.
     *
     * @param ruleId e.g. {@link GraphBuilder#DANGLING_DEPENDENCY}
     * @return matching findings
     */
    public List<Finding> findings(String ruleId) {
        return findings.stream()
            .filter(f -> f.ruleId().equals(ruleId))
            .toList();
    }

    public List<Finding> danglingDependencies() {
        return findings(GraphBuilder.DANGLING_DEPENDENCY);
    }

    public List<Finding> malformedEntries() {
        return findings(GraphBuilder.MALFORMED_ENTRY);
    }

    public List<Finding> duplicates() {
        return findings(GraphBuilder.DUPLICATE_NODE_ID);
    }

    public boolean hasFindings() {
        return !findings.isEmpty();
    }
}
