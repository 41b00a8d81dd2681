package com.hexarchitect.core;

import com.hexarchitect.core.graph.ArchitectureGraph;
import com.hexarchitect.core.model.Finding;
import com.hexarchitect.core.model.FindingSeverity;
import com.hexarchitect.core.validation.ValidationReport;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Result of one {@link ArchitectureEngine#rebuild()}: the frozen graph plus everything that was
 * reported while building and validating it.
 *
 * @param graph immutable architecture graph
 * @param buildFindings findings reported by the graph builder, after strict-mode escalation
 * @param validation findings reported by the validation rules
 */
public record EngineSnapshot(
    ArchitectureGraph graph,
    List<Finding> buildFindings,
    ValidationReport validation
) {
    public EngineSnapshot {
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(validation, "validation must not be null");
        buildFindings = buildFindings == null ? List.of() : List.copyOf(buildFindings);
    }

    /**
     * Returns build findings followed by validation findings.
     *
     * @return all findings
     */
    public List<Finding> allFindings() {
        List<Finding> all = new ArrayList<>(buildFindings);
        all.addAll(validation.findings());
        return List.copyOf(all);
    }

    /**
     * Checks whether any build or validation finding is a violation.
     *
     * @return true if the architecture breaks at least one rule
     */
    public boolean hasViolations() {
        return validation.hasViolations()
            || buildFindings.stream().anyMatch(f -> f.severity() == FindingSeverity.VIOLATION);
    }
}
