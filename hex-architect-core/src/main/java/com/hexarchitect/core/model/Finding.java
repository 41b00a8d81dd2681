package com.hexarchitect.core.model;

import java.util.List;
import java.util.Objects;

/**
 * An advisory record emitted while building or validating a graph.
 *
 * <p>Findings describe structural observations, input irregularities and rule violations.
 * They are returned to the caller as data and never stored in the graph they describe.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * Finding finding = Finding.violation(
 *     "dependency-direction",
 *     List.of(NodeId.of("Order"), NodeId.of("OrderMapper")),
 *     "Order (Domain) depends on OrderMapper (Adapter)"
 * );
 * }</pre>
 *
 * @param ruleId identifier of the rule or build step that produced the finding
 * @param severity severity level
 * @param nodes affected nodes, possibly empty
 * @param explanation human-readable description
 */
public record Finding(
    String ruleId,
    FindingSeverity severity,
    List<NodeId> nodes,
    String explanation
) {
    /**
     * Compact constructor with validation.
     */
    public Finding {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(explanation, "explanation must not be null");
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
    }

    /**
     * Create an informational finding.
     *
     * @param ruleId the rule ID
     * @param nodes affected nodes
     * @param explanation the explanation
     * @return a new Finding with INFO severity
     */
    public static Finding info(String ruleId, List<NodeId> nodes, String explanation) {
        return new Finding(ruleId, FindingSeverity.INFO, nodes, explanation);
    }

    /**
     * Create a warning finding.
     *
     * @param ruleId the rule ID
     * @param nodes affected nodes
     * @param explanation the explanation
     * @return a new Finding with WARNING severity
     */
    public static Finding warning(String ruleId, List<NodeId> nodes, String explanation) {
        return new Finding(ruleId, FindingSeverity.WARNING, nodes, explanation);
    }

    /**
     * Create a violation finding.
     *
     * @param ruleId the rule ID
     * @param nodes affected nodes
     * @param explanation the explanation
     * @return a new Finding with VIOLATION severity
     */
    public static Finding violation(String ruleId, List<NodeId> nodes, String explanation) {
        return new Finding(ruleId, FindingSeverity.VIOLATION, nodes, explanation);
    }

    /**
     * Returns a copy of this finding with a different severity.
     *
     * @param newSeverity severity of the copy
     * @return re-graded finding
     */
    public Finding withSeverity(FindingSeverity newSeverity) {
        return new Finding(ruleId, newSeverity, nodes, explanation);
    }

    /**
     * Checks whether the finding names the given node.
     *
     * @param id node identifier
     * @return true if the node is affected
     */
    public boolean affects(NodeId id) {
        return nodes.contains(id);
    }

    @Override
    public String toString() {
        return "[" + severity + "] " + ruleId + ": " + explanation;
    }
}
