package com.hexarchitect.core.validation;

import com.hexarchitect.core.graph.ArchitectureGraph;
import com.hexarchitect.core.model.Finding;
import com.hexarchitect.core.model.GraphEdge;
import com.hexarchitect.core.model.GraphNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags every edge that points outward, from an inner layer to an outer one.
 *
 * <p>Layers are ordered by {@link com.hexarchitect.core.model.Layer#rank()}:
 * Domain &lt; Port &lt; Application &lt; Adapter &lt; Infrastructure. An edge is a violation
 * exactly when {@code rank(to) > rank(from)}; dependencies within a layer or toward the domain
 * are always allowed.
 */
public class DependencyDirectionRule implements ValidationRule {

    public static final String ID = "dependency-direction";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDescription() {
        return "Dependencies must point toward the domain, never outward";
    }

    @Override
    public List<Finding> evaluate(ArchitectureGraph graph) {
        List<Finding> findings = new ArrayList<>();
        for (GraphEdge edge : graph.allEdges()) {
            GraphNode from = graph.node(edge.from()).orElseThrow();
            GraphNode to = graph.node(edge.to()).orElseThrow();
            if (to.layer().rank() > from.layer().rank()) {
                findings.add(Finding.violation(ID, List.of(from.id(), to.id()), String.format(
                    "%s (%s) depends on %s (%s); the %s layer must not depend on the outer %s layer",
                    from.typeName(), from.layer(), to.typeName(), to.layer(), from.layer(), to.layer())));
            }
        }
        return findings;
    }
}
