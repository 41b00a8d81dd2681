package com.hexarchitect.core.validation;

import com.hexarchitect.core.graph.ArchitectureGraph;
import com.hexarchitect.core.model.Finding;

import java.util.List;

/**
 * Reports nodes with neither dependencies nor dependents.
 *
 * <p>Standalone value objects are legitimate, so findings are informational only.
 */
public class OrphanNodeRule implements ValidationRule {

    public static final String ID = "orphan-node";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDescription() {
        return "Components without any incoming or outgoing dependency";
    }

    @Override
    public List<Finding> evaluate(ArchitectureGraph graph) {
        return graph.allNodes().stream()
            .filter(node -> graph.edgesFrom(node.id()).isEmpty() && graph.edgesTo(node.id()).isEmpty())
            .map(node -> Finding.info(ID, List.of(node.id()),
                node.typeName() + " (" + node.layer() + ") has no dependencies and no dependents"))
            .toList();
    }
}
