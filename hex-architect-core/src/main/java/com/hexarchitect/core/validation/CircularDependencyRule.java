package com.hexarchitect.core.validation;

import com.hexarchitect.core.graph.ArchitectureGraph;
import com.hexarchitect.core.model.Finding;
import com.hexarchitect.core.model.NodeId;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Flags dependency cycles, including self-dependencies.
 */
public class CircularDependencyRule implements ValidationRule {

    public static final String ID = "circular-dependency";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDescription() {
        return "Components that depend on themselves through a chain of dependencies";
    }

    @Override
    public List<Finding> evaluate(ArchitectureGraph graph) {
        return graph.analysis().detectCycles().stream()
            .map(cycle -> Finding.violation(ID, cycle, "Circular dependency: " + describe(cycle)))
            .toList();
    }

    private String describe(List<NodeId> cycle) {
        return cycle.stream().map(NodeId::value).collect(Collectors.joining(" -> "))
            + " -> " + cycle.get(0).value();
    }
}
