package com.hexarchitect.core.validation;

import com.hexarchitect.core.graph.ArchitectureGraph;
import com.hexarchitect.core.graph.CouplingMetrics;
import com.hexarchitect.core.graph.GraphAnalysis;
import com.hexarchitect.core.model.Finding;
import com.hexarchitect.core.model.GraphNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Warns about nodes connected to more than a threshold of edges.
 */
public class GodComponentRule implements ValidationRule {

    public static final String ID = "god-component";
    public static final int DEFAULT_THRESHOLD = 10;

    private final int threshold;

    public GodComponentRule() {
        this(DEFAULT_THRESHOLD);
    }

    /**
     * Creates the rule with a custom threshold.
     *
     * @param threshold maximum number of incident edges a node may have
     * @throws IllegalArgumentException if the threshold is negative
     */
    public GodComponentRule(int threshold) {
        if (threshold < 0) {
            throw new IllegalArgumentException("threshold must not be negative: " + threshold);
        }
        this.threshold = threshold;
    }

    public int getThreshold() {
        return threshold;
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDescription() {
        return "Components connected to more than " + threshold + " others";
    }

    @Override
    public List<Finding> evaluate(ArchitectureGraph graph) {
        GraphAnalysis analysis = graph.analysis();
        List<Finding> findings = new ArrayList<>();
        for (GraphNode node : graph.allNodes()) {
            CouplingMetrics coupling = analysis.coupling(node.id()).orElseThrow();
            if (coupling.total() > threshold) {
                findings.add(Finding.warning(ID, List.of(node.id()), String.format(
                    "%s has %d connections (%d dependents, %d dependencies), above the limit of %d",
                    node.typeName(), coupling.total(), coupling.afferent(), coupling.efferent(), threshold)));
            }
        }
        return findings;
    }
}
