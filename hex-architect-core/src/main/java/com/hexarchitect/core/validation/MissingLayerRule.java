package com.hexarchitect.core.validation;

import com.hexarchitect.core.graph.ArchitectureGraph;
import com.hexarchitect.core.model.Finding;
import com.hexarchitect.core.model.Layer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Warns about expected layers that contain no node at all.
 *
 * <p>Minimal programs may omit a layer on purpose, hence warnings rather than violations.
 */
public class MissingLayerRule implements ValidationRule {

    public static final String ID = "missing-layer";

    private final Set<Layer> expectedLayers;

    /**
     * Creates the rule expecting every layer.
     */
    public MissingLayerRule() {
        this(EnumSet.allOf(Layer.class));
    }

    /**
     * Creates the rule for a subset of layers.
     *
     * @param expectedLayers layers that should be populated
     */
    public MissingLayerRule(Collection<Layer> expectedLayers) {
        Objects.requireNonNull(expectedLayers, "expectedLayers must not be null");
        this.expectedLayers = expectedLayers.isEmpty()
            ? EnumSet.noneOf(Layer.class)
            : EnumSet.copyOf(expectedLayers);
    }

    public Set<Layer> getExpectedLayers() {
        return Set.copyOf(expectedLayers);
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDescription() {
        return "Expected layers that contain no component";
    }

    @Override
    public List<Finding> evaluate(ArchitectureGraph graph) {
        List<Finding> findings = new ArrayList<>();
        for (Layer layer : expectedLayers) {
            if (graph.nodesByLayer(layer).isEmpty()) {
                findings.add(Finding.warning(ID, List.of(),
                    "No component is registered in the " + layer + " layer"));
            }
        }
        return findings;
    }
}
