package com.hexarchitect.core.validation;

import com.hexarchitect.core.graph.ArchitectureGraph;
import com.hexarchitect.core.model.Finding;
import com.hexarchitect.core.model.GraphEdge;
import com.hexarchitect.core.model.GraphNode;
import com.hexarchitect.core.model.Layer;

import java.util.ArrayList;
import java.util.List;

/**
 * Warns about ports that no adapter depends on.
 *
 * <p>A port counts as implemented once at least one node in the Adapter layer has an edge to it.
 */
public class UnimplementedPortRule implements ValidationRule {

    public static final String ID = "unimplemented-port";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDescription() {
        return "Ports without an implementing adapter";
    }

    @Override
    public List<Finding> evaluate(ArchitectureGraph graph) {
        List<Finding> findings = new ArrayList<>();
        for (GraphNode port : graph.nodesByLayer(Layer.PORT)) {
            if (!hasAdapter(graph, port)) {
                findings.add(Finding.warning(ID, List.of(port.id()),
                    port.id() + " (Port) has no implementing adapter"));
            }
        }
        return findings;
    }

    private static boolean hasAdapter(ArchitectureGraph graph, GraphNode port) {
        for (GraphEdge edge : graph.edgesTo(port.id())) {
            boolean fromAdapter = graph.node(edge.from())
                .map(source -> source.layer() == Layer.ADAPTER)
                .orElse(false);
            if (fromAdapter) {
                return true;
            }
        }
        return false;
    }
}
