package com.hexarchitect.core.export;

import com.hexarchitect.core.graph.ArchitectureGraph;
import com.hexarchitect.core.model.GraphEdge;
import com.hexarchitect.core.model.GraphNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Exports the graph in GraphViz DOT syntax.
 *
 * <p>Each node is quoted by its type name and filled with its layer colour; each edge carries
 * its relationship as label.
 */
public class DotExporter implements GraphExporter {

    private static final Logger log = LoggerFactory.getLogger(DotExporter.class);

    private final String rankDirection;

    public DotExporter() {
        this("TB");
    }

    /**
     * Creates an exporter with a layout direction.
     *
     * @param rankDirection GraphViz rankdir: TB, LR, BT or RL
     */
    public DotExporter(String rankDirection) {
        this.rankDirection = Objects.requireNonNull(rankDirection, "rankDirection must not be null");
    }

    @Override
    public String getId() {
        return "dot";
    }

    @Override
    public String getDisplayName() {
        return "DOT (GraphViz)";
    }

    @Override
    public String getFileExtension() {
        return "dot";
    }

    @Override
    public ExportedDocument export(ArchitectureGraph graph) {
        Objects.requireNonNull(graph, "graph must not be null");

        StringBuilder sb = new StringBuilder();
        sb.append("digraph hex_architecture {\n");
        sb.append("  rankdir=").append(rankDirection).append(";\n");
        sb.append("  node [shape=box, style=\"rounded,filled\"];\n\n");

        for (GraphNode node : graph.allNodes()) {
            sb.append("  ").append(quote(node.typeName()))
                .append(" [label=").append(quote(node.typeName() + "\n(" + node.role().displayName() + ")"))
                .append(", fillcolor=").append(LayerColors.colorFor(node.layer()))
                .append(", tooltip=").append(quote(node.layer().displayName()))
                .append("];\n");
        }

        sb.append('\n');
        for (GraphEdge edge : graph.allEdges()) {
            sb.append("  ").append(quote(edge.from().value()))
                .append(" -> ").append(quote(edge.to().value()))
                .append(" [label=\"DependsOn\"];\n");
        }
        sb.append("}\n");

        log.debug("Exported DOT graph with {} nodes and {} edges", graph.nodeCount(), graph.edgeCount());
        return new ExportedDocument("architecture-graph", sb.toString(), getFileExtension());
    }

    /**
     * Produces a DOT double-quoted string; line breaks become DOT's centered {@code \n} escape.
     */
    private String quote(String text) {
        return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + "\"";
    }
}
