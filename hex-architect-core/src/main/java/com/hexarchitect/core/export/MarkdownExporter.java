package com.hexarchitect.core.export;

import com.hexarchitect.core.graph.ArchitectureGraph;
import com.hexarchitect.core.model.GraphEdge;
import com.hexarchitect.core.model.GraphNode;
import com.hexarchitect.core.model.Layer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;

/**
 * Exports the graph as a Markdown component catalog.
 *
 * <h2>Document Structure</h2>
 * <ul>
 *   <li><b>Summary:</b> component count per layer plus totals</li>
 *   <li><b>Components:</b> one table per populated layer (component, role, module)</li>
 *   <li><b>Dependencies:</b> one table row per edge</li>
 * </ul>
 */
public class MarkdownExporter implements GraphExporter {

    private static final Logger log = LoggerFactory.getLogger(MarkdownExporter.class);

    private static final String NEWLINE = "\n";
    private static final String NO_COMPONENTS = "_No components registered._\n";
    private static final String NO_DEPENDENCIES = "_No dependencies between registered components._\n";

    @Override
    public String getId() {
        return "markdown";
    }

    @Override
    public String getDisplayName() {
        return "Markdown Component Catalog";
    }

    @Override
    public String getFileExtension() {
        return "md";
    }

    @Override
    public ExportedDocument export(ArchitectureGraph graph) {
        Objects.requireNonNull(graph, "graph must not be null");

        StringBuilder sb = new StringBuilder();
        sb.append("# ").append(graph.metadata().description()).append(NEWLINE).append(NEWLINE);

        appendSummary(sb, graph);
        appendComponents(sb, graph);
        appendDependencies(sb, graph);

        log.debug("Exported Markdown catalog with {} nodes and {} edges", graph.nodeCount(), graph.edgeCount());
        return new ExportedDocument("architecture-catalog", sb.toString(), getFileExtension());
    }

    private void appendSummary(StringBuilder sb, ArchitectureGraph graph) {
        sb.append("## Summary").append(NEWLINE).append(NEWLINE);
        sb.append("| Layer | Components |").append(NEWLINE);
        sb.append("|-------|------------|").append(NEWLINE);
        for (Layer layer : Layer.values()) {
            sb.append("| ").append(layer.displayName()).append(" | ")
                .append(graph.nodesByLayer(layer).size()).append(" |").append(NEWLINE);
        }
        sb.append(NEWLINE);
        sb.append("- **Total components:** ").append(graph.nodeCount()).append(NEWLINE);
        sb.append("- **Total dependencies:** ").append(graph.edgeCount()).append(NEWLINE);
        sb.append(NEWLINE);
    }

    private void appendComponents(StringBuilder sb, ArchitectureGraph graph) {
        sb.append("## Components").append(NEWLINE).append(NEWLINE);
        if (graph.isEmpty()) {
            sb.append(NO_COMPONENTS).append(NEWLINE);
            return;
        }
        for (Layer layer : Layer.values()) {
            Set<GraphNode> nodes = graph.nodesByLayer(layer);
            if (nodes.isEmpty()) {
                continue;
            }
            sb.append("### ").append(layer.displayName()).append(NEWLINE).append(NEWLINE);
            sb.append("| Component | Role | Module |").append(NEWLINE);
            sb.append("|-----------|------|--------|").append(NEWLINE);
            for (GraphNode node : nodes) {
                sb.append("| `").append(escape(node.typeName())).append("` | ")
                    .append(node.role().displayName()).append(" | ")
                    .append(node.modulePath().isEmpty() ? "-" : escape(node.modulePath()))
                    .append(" |").append(NEWLINE);
            }
            sb.append(NEWLINE);
        }
    }

    private void appendDependencies(StringBuilder sb, ArchitectureGraph graph) {
        sb.append("## Dependencies").append(NEWLINE).append(NEWLINE);
        if (graph.allEdges().isEmpty()) {
            sb.append(NO_DEPENDENCIES);
            return;
        }
        sb.append("| From | To | Relation |").append(NEWLINE);
        sb.append("|------|----|----------|").append(NEWLINE);
        for (GraphEdge edge : graph.allEdges()) {
            sb.append("| `").append(escape(edge.from().value())).append("` | `")
                .append(escape(edge.to().value())).append("` | DependsOn |").append(NEWLINE);
        }
    }

    /**
     * Escapes table cell separators.
     */
    private String escape(String text) {
        return text.replace("|", "\\|");
    }
}
