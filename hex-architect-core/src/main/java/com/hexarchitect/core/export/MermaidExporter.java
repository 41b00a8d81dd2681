package com.hexarchitect.core.export;

import com.hexarchitect.core.graph.ArchitectureGraph;
import com.hexarchitect.core.model.GraphEdge;
import com.hexarchitect.core.model.GraphNode;
import com.hexarchitect.core.model.Layer;
import com.hexarchitect.core.model.NodeId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Exports the graph as a Mermaid flowchart.
 *
 * <p>Nodes are grouped into one subgraph per populated layer and styled with a class per
 * layer. Node identifiers are {@code n} followed by the node's {@link NodeId#key()}, so type
 * names containing {@code ::}, dots or generics never break the syntax.
 *
 * <pre>
 * graph TD
 *   subgraph Domain
 *     n1a2b...["User&lt;br/&gt;(Entity)"]:::domain
 *   end
 *   n3c4d... --&gt;|DependsOn| n1a2b...
 * </pre>
 *
 * @see <a href="https://mermaid.js.org/">Mermaid Documentation</a>
 */
public class MermaidExporter implements GraphExporter {

    private static final Logger log = LoggerFactory.getLogger(MermaidExporter.class);

    private static final String EXPORTER_ID = "mermaid";
    private static final String DISPLAY_NAME = "Mermaid Flowchart";
    private static final String FILE_EXTENSION = "mmd";
    private static final String DOCUMENT_NAME = "architecture-graph";

    private static final String INDENT = "  ";
    private static final String RELATION_LABEL = "DependsOn";

    private final String direction;

    /**
     * Creates a top-down exporter.
     */
    public MermaidExporter() {
        this("TD");
    }

    /**
     * Creates an exporter with a layout direction.
     *
     * @param direction Mermaid direction: TD, TB, BT, LR or RL
     */
    public MermaidExporter(String direction) {
        this.direction = Objects.requireNonNull(direction, "direction must not be null");
    }

    @Override
    public String getId() {
        return EXPORTER_ID;
    }

    @Override
    public String getDisplayName() {
        return DISPLAY_NAME;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public ExportedDocument export(ArchitectureGraph graph) {
        Objects.requireNonNull(graph, "graph must not be null");

        StringBuilder sb = new StringBuilder();
        sb.append("graph ").append(direction).append('\n');

        for (Layer layer : Layer.values()) {
            appendLayer(sb, layer, graph.nodesByLayer(layer));
        }

        if (!graph.allEdges().isEmpty()) {
            sb.append('\n');
        }
        for (GraphEdge edge : graph.allEdges()) {
            sb.append(INDENT).append(nodeRef(edge.from()))
                .append(" -->|").append(RELATION_LABEL).append("| ")
                .append(nodeRef(edge.to())).append('\n');
        }

        appendClassDefinitions(sb);

        log.debug("Exported Mermaid flowchart with {} nodes and {} edges", graph.nodeCount(), graph.edgeCount());
        return new ExportedDocument(DOCUMENT_NAME, sb.toString(), FILE_EXTENSION);
    }

    private void appendLayer(StringBuilder sb, Layer layer, Set<GraphNode> nodes) {
        if (nodes.isEmpty()) {
            return;
        }
        sb.append(INDENT).append("subgraph ").append(layer.displayName()).append('\n');
        for (GraphNode node : nodes) {
            sb.append(INDENT).append(INDENT).append(nodeRef(node.id()))
                .append("[\"").append(escape(node.typeName()))
                .append("<br/>(").append(node.role().displayName()).append(")\"]:::")
                .append(styleClass(layer)).append('\n');
        }
        sb.append(INDENT).append("end\n");
    }

    private void appendClassDefinitions(StringBuilder sb) {
        sb.append('\n');
        for (Layer layer : Layer.values()) {
            sb.append(INDENT).append("classDef ").append(styleClass(layer))
                .append(" fill:").append(LayerColors.colorFor(layer)).append('\n');
        }
    }

    private String nodeRef(NodeId id) {
        return "n" + id.key();
    }

    private String styleClass(Layer layer) {
        return layer.name().toLowerCase(Locale.ROOT);
    }

    /**
     * Escapes characters with special meaning inside a quoted Mermaid label.
     */
    private String escape(String text) {
        return text.replace("\"", "#quot;").replace("<", "#lt;").replace(">", "#gt;");
    }
}
