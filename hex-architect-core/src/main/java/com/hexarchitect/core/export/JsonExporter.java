package com.hexarchitect.core.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.hexarchitect.core.graph.ArchitectureGraph;
import com.hexarchitect.core.model.GraphEdge;
import com.hexarchitect.core.model.GraphNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Exports the graph as a JSON document with {@code nodes} and {@code edges} arrays.
 *
 * <p><b>Output shape:</b>
 * <pre>{@code
 * {
 *   "description" : "Hexagonal Architecture Graph",
 *   "nodes" : [ { "id" : "User", "key" : "b512...", "layer" : "Domain", "role" : "Entity", "module" : "app::domain" } ],
 *   "edges" : [ { "source" : "InMemoryUserRepository", "target" : "UserRepository", "relation" : "DEPENDS_ON" } ]
 * }
 * }</pre>
 */
public class JsonExporter implements GraphExporter {

    private static final Logger log = LoggerFactory.getLogger(JsonExporter.class);

    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .build();

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public String getDisplayName() {
        return "JSON Graph Document";
    }

    @Override
    public String getFileExtension() {
        return "json";
    }

    @Override
    public ExportedDocument export(ArchitectureGraph graph) throws ExportException {
        Objects.requireNonNull(graph, "graph must not be null");

        GraphDocument document = new GraphDocument(
            graph.metadata().description(),
            graph.allNodes().stream().map(JsonExporter::toJson).toList(),
            graph.allEdges().stream().map(JsonExporter::toJson).toList()
        );

        try {
            String content = MAPPER.writeValueAsString(document);
            log.debug("Exported JSON document with {} nodes and {} edges", graph.nodeCount(), graph.edgeCount());
            return new ExportedDocument("architecture-graph", content, getFileExtension());
        } catch (JsonProcessingException e) {
            throw new ExportException("JSON serialization failed: " + e.getOriginalMessage(), e);
        }
    }

    private static JsonNodeEntry toJson(GraphNode node) {
        return new JsonNodeEntry(node.typeName(), node.id().key(), node.layer().displayName(),
            node.role().displayName(), node.modulePath());
    }

    private static JsonEdgeEntry toJson(GraphEdge edge) {
        return new JsonEdgeEntry(edge.from().value(), edge.to().value(), edge.relation().name());
    }

    record GraphDocument(String description, List<JsonNodeEntry> nodes, List<JsonEdgeEntry> edges) {}

    record JsonNodeEntry(String id, String key, String layer, String role, String module) {}

    record JsonEdgeEntry(String source, String target, String relation) {}
}
