package com.hexarchitect.core.export;

import com.hexarchitect.core.graph.ArchitectureGraph;

/**
 * Interface for exporters that turn an architecture graph into a textual document.
 *
 * <p>Exporters are pure functions of {@link ArchitectureGraph#allNodes()} and
 * {@link ArchitectureGraph#allEdges()}: they keep no state between calls and must represent
 * every node and every edge, so that counting them in the output gives the graph's own counts.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class PlainTextExporter implements GraphExporter {
 *     @Override
 *     public String getId() {
 *         return "text";
 *     }
 *
 *     @Override
 *     public String getDisplayName() {
 *         return "Plain Text Listing";
 *     }
 *
 *     @Override
 *     public String getFileExtension() {
 *         return "txt";
 *     }
 *
 *     @Override
 *     public ExportedDocument export(ArchitectureGraph graph) {
 *         StringBuilder sb = new StringBuilder();
 *         graph.allEdges().forEach(e -> sb.append(e.from()).append(" -> ").append(e.to()).append('\n'));
 *         return new ExportedDocument("dependencies", sb.toString(), getFileExtension());
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.hexarchitect.core.export.GraphExporter}
 *
 * @see ExporterRegistry
 * @see ExportedDocument
 */
public interface GraphExporter {

    /**
     * Returns unique identifier for this exporter.
     *
     * <p>Used for referencing the exporter in configuration and on the command line. Should be
     * lowercase (e.g., "mermaid", "dot", "json").
     *
     * @return unique exporter identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this exporter.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns file extension for exported documents, without leading dot.
     *
     * @return file extension
     */
    String getFileExtension();

    /**
     * Exports the graph.
     *
     * @param graph graph to export
     * @return exported document
     * @throws ExportException if the document cannot be produced
     */
    ExportedDocument export(ArchitectureGraph graph) throws ExportException;
}
