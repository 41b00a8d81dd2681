package com.hexarchitect.core.export;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Lookup of {@link GraphExporter}s by id.
 *
 * <p>{@link #discover()} loads every exporter registered via SPI; the built-in Mermaid, DOT,
 * JSON and Markdown exporters are registered by this library.
 */
public class ExporterRegistry {

    private static final Logger log = LoggerFactory.getLogger(ExporterRegistry.class);

    private final Map<String, GraphExporter> exporters = new LinkedHashMap<>();

    /**
     * Creates a registry over the given exporters; on id clashes the first one wins.
     *
     * @param exporters exporters to index
     */
    public ExporterRegistry(List<? extends GraphExporter> exporters) {
        for (GraphExporter exporter : exporters) {
            if (this.exporters.putIfAbsent(exporter.getId(), exporter) != null) {
                log.warn("Ignoring exporter {} ({}): id already registered",
                    exporter.getId(), exporter.getClass().getName());
            }
        }
    }

    /**
     * Discovers all exporters via {@link ServiceLoader}.
     *
     * @return registry of discovered exporters
     */
    public static ExporterRegistry discover() {
        List<GraphExporter> discovered = new ArrayList<>();
        ServiceLoader.load(GraphExporter.class).forEach(discovered::add);
        log.debug("Discovered {} graph exporters", discovered.size());
        return new ExporterRegistry(discovered);
    }

    public Optional<GraphExporter> find(String id) {
        return Optional.ofNullable(exporters.get(id));
    }

    public List<GraphExporter> getExporters() {
        return List.copyOf(exporters.values());
    }

    public Set<String> ids() {
        return Set.copyOf(exporters.keySet());
    }
}
