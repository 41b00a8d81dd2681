package com.hexarchitect.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hexarchitect.core.graph.DuplicatePolicy;
import com.hexarchitect.core.graph.GraphMetadata;
import com.hexarchitect.core.model.Layer;

import java.util.Arrays;
import java.util.List;

/**
 * Root configuration of the architecture engine.
 *
 * <p>Loaded from {@code hexarchitect.yaml}. Every section is optional; missing sections and
 * fields fall back to {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * graph:
 *   description: "Order service"
 *   duplicatePolicy: FIRST_WINS
 *
 * validation:
 *   strict: true
 *   rules:
 *     - dependency-direction
 *     - missing-layer
 *   expectedLayers: [DOMAIN, PORT, ADAPTER]
 *   godComponentThreshold: 12
 *
 * export:
 *   directory: "./docs/architecture"
 *   formats:
 *     - mermaid
 *     - markdown
 * }</pre>
 *
 * @param graph graph construction settings
 * @param validation validation settings
 * @param export export settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EngineConfig(
    @JsonProperty("graph") GraphSettings graph,
    @JsonProperty("validation") ValidationSettings validation,
    @JsonProperty("export") ExportSettings export
) {
    /**
     * Compact constructor replacing missing sections with defaults.
     */
    public EngineConfig {
        if (graph == null) {
            graph = new GraphSettings(null, null);
        }
        if (validation == null) {
            validation = new ValidationSettings(null, null, null, null);
        }
        if (export == null) {
            export = new ExportSettings(null, null);
        }
    }

    /**
     * Creates the default configuration: first registration wins, all rules enabled,
     * all layers expected, non-strict validation.
     *
     * @return default configuration
     */
    public static EngineConfig defaults() {
        return new EngineConfig(null, null, null);
    }

    /**
     * Graph construction settings.
     *
     * @param description description stored in the graph metadata
     * @param duplicatePolicy duplicate node resolution policy
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GraphSettings(
        @JsonProperty("description") String description,
        @JsonProperty("duplicatePolicy") DuplicatePolicy duplicatePolicy
    ) {
        public GraphSettings {
            if (description == null || description.isBlank()) {
                description = GraphMetadata.DEFAULT_DESCRIPTION;
            }
            if (duplicatePolicy == null) {
                duplicatePolicy = DuplicatePolicy.FIRST_WINS;
            }
        }
    }

    /**
     * Validation settings.
     *
     * @param strict whether dangling dependencies are escalated to violations
     * @param rules enabled rule ids (empty = all known rules)
     * @param expectedLayers layers checked by the missing-layer rule (empty = all layers)
     * @param godComponentThreshold connection limit of the god-component rule
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ValidationSettings(
        @JsonProperty("strict") Boolean strict,
        @JsonProperty("rules") List<String> rules,
        @JsonProperty("expectedLayers") List<Layer> expectedLayers,
        @JsonProperty("godComponentThreshold") Integer godComponentThreshold
    ) {
        public static final int DEFAULT_GOD_COMPONENT_THRESHOLD = 10;

        public ValidationSettings {
            if (strict == null) {
                strict = Boolean.FALSE;
            }
            rules = rules == null ? List.of() : List.copyOf(rules);
            expectedLayers = expectedLayers == null || expectedLayers.isEmpty()
                ? Arrays.asList(Layer.values())
                : List.copyOf(expectedLayers);
            if (godComponentThreshold == null || godComponentThreshold < 0) {
                godComponentThreshold = DEFAULT_GOD_COMPONENT_THRESHOLD;
            }
        }

        public boolean isStrict() {
            return strict;
        }

        /**
         * Checks if a rule is enabled; every rule is enabled when no list is configured.
         *
         * @param ruleId rule identifier
         * @return true if the rule should run
         */
        public boolean isEnabled(String ruleId) {
            return rules.isEmpty() || rules.contains(ruleId);
        }
    }

    /**
     * Export settings.
     *
     * @param directory output directory for exported documents
     * @param formats exporter ids to run
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ExportSettings(
        @JsonProperty("directory") String directory,
        @JsonProperty("formats") List<String> formats
    ) {
        public static final String DEFAULT_DIRECTORY = "./docs/architecture";

        public ExportSettings {
            if (directory == null || directory.isBlank()) {
                directory = DEFAULT_DIRECTORY;
            }
            formats = formats == null || formats.isEmpty()
                ? List.of("mermaid", "markdown")
                : List.copyOf(formats);
        }
    }
}
