package com.hexarchitect.core.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.hexarchitect.core.model.ComponentEntry;
import com.hexarchitect.core.model.Layer;
import com.hexarchitect.core.model.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Reads component entries from a YAML or JSON manifest.
 *
 * <p>Files ending in {@code .json} are parsed as JSON, everything else as YAML. Layer and role
 * names are matched leniently (see {@link Layer#parse(String)}); names that match nothing are
 * left empty in the entry so the graph builder reports them as malformed.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * components:
 *   - type: User
 *     layer: domain
 *     role: entity
 *     module: app::domain
 *   - type: InMemoryUserRepository
 *     layer: adapter
 *     role: adapter
 *     dependsOn: [UserRepository]
 * }</pre>
 */
public final class ManifestLoader {

    private static final Logger log = LoggerFactory.getLogger(ManifestLoader.class);

    private static final ObjectMapper YAML_MAPPER = new YAMLMapper();
    private static final ObjectMapper JSON_MAPPER = new JsonMapper();

    private ManifestLoader() {
        // Utility class
    }

    /**
     * Loads entries from a manifest file.
     *
     * @param manifestPath YAML or JSON manifest
     * @return entries in file order
     * @throws ManifestException if the file is missing, unreadable or not a manifest
     */
    public static List<ComponentEntry> load(Path manifestPath) {
        Objects.requireNonNull(manifestPath, "manifestPath must not be null");
        if (!Files.isRegularFile(manifestPath)) {
            throw new ManifestException("Manifest not found: " + manifestPath, null);
        }

        ObjectMapper mapper = isJson(manifestPath) ? JSON_MAPPER : YAML_MAPPER;
        try (InputStream in = Files.newInputStream(manifestPath)) {
            List<ComponentEntry> entries = toEntries(mapper.readValue(in, Manifest.class));
            log.info("Loaded {} component entries from: {}", entries.size(), manifestPath);
            return entries;
        } catch (IOException e) {
            throw new ManifestException("Failed to read manifest: " + manifestPath, e);
        }
    }

    /**
     * Loads entries from YAML text.
     *
     * @param yaml manifest content
     * @return entries in document order
     * @throws ManifestException if the content is not a manifest
     */
    public static List<ComponentEntry> parseYaml(String yaml) {
        Objects.requireNonNull(yaml, "yaml must not be null");
        try {
            return toEntries(YAML_MAPPER.readValue(yaml, Manifest.class));
        } catch (IOException e) {
            throw new ManifestException("Failed to parse manifest content", e);
        }
    }

    private static boolean isJson(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json");
    }

    private static List<ComponentEntry> toEntries(Manifest manifest) {
        if (manifest == null || manifest.components() == null) {
            return List.of();
        }
        return manifest.components().stream()
            .map(ManifestLoader::toEntry)
            .toList();
    }

    private static ComponentEntry toEntry(ManifestComponent component) {
        if (component == null) {
            // bare list item; the builder reports it as malformed
            return new ComponentEntry(null, null, null, null, null);
        }
        return new ComponentEntry(
            component.type(),
            Layer.parse(component.layer()).orElse(null),
            Role.parse(component.role()).orElse(null),
            component.module(),
            component.dependsOn()
        );
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Manifest(
        @JsonProperty("components") List<ManifestComponent> components
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ManifestComponent(
        @JsonProperty("type") String type,
        @JsonProperty("layer") String layer,
        @JsonProperty("role") String role,
        @JsonProperty("module") String module,
        @JsonProperty("dependsOn") List<String> dependsOn
    ) {}
}
