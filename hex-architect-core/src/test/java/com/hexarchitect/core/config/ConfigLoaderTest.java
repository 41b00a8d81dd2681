package com.hexarchitect.core.config;

import com.hexarchitect.core.graph.DuplicatePolicy;
import com.hexarchitect.core.graph.GraphMetadata;
import com.hexarchitect.core.model.Layer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("hexarchitect.yaml");
        Files.writeString(configFile, """
            graph:
              description: "Order service"
              duplicatePolicy: fail

            validation:
              strict: true
              rules:
                - dependency-direction
                - missing-layer
              expectedLayers: [DOMAIN, port, Adapter]
              godComponentThreshold: 12

            export:
              directory: "./build/architecture"
              formats:
                - dot
            """);

        EngineConfig config = ConfigLoader.load(configFile);

        assertThat(config.graph().description()).isEqualTo("Order service");
        assertThat(config.graph().duplicatePolicy()).isEqualTo(DuplicatePolicy.FAIL);
        assertThat(config.validation().isStrict()).isTrue();
        assertThat(config.validation().rules()).containsExactly("dependency-direction", "missing-layer");
        assertThat(config.validation().expectedLayers()).containsExactly(Layer.DOMAIN, Layer.PORT, Layer.ADAPTER);
        assertThat(config.validation().godComponentThreshold()).isEqualTo(12);
        assertThat(config.export().directory()).isEqualTo("./build/architecture");
        assertThat(config.export().formats()).containsExactly("dot");
    }

    @Test
    void load_partialYaml_fillsMissingSectionsWithDefaults() throws IOException {
        Path configFile = tempDir.resolve("hexarchitect.yaml");
        Files.writeString(configFile, """
            validation:
              strict: true
            unknownSection:
              ignored: yes
            """);

        EngineConfig config = ConfigLoader.load(configFile);

        assertThat(config.validation().isStrict()).isTrue();
        assertThat(config.validation().isEnabled("orphan-node")).isTrue();
        assertThat(config.graph().description()).isEqualTo(GraphMetadata.DEFAULT_DESCRIPTION);
        assertThat(config.graph().duplicatePolicy()).isEqualTo(DuplicatePolicy.FIRST_WINS);
        assertThat(config.export().formats()).containsExactly("mermaid", "markdown");
    }

    @Test
    void load_nonExistentFile_returnsDefaults() {
        EngineConfig config = ConfigLoader.load(tempDir.resolve("missing.yaml"));

        assertThat(config).isEqualTo(EngineConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("hexarchitect.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(EngineConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("hexarchitect.yaml");
        Files.writeString(configFile, "validation: [unclosed");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(EngineConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(EngineConfig.defaults());
    }
}
