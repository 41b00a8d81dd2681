package com.hexarchitect.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ExportCommand}.
 */
class ExportCommandTest {

    @TempDir
    Path tempDir;

    private Path manifest;
    private String config;

    @BeforeEach
    void setUp() throws IOException {
        manifest = CommandTestSupport.writeManifest(tempDir, CommandTestSupport.USER_MODULE);
        config = tempDir.resolve("none.yaml").toString();
    }

    @Test
    void export_selectedFormats_writesOneFileEach() throws IOException {
        Path outputDir = tempDir.resolve("out");

        CommandTestSupport.Result result = CommandTestSupport.run("export", manifest.toString(),
            "-c", config, "-f", "dot", "-f", "json", "-o", outputDir.toString());

        assertThat(result.exitCode()).isZero();
        assertThat(outputDir.resolve("architecture-graph.dot")).exists();
        assertThat(outputDir.resolve("architecture-graph.json")).exists();
        assertThat(Files.readString(outputDir.resolve("architecture-graph.dot")))
            .contains("\"InMemoryUserRepository\" -> \"UserRepository\"");
    }

    @Test
    void export_formatsFromConfig_areUsedByDefault() throws IOException {
        Path outputDir = tempDir.resolve("docs");
        Path configFile = Files.writeString(tempDir.resolve("hexarchitect.yaml"), """
            export:
              directory: "%s"
              formats: [mermaid, markdown]
            """.formatted(outputDir.toString().replace("\\", "/")));

        CommandTestSupport.Result result = CommandTestSupport.run("export", manifest.toString(),
            "-c", configFile.toString());

        assertThat(result.exitCode()).isZero();
        assertThat(outputDir.resolve("architecture-graph.mmd")).exists();
        assertThat(outputDir.resolve("architecture-catalog.md")).exists();
    }

    @Test
    void export_unknownFormat_exitsOneWithoutWriting() {
        Path outputDir = tempDir.resolve("out");

        CommandTestSupport.Result result = CommandTestSupport.run("export", manifest.toString(),
            "-c", config, "-f", "svg", "-o", outputDir.toString());

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(outputDir).doesNotExist();
    }
}
