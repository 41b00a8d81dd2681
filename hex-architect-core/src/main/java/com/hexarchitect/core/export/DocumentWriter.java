package com.hexarchitect.core.export;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes exported documents to the filesystem.
 *
 * <p>Creates the output directory if needed and overwrites existing files.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * ExportedDocument document = new MermaidExporter().export(graph);
 * Path written = new DocumentWriter(Paths.get("./docs/architecture")).write(document);
 * // Creates: ./docs/architecture/architecture-graph.mmd
 * }</pre>
 */
public class DocumentWriter {

    private static final Logger logger = LoggerFactory.getLogger(DocumentWriter.class);

    private final Path outputDirectory;

    public DocumentWriter(Path outputDirectory) {
        this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }

    /**
     * Writes a document as {@code <name>.<extension>} in the output directory.
     *
     * @param document document to write
     * @return path of the written file
     * @throws ExportException if the directory or file cannot be written
     */
    public Path write(ExportedDocument document) throws ExportException {
        Objects.requireNonNull(document, "document must not be null");
        Path target = outputDirectory.resolve(document.fileName());
        try {
            Files.createDirectories(outputDirectory);
            byte[] bytes = document.content().getBytes(StandardCharsets.UTF_8);
            Files.write(target, bytes);
            logger.info("Wrote file: {} ({} bytes)", target, bytes.length);
            return target;
        } catch (IOException e) {
            throw new ExportException("Failed to write file: " + target, e);
        }
    }
}
