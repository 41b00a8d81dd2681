package com.hexarchitect.core.export;

import java.util.Objects;

/**
 * Represents an exported document.
 *
 * @param name document name, used as the file base name
 * @param content document content (Mermaid, DOT, JSON, Markdown)
 * @param fileExtension file extension for this content, without leading dot
 */
public record ExportedDocument(
    String name,
    String content,
    String fileExtension
) {
    /**
     * Compact constructor with validation.
     */
    public ExportedDocument {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(fileExtension, "fileExtension must not be null");
    }

    public String fileName() {
        return name + "." + fileExtension;
    }
}
