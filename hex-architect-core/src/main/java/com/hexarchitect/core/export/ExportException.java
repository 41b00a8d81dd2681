package com.hexarchitect.core.export;

/**
 * Thrown when a graph cannot be exported or an exported document cannot be written.
 */
public class ExportException extends Exception {

    public ExportException(String message) {
        super(message);
    }

    public ExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
