package com.hexarchitect.core.registry;

/**
 * Thrown when a component manifest cannot be read or parsed.
 */
public class ManifestException extends RuntimeException {

    public ManifestException(String message, Throwable cause) {
        super(message, cause);
    }
}
