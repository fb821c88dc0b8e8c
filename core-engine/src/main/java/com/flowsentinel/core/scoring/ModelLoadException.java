package com.flowsentinel.core.scoring;

/**
 * Thrown when a scoring model artifact cannot be read or is structurally
 * invalid. Fatal at startup.
 *
 * @since 1.0.0
 */
public class ModelLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ModelLoadException(String message) {
        super(message);
    }

    public ModelLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
