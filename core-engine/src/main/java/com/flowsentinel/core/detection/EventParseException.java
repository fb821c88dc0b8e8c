package com.flowsentinel.core.detection;

/**
 * Raised for a line that is not a well-formed JSON object. The line is
 * skipped; processing continues with the next one.
 *
 * @since 1.0.0
 */
public class EventParseException extends Exception {

    private static final long serialVersionUID = 1L;

    public EventParseException(String message) {
        super(message);
    }

    public EventParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
