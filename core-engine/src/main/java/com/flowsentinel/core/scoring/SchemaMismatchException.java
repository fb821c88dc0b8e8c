package com.flowsentinel.core.scoring;

/**
 * Thrown when the feature columns a scorer was loaded with disagree with the
 * configured or extracted columns. Scoring with a mismatched column order
 * would silently produce wrong verdicts, so this is never recovered from.
 *
 * @since 1.0.0
 */
public class SchemaMismatchException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public SchemaMismatchException(String message) {
        super(message);
    }
}
