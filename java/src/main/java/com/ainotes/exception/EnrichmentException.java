package com.ainotes.exception;

/**
 * Thrown when the external AI service could not produce tags or an embedding.
 * The message is a short human-readable cause such as {@code timeout}.
 */
public class EnrichmentException extends RuntimeException {

    public EnrichmentException(String message) {
        super(message);
    }

    public EnrichmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
