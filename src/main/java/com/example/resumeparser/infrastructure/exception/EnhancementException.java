package com.example.resumeparser.infrastructure.exception;

/**
 * Raised by profile enhancement collaborators when analysis cannot be produced.
 * The pipeline downgrades it to a warning.
 */
public class EnhancementException extends InfrastructureException {

    public EnhancementException(String message) {
        super(message);
    }

    public EnhancementException(String message, Throwable cause) {
        super(message, cause);
    }
}
