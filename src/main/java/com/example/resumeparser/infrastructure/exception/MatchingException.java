package com.example.resumeparser.infrastructure.exception;

/**
 * Raised by job matching collaborators. The pipeline downgrades it to a warning.
 */
public class MatchingException extends InfrastructureException {

    public MatchingException(String message) {
        super(message);
    }

    public MatchingException(String message, Throwable cause) {
        super(message, cause);
    }
}
