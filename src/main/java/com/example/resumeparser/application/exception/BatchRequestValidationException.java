package com.example.resumeparser.application.exception;

/**
 * Thrown when a batch processing request cannot be started, e.g. because it names no documents.
 */
public class BatchRequestValidationException extends UseCaseValidationException {

    public BatchRequestValidationException(String message) {
        super(message);
    }
}
