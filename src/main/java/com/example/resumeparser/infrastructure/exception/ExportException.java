package com.example.resumeparser.infrastructure.exception;

/**
 * Signals that a pipeline result could not be serialized or written to disk.
 */
public class ExportException extends InfrastructureException {

    public ExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
