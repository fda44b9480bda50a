package com.example.resumeparser.infrastructure.exception;

/**
 * Signals that no text could be extracted from a document: the file is unreadable, or every
 * extraction engine failed or was unavailable.
 */
public class ExtractionException extends InfrastructureException {

    public ExtractionException(String message) {
        super(message);
    }

	/**
	 * Creates the exception with a contextual message and the root cause from the PDF library.
	 *
	 * @param message description shared with the application layer
	 * @param cause   low-level library exception
	 */
    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
