package com.example.resumeparser.domain.exception;

/**
 * Raised when the client attempts to run an upload flow without providing a résumé file.
 */
public class DocumentRequiredException extends DomainException {

	/**
	 * Creates the exception with a user-friendly explanation.
	 */
    public DocumentRequiredException() {
        super("Please choose a résumé file to upload.");
    }
}
