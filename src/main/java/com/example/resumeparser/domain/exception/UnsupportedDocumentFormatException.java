package com.example.resumeparser.domain.exception;

/**
 * Raised when the uploaded file does not resemble a PDF résumé.
 * This protects the extraction engines from receiving unsupported formats.
 */
public class UnsupportedDocumentFormatException extends DomainException {

	/**
	 * Creates the exception and mentions the offending file so the user can react.
	 *
	 * @param fileName original file name supplied by the client
	 */
    public UnsupportedDocumentFormatException(String fileName) {
        super("Only PDF résumés are supported" + (fileName != null ? ": " + fileName : "."));
    }
}
