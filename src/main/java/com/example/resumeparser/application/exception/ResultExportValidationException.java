package com.example.resumeparser.application.exception;

/**
 * Dedicated exception for export requests that have nothing to export.
 */
public class ResultExportValidationException extends UseCaseValidationException {

	/**
	 * Creates a new exception describing why the export request is invalid.
	 *
	 * @param message validation message suitable for display
	 */
    public ResultExportValidationException(String message) {
        super(message);
    }
}
