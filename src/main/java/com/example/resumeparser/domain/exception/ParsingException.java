package com.example.resumeparser.domain.exception;

/**
 * Raised when extracted text is empty or otherwise unusable for structural parsing.
 * The pipeline treats it as a critical failure of the parsing stage.
 */
public class ParsingException extends DomainException {

    public ParsingException(String message) {
        super(message);
    }
}
