package com.example.resumeparser.domain.model;

import java.time.Duration;
import java.util.List;

/**
 * Text produced by one extraction attempt, scored for reliability.
 */
public record ExtractionResult(
        String text,
        ExtractionMethod method,
        double confidence,
        int pageCount,
        int processedPages,
        List<String> errors,
        Duration elapsedTime,
        DocumentMetadata metadata
) {

    public ExtractionResult {
        text = text == null ? "" : text;
        errors = errors == null ? List.of() : List.copyOf(errors);
        elapsedTime = elapsedTime == null ? Duration.ZERO : elapsedTime;
        confidence = Math.min(Math.max(confidence, 0.0), 1.0);
    }

    /**
     * @return length of the text ignoring surrounding whitespace
     */
    public int textLength() {
        return text.strip().length();
    }

    public ExtractionResult withText(String newText) {
        return new ExtractionResult(newText, method, confidence, pageCount, processedPages, errors, elapsedTime, metadata);
    }

    public ExtractionResult withElapsedTime(Duration newElapsedTime) {
        return new ExtractionResult(text, method, confidence, pageCount, processedPages, errors, newElapsedTime, metadata);
    }
}
