package com.example.resumeparser.infrastructure.extraction;

import com.example.resumeparser.domain.model.DocumentMetadata;

import java.util.List;

/**
 * Unscored output of a {@link TextExtractionEngine}.
 *
 * @param text           text of the processed pages, pages separated by a blank line
 * @param pageCount      total pages in the document
 * @param processedPages pages actually read
 * @param errors         page-level failures, formatted as {@code "Page n: message"}
 * @param metadata       PDF metadata when the engine reads it, otherwise {@code null}
 */
public record RawExtraction(
        String text,
        int pageCount,
        int processedPages,
        List<String> errors,
        DocumentMetadata metadata
) {

    public RawExtraction {
        text = text == null ? "" : text;
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
