package com.example.resumeparser.domain.model;

/**
 * PDF-level metadata surfaced alongside extracted text.
 * Constructed by infrastructure readers; any field may be {@code null} when the source lacks it.
 */
public record DocumentMetadata(
        String title,
        String author,
        String creator,
        String producer,
        String creationDate,
        String creatorTool,
        String pdfVersion,
        boolean encrypted,
        int totalPages,
        int extractedPages
) {

    public static DocumentMetadata pagesOnly(int totalPages, int extractedPages) {
        return new DocumentMetadata(null, null, null, null, null, null, null, false, totalPages, extractedPages);
    }
}
