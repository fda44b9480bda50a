package com.example.resumeparser.domain.model;

import java.util.Locale;

/**
 * Fixed enumeration of the text extraction engines the pipeline knows about.
 * Direct-text engines read the PDF content stream; {@link #TESSERACT_OCR} renders pages and
 * runs optical recognition over them.
 */
public enum ExtractionMethod {
    PDFBOX_TEXT(true),
    PDFBOX_LAYOUT(true),
    TIKA(true),
    TESSERACT_OCR(false);

    private final boolean directText;

    ExtractionMethod(boolean directText) {
        this.directText = directText;
    }

    /**
     * @return {@code true} when the engine reads embedded text rather than recognizing rendered pages
     */
    public boolean isDirectText() {
        return directText;
    }

    /**
     * Parses a configuration or request value into a method.
     * {@code auto}, blank and unknown values resolve to {@code null}, meaning "let the selector decide".
     *
     * @param rawValue string coming from configuration or the HTTP layer
     * @return method or {@code null} for automatic selection
     */
    public static ExtractionMethod fromString(String rawValue) {
        if (rawValue == null || rawValue.isBlank() || "auto".equalsIgnoreCase(rawValue.trim())) {
            return null;
        }
        try {
            return ExtractionMethod.valueOf(rawValue.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }

    /**
     * Resolves a human friendly label for logs and reports.
     *
     * @param method method to translate
     * @return display name
     */
    public static String toDisplayName(ExtractionMethod method) {
        return switch (method) {
            case PDFBOX_TEXT -> "PDFBox text stream";
            case PDFBOX_LAYOUT -> "PDFBox layout-sorted text";
            case TIKA -> "Apache Tika";
            case TESSERACT_OCR -> "Tesseract OCR";
        };
    }
}
