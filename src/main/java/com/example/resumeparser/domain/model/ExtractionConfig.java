package com.example.resumeparser.domain.model;

import java.util.List;

/**
 * Per-run extraction options.
 *
 * @param preferredMethod explicit engine, or {@code null} for automatic selection
 * @param useFallback     whether insufficient results escalate to other engines
 * @param maxPages        upper bound of pages to read, or {@code null} for all pages
 * @param cleanText       whether the retained text is normalized before it is returned
 * @param ocrLanguages    Tesseract language codes, joined with {@code +} at recognition time
 */
public record ExtractionConfig(
        ExtractionMethod preferredMethod,
        boolean useFallback,
        Integer maxPages,
        boolean cleanText,
        List<String> ocrLanguages
) {

    public ExtractionConfig {
        ocrLanguages = ocrLanguages == null || ocrLanguages.isEmpty() ? List.of("eng") : List.copyOf(ocrLanguages);
        if (maxPages != null && maxPages <= 0) {
            maxPages = null;
        }
    }

    public static ExtractionConfig defaults() {
        return new ExtractionConfig(null, true, null, true, List.of("eng"));
    }

    public boolean isAutoSelect() {
        return preferredMethod == null;
    }

    /**
     * Resolves how many of {@code totalPages} should be read.
     */
    public int pagesToRead(int totalPages) {
        return maxPages == null ? totalPages : Math.min(maxPages, totalPages);
    }

    public ExtractionConfig withPreferredMethod(ExtractionMethod method) {
        return new ExtractionConfig(method, useFallback, maxPages, cleanText, ocrLanguages);
    }

    public ExtractionConfig withFallback(boolean enabled) {
        return new ExtractionConfig(preferredMethod, enabled, maxPages, cleanText, ocrLanguages);
    }
}
