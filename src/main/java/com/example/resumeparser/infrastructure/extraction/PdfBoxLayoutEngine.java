package com.example.resumeparser.infrastructure.extraction;

import com.example.resumeparser.domain.model.ExtractionMethod;

import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

/**
 * Reads text sorted by position on the page, following article beads where present.
 * Handles multi-column layouts that content-stream order scrambles.
 */
@Component
public class PdfBoxLayoutEngine extends AbstractPdfBoxEngine {

    public PdfBoxLayoutEngine(PdfBoxMetadataReader metadataReader) {
        super(metadataReader);
    }

    @Override
    public ExtractionMethod method() {
        return ExtractionMethod.PDFBOX_LAYOUT;
    }

    @Override
    protected void configureStripper(PDFTextStripper stripper) {
        stripper.setSortByPosition(true);
        stripper.setShouldSeparateByBeads(true);
        stripper.setAverageCharTolerance(0.12f);
        stripper.setSpacingTolerance(0.2f);
    }
}
