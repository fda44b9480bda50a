package com.example.resumeparser.infrastructure.extraction;

import com.example.resumeparser.domain.model.ExtractionMethod;

import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

/**
 * Reads text in content-stream order. Fastest engine; good enough for most single-column résumés.
 */
@Component
public class PdfBoxTextEngine extends AbstractPdfBoxEngine {

    public PdfBoxTextEngine(PdfBoxMetadataReader metadataReader) {
        super(metadataReader);
    }

    @Override
    public ExtractionMethod method() {
        return ExtractionMethod.PDFBOX_TEXT;
    }

    @Override
    protected void configureStripper(PDFTextStripper stripper) {
        stripper.setSortByPosition(false);
    }
}
