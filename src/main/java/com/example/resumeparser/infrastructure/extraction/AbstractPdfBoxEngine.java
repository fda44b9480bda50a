package com.example.resumeparser.infrastructure.extraction;

import com.example.resumeparser.domain.model.ExtractionConfig;
import com.example.resumeparser.domain.model.ExtractionMethod;
import com.example.resumeparser.infrastructure.exception.ExtractionException;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared page-by-page loop of the PDFBox engines. A page that fails to strip is recorded as an
 * error and skipped; the remaining pages are still read. An interrupted thread stops before the
 * next page.
 */
abstract class AbstractPdfBoxEngine implements TextExtractionEngine {

    private static final Logger log = LoggerFactory.getLogger(AbstractPdfBoxEngine.class);
    static final String PAGE_SEPARATOR = "\n\n";

    private final PdfBoxMetadataReader metadataReader;

    protected AbstractPdfBoxEngine(PdfBoxMetadataReader metadataReader) {
        this.metadataReader = metadataReader;
    }

    /**
     * Applies the engine-specific stripper settings.
     */
    protected abstract void configureStripper(PDFTextStripper stripper);

    @Override
    public boolean isSupported() {
        return true;
    }

    @Override
    public RawExtraction extract(byte[] content, ExtractionConfig config) throws IOException {
        try (PDDocument document = Loader.loadPDF(content)) {
            int totalPages = document.getNumberOfPages();
            int pagesToRead = config.pagesToRead(totalPages);

            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setLineSeparator("\n");
            stripper.setParagraphEnd("\n");
            stripper.setAddMoreFormatting(true);
            configureStripper(stripper);

            List<String> pages = new ArrayList<>(pagesToRead);
            List<String> errors = new ArrayList<>();
            for (int pageNumber = 1; pageNumber <= pagesToRead; pageNumber++) {
                abortIfInterrupted(method(), pageNumber - 1);
                stripper.setStartPage(pageNumber);
                stripper.setEndPage(pageNumber);
                try {
                    String pageText = stripper.getText(document).strip();
                    if (!pageText.isEmpty()) {
                        pages.add(pageText);
                    }
                } catch (IOException | RuntimeException ex) {
                    log.warn("{} failed on page {}: {}", method(), pageNumber, ex.getMessage());
                    errors.add("Page " + pageNumber + ": " + ex.getMessage());
                }
            }
            return new RawExtraction(
                    String.join(PAGE_SEPARATOR, pages),
                    totalPages,
                    pagesToRead,
                    errors,
                    metadataReader.read(document, pagesToRead)
            );
        }
    }

    /**
     * Stops a page loop whose thread was interrupted, typically by a stage timeout.
     *
     * @throws ExtractionException when the current thread is interrupted
     */
    static void abortIfInterrupted(ExtractionMethod method, int pagesRead) {
        if (Thread.currentThread().isInterrupted()) {
            throw new ExtractionException(method + " interrupted after " + pagesRead + " pages");
        }
    }
}
