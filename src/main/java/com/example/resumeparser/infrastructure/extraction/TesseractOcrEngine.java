package com.example.resumeparser.infrastructure.extraction;

import com.example.resumeparser.config.ResumePipelineProperties;
import com.example.resumeparser.domain.model.ExtractionConfig;
import com.example.resumeparser.domain.model.ExtractionMethod;
import com.example.resumeparser.infrastructure.exception.ExtractionException;

import net.sourceforge.tess4j.ITessAPI;
import net.sourceforge.tess4j.TessAPI;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Semaphore;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Renders each page to a grayscale bitmap and recognizes it with Tesseract.
 * <p>
 * Recognition is CPU bound, so a process-wide semaphore caps concurrent jobs regardless of how many
 * pipelines run at once. A {@link Tesseract} instance is not thread safe and is created per job.
 * <p>
 * The engine is only supported when OCR is enabled, the tessdata directory exists and the native
 * Tesseract library loads. A native failure during recognition fails the extraction instead of
 * escaping as an {@link Error}.
 */
@Component
public class TesseractOcrEngine implements TextExtractionEngine {

    private static final Logger log = LoggerFactory.getLogger(TesseractOcrEngine.class);

    private final ResumePipelineProperties.Ocr ocr;
    private final Supplier<Tesseract> tesseractFactory;
    private final Semaphore recognitionPermits;
    private final boolean supported;

    @Autowired
    public TesseractOcrEngine(ResumePipelineProperties properties) {
        this(properties, TesseractOcrEngine::nativeLibraryLoads, Tesseract::new);
    }

    TesseractOcrEngine(ResumePipelineProperties properties, BooleanSupplier nativeLibraryCheck,
                       Supplier<Tesseract> tesseractFactory) {
        this.ocr = properties.getOcr();
        this.tesseractFactory = tesseractFactory;
        this.recognitionPermits = new Semaphore(ocr.effectiveConcurrency());
        this.supported = detectSupport(nativeLibraryCheck);
    }

    @Override
    public ExtractionMethod method() {
        return ExtractionMethod.TESSERACT_OCR;
    }

    @Override
    public boolean isSupported() {
        return supported;
    }

    @Override
    public RawExtraction extract(byte[] content, ExtractionConfig config) throws IOException {
        if (!supported) {
            throw new ExtractionException("OCR is not available in this process.");
        }
        try (PDDocument document = Loader.loadPDF(content)) {
            int totalPages = document.getNumberOfPages();
            int pagesToRead = config.pagesToRead(totalPages);
            PDFRenderer renderer = new PDFRenderer(document);
            Tesseract tesseract = newTesseract(config.ocrLanguages());

            List<String> pages = new ArrayList<>(pagesToRead);
            List<String> errors = new ArrayList<>();
            for (int pageIndex = 0; pageIndex < pagesToRead; pageIndex++) {
                AbstractPdfBoxEngine.abortIfInterrupted(method(), pageIndex);
                try {
                    BufferedImage image = renderer.renderImageWithDPI(pageIndex, ocr.getDpi(), ImageType.GRAY);
                    String pageText = recognize(tesseract, image).strip();
                    if (!pageText.isEmpty()) {
                        pages.add(pageText);
                    }
                } catch (IOException | TesseractException | RuntimeException ex) {
                    log.warn("OCR failed on page {}: {}", pageIndex + 1, ex.getMessage());
                    errors.add("Page " + (pageIndex + 1) + ": " + ex.getMessage());
                }
            }
            return new RawExtraction(String.join(AbstractPdfBoxEngine.PAGE_SEPARATOR, pages),
                    totalPages, pagesToRead, errors, null);
        } catch (LinkageError ex) {
            log.warn("Native Tesseract failed: {}", ex.getMessage());
            throw new ExtractionException("Native Tesseract library failed: " + ex.getMessage(), ex);
        }
    }

    private String recognize(Tesseract tesseract, BufferedImage image) throws TesseractException {
        try {
            recognitionPermits.acquire();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ExtractionException("Interrupted while waiting for an OCR slot.", ex);
        }
        try {
            return tesseract.doOCR(image);
        } finally {
            recognitionPermits.release();
        }
    }

    private Tesseract newTesseract(List<String> languages) {
        Tesseract tesseract = tesseractFactory.get();
        tesseract.setDatapath(ocr.getDatapath());
        tesseract.setLanguage(String.join("+", languages));
        tesseract.setPageSegMode(ocr.getPageSegMode());
        return tesseract;
    }

    private boolean detectSupport(BooleanSupplier nativeLibraryCheck) {
        if (!ocr.isEnabled()) {
            log.info("OCR disabled by configuration");
            return false;
        }
        String datapath = ocr.getDatapath();
        if (datapath == null || !Files.isDirectory(Path.of(datapath))) {
            log.warn("Tesseract data directory {} not found; OCR unavailable", datapath);
            return false;
        }
        if (!nativeLibraryCheck.getAsBoolean()) {
            log.warn("Native Tesseract library could not be loaded; OCR unavailable");
            return false;
        }
        log.info("OCR available with tessdata at {} and {} concurrent jobs", datapath, recognitionPermits.availablePermits());
        return true;
    }

    /**
     * Creates and releases one native API handle, which loads libtesseract through JNA.
     */
    private static boolean nativeLibraryLoads() {
        try {
            TessAPI api = TessAPI.INSTANCE;
            ITessAPI.TessBaseAPI handle = api.TessBaseAPICreate();
            api.TessBaseAPIDelete(handle);
            return true;
        } catch (LinkageError | RuntimeException ex) {
            log.debug("Tesseract native library check failed", ex);
            return false;
        }
    }
}
