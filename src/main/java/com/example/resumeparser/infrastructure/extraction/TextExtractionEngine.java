package com.example.resumeparser.infrastructure.extraction;

import com.example.resumeparser.domain.model.ExtractionConfig;
import com.example.resumeparser.domain.model.ExtractionMethod;

import java.io.IOException;

/**
 * A single way of turning PDF bytes into text.
 * Implementations are stateless and safe to call from several threads at once.
 */
public interface TextExtractionEngine {

    /**
     * @return the method this engine implements
     */
    ExtractionMethod method();

    /**
     * Reports whether the engine can run in this process (libraries and native data present).
     * Evaluated once at startup.
     */
    boolean isSupported();

    /**
     * Extracts text from the given PDF bytes.
     *
     * @param content raw PDF bytes
     * @param config  page limits and OCR languages for this run
     * @return extracted text with per-page errors collected rather than thrown
     * @throws IOException when the document cannot be opened at all
     */
    RawExtraction extract(byte[] content, ExtractionConfig config) throws IOException;
}
