package com.example.resumeparser.application.service.extraction;

import com.example.resumeparser.config.ResumePipelineProperties;
import com.example.resumeparser.domain.model.ExtractionMethod;
import com.example.resumeparser.domain.model.ExtractionResult;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Chooses the primary engine for a document and decides when a result is too weak to keep
 * without trying other engines.
 */
@Component
public class MethodSelector {

    /** Direct-text engines by fidelity, recognition last. */
    static final List<ExtractionMethod> FALLBACK_ORDER = List.of(
            ExtractionMethod.PDFBOX_LAYOUT,
            ExtractionMethod.TIKA,
            ExtractionMethod.PDFBOX_TEXT,
            ExtractionMethod.TESSERACT_OCR
    );

    private final ResumePipelineProperties.Extraction extraction;
    private final ResumePipelineProperties.Fallback fallback;

    public MethodSelector(ResumePipelineProperties properties) {
        this.extraction = properties.getExtraction();
        this.fallback = properties.getFallback();
    }

    /**
     * Picks the primary engine by document size: small documents go to the fastest engine, medium
     * ones to the layout-aware engine and large ones to Tika. An unavailable pick is replaced by the
     * first available direct engine, then by OCR.
     *
     * @return the engine to try first, or empty when nothing is available
     */
    public Optional<ExtractionMethod> selectPrimary(long byteSize, EngineCapabilities capabilities) {
        ExtractionMethod preferred;
        if (byteSize < extraction.getSmallDocumentBytes()) {
            preferred = ExtractionMethod.PDFBOX_TEXT;
        } else if (byteSize < extraction.getMediumDocumentBytes()) {
            preferred = ExtractionMethod.PDFBOX_LAYOUT;
        } else {
            preferred = ExtractionMethod.TIKA;
        }
        if (capabilities.isAvailable(preferred)) {
            return Optional.of(preferred);
        }
        Optional<ExtractionMethod> direct = FALLBACK_ORDER.stream()
                .filter(ExtractionMethod::isDirectText)
                .filter(capabilities::isAvailable)
                .findFirst();
        if (direct.isPresent()) {
            return direct;
        }
        return capabilities.isAvailable(ExtractionMethod.TESSERACT_OCR)
                ? Optional.of(ExtractionMethod.TESSERACT_OCR)
                : Optional.empty();
    }

    /**
     * @return the fallback order restricted to available engines
     */
    public List<ExtractionMethod> fallbackOrder(EngineCapabilities capabilities) {
        return FALLBACK_ORDER.stream().filter(capabilities::isAvailable).toList();
    }

    /**
     * A result needs fallback when its text is short, its confidence low, too many of its pages
     * failed, or it is dominated by non-alphanumeric characters.
     */
    public boolean needsFallback(ExtractionResult result) {
        if (result.textLength() < fallback.getMinTextLength()) {
            return true;
        }
        if (result.confidence() < fallback.getMinConfidence()) {
            return true;
        }
        if (result.errors().size() > result.processedPages() * fallback.getMaxPageErrorRatio()) {
            return true;
        }
        return ConfidenceScorer.specialCharacterRatio(result.text()) > fallback.getMaxSpecialCharRatio();
    }
}
