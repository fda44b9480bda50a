package com.example.resumeparser.application.service.extraction;

import com.example.resumeparser.domain.model.ExtractionMethod;
import com.example.resumeparser.infrastructure.extraction.TextExtractionEngine;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Engines usable in this process, computed once at startup.
 */
public final class EngineCapabilities {

    private final Set<ExtractionMethod> available;

    private EngineCapabilities(Set<ExtractionMethod> available) {
        this.available = available.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(ExtractionMethod.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(available));
    }

    /**
     * Checks every engine once. OCR additionally requires the enabled flag.
     */
    public static EngineCapabilities detect(Collection<? extends TextExtractionEngine> engines, boolean ocrEnabled) {
        EnumSet<ExtractionMethod> available = EnumSet.noneOf(ExtractionMethod.class);
        for (TextExtractionEngine engine : engines) {
            if (engine.method() == ExtractionMethod.TESSERACT_OCR && !ocrEnabled) {
                continue;
            }
            if (engine.isSupported()) {
                available.add(engine.method());
            }
        }
        return new EngineCapabilities(available);
    }

    public static EngineCapabilities of(Set<ExtractionMethod> methods) {
        return new EngineCapabilities(methods);
    }

    public boolean isAvailable(ExtractionMethod method) {
        return method != null && available.contains(method);
    }

    public boolean hasDirectTextEngine() {
        return available.stream().anyMatch(ExtractionMethod::isDirectText);
    }

    public boolean isEmpty() {
        return available.isEmpty();
    }

    public Set<ExtractionMethod> available() {
        return available;
    }

    @Override
    public String toString() {
        return "EngineCapabilities" + available;
    }
}
