package com.example.resumeparser.application.service.extraction;

import com.example.resumeparser.application.service.parsing.TextNormalizer;
import com.example.resumeparser.domain.model.Document;
import com.example.resumeparser.domain.model.ExtractionConfig;
import com.example.resumeparser.domain.model.ExtractionMethod;
import com.example.resumeparser.domain.model.ExtractionResult;
import com.example.resumeparser.infrastructure.extraction.RawExtraction;
import com.example.resumeparser.infrastructure.extraction.TextExtractionEngine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * Application service that turns a {@link Document} into text.
 * It picks the primary engine, escalates through the fallback order while results stay weak, and
 * keeps the best result seen. Engine exceptions never leave this class.
 */
@Service
public class ExtractionService {

    private static final Logger log = LoggerFactory.getLogger(ExtractionService.class);

    private final Map<ExtractionMethod, TextExtractionEngine> engines = new EnumMap<>(ExtractionMethod.class);
    private final EngineCapabilities capabilities;
    private final MethodSelector selector;
    private final ConfidenceScorer scorer;
    private final TextNormalizer normalizer;

    public ExtractionService(List<TextExtractionEngine> engines,
                             EngineCapabilities capabilities,
                             MethodSelector selector,
                             ConfidenceScorer scorer,
                             TextNormalizer normalizer) {
        for (TextExtractionEngine engine : engines) {
            this.engines.put(engine.method(), engine);
        }
        this.capabilities = capabilities;
        this.selector = selector;
        this.scorer = scorer;
        this.normalizer = normalizer;
    }

    public ExtractionOutcome extract(Document document, ExtractionConfig config) {
        return extract(document, config, () -> false);
    }

    /**
     * Extracts text from the document.
     *
     * @param document  document to read
     * @param config    per-run extraction options
     * @param cancelled polled before every fallback attempt
     * @return the retained result with all attempts, or a failure describing every attempt
     */
    public ExtractionOutcome extract(Document document, ExtractionConfig config, BooleanSupplier cancelled) {
        long startedAt = System.nanoTime();
        if (document == null || document.isEmpty()) {
            return new ExtractionOutcome.Failed("Document is empty", List.of());
        }
        Optional<ExtractionMethod> primary = resolvePrimary(document, config);
        if (primary.isEmpty()) {
            String message = config.isAutoSelect()
                    ? "No extraction engine is available"
                    : "Extraction method " + config.preferredMethod() + " is not available";
            return new ExtractionOutcome.Failed(message, List.of());
        }

        byte[] content = document.content();
        List<EngineOutcome> attempts = new ArrayList<>();
        Set<ExtractionMethod> tried = EnumSet.noneOf(ExtractionMethod.class);

        log.info("Extracting {} ({} bytes) with {}", document.reference(), document.byteSize(), primary.get());
        EngineOutcome first = runEngine(primary.get(), content, config);
        attempts.add(first);
        tried.add(primary.get());
        ExtractionResult best = first instanceof EngineOutcome.Succeeded succeeded ? succeeded.result() : null;

        if (config.useFallback() && (best == null || selector.needsFallback(best))) {
            for (ExtractionMethod method : selector.fallbackOrder(capabilities)) {
                if (tried.contains(method)) {
                    continue;
                }
                if (cancelled.getAsBoolean() || Thread.currentThread().isInterrupted()) {
                    log.info("Extraction of {} cancelled before trying {}", document.reference(), method);
                    break;
                }
                log.warn("Escalating extraction of {} to {}", document.reference(), method);
                EngineOutcome outcome = runEngine(method, content, config);
                attempts.add(outcome);
                tried.add(method);
                if (outcome instanceof EngineOutcome.Succeeded succeeded) {
                    ExtractionResult candidate = succeeded.result();
                    int bestLength = best == null ? 0 : best.textLength();
                    boolean longer = candidate.textLength() > bestLength;
                    best = better(best, candidate);
                    if (longer) {
                        break;
                    }
                }
            }
        }

        if (best == null) {
            List<String> errors = attempts.stream()
                    .filter(EngineOutcome.Failed.class::isInstance)
                    .map(EngineOutcome.Failed.class::cast)
                    .map(failed -> failed.method() + ": " + failed.error())
                    .toList();
            return new ExtractionOutcome.Failed("All extraction engines failed", errors);
        }

        String text = config.cleanText() ? normalizer.normalize(best.text()) : best.text();
        ExtractionResult retained = best.withText(text)
                .withElapsedTime(Duration.ofNanos(System.nanoTime() - startedAt));
        log.info("Retained {} result for {}: {} chars, confidence {}", retained.method(),
                document.reference(), retained.textLength(), String.format("%.2f", retained.confidence()));
        return new ExtractionOutcome.Extracted(retained, attempts);
    }

    private Optional<ExtractionMethod> resolvePrimary(Document document, ExtractionConfig config) {
        if (config.isAutoSelect()) {
            return selector.selectPrimary(document.byteSize(), capabilities);
        }
        if (capabilities.isAvailable(config.preferredMethod()) && engines.containsKey(config.preferredMethod())) {
            return Optional.of(config.preferredMethod());
        }
        if (config.useFallback()) {
            log.warn("Preferred method {} is not available; using fallback order", config.preferredMethod());
            return selector.fallbackOrder(capabilities).stream().findFirst();
        }
        return Optional.empty();
    }

    private EngineOutcome runEngine(ExtractionMethod method, byte[] content, ExtractionConfig config) {
        TextExtractionEngine engine = engines.get(method);
        if (engine == null) {
            return new EngineOutcome.Failed(method, "No engine registered");
        }
        long startedAt = System.nanoTime();
        try {
            RawExtraction raw = engine.extract(content, config);
            double confidence = scorer.score(raw.text(), method);
            ExtractionResult result = new ExtractionResult(
                    raw.text(),
                    method,
                    confidence,
                    raw.pageCount(),
                    raw.processedPages(),
                    raw.errors(),
                    Duration.ofNanos(System.nanoTime() - startedAt),
                    raw.metadata()
            );
            log.debug("{} produced {} chars over {} pages, confidence {}", method, result.textLength(),
                    result.processedPages(), confidence);
            return new EngineOutcome.Succeeded(result);
        } catch (IOException | RuntimeException | LinkageError ex) {
            log.warn("{} failed: {}", method, ex.getMessage());
            String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            return new EngineOutcome.Failed(method, message);
        }
    }

    /**
     * Longest text wins; equal lengths are decided by confidence.
     */
    static ExtractionResult better(ExtractionResult current, ExtractionResult candidate) {
        if (current == null) {
            return candidate;
        }
        if (candidate.textLength() != current.textLength()) {
            return candidate.textLength() > current.textLength() ? candidate : current;
        }
        return candidate.confidence() > current.confidence() ? candidate : current;
    }

    public EngineCapabilities capabilities() {
        return capabilities;
    }
}
