package com.example.resumeparser.application.service.pipeline;

import com.example.resumeparser.application.exception.BatchRequestValidationException;
import com.example.resumeparser.domain.model.BatchReport;
import com.example.resumeparser.domain.model.Document;
import com.example.resumeparser.domain.model.PipelineConfig;
import com.example.resumeparser.domain.model.PipelineResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.function.Function;

/**
 * Runs many résumés through the pipeline concurrently on a bounded executor.
 * Each document gets its own independent run; results come back in input order.
 */
@Service
public class ResumeBatchProcessor {

    private static final Logger log = LoggerFactory.getLogger(ResumeBatchProcessor.class);

    private final ResumeProcessingPipeline pipeline;
    private final AsyncTaskExecutor batchExecutor;

    public ResumeBatchProcessor(ResumeProcessingPipeline pipeline,
                                @Qualifier("resumeBatchExecutor") AsyncTaskExecutor batchExecutor) {
        this.pipeline = pipeline;
        this.batchExecutor = batchExecutor;
    }

    /**
     * @throws BatchRequestValidationException when no paths are given
     */
    public BatchReport processAll(List<Path> paths, PipelineConfig config) {
        if (paths == null || paths.isEmpty()) {
            throw new BatchRequestValidationException("Please provide at least one résumé to process.");
        }
        return run(paths, path -> pipeline.process(path, config), Path::toString);
    }

    /**
     * @throws BatchRequestValidationException when no documents are given
     */
    public BatchReport processDocuments(List<Document> documents, PipelineConfig config) {
        if (documents == null || documents.isEmpty()) {
            throw new BatchRequestValidationException("Please provide at least one résumé to process.");
        }
        return run(documents, document -> pipeline.process(document, config), Document::reference);
    }

    private <T> BatchReport run(List<T> inputs, Function<T, PipelineResult> task, Function<T, String> reference) {
        log.info("Processing batch of {} résumés", inputs.size());
        List<Future<PipelineResult>> futures = new ArrayList<>(inputs.size());
        for (T input : inputs) {
            futures.add(batchExecutor.submit(() -> task.apply(input)));
        }
        List<PipelineResult> results = new ArrayList<>(inputs.size());
        for (int i = 0; i < futures.size(); i++) {
            String inputRef = reference.apply(inputs.get(i));
            try {
                results.add(futures.get(i).get());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                results.add(failedRun(inputRef, "Batch interrupted"));
            } catch (ExecutionException ex) {
                log.warn("Batch item {} failed: {}", inputRef, ex.getCause().getMessage());
                results.add(failedRun(inputRef, "Unexpected failure: " + ex.getCause().getMessage()));
            }
        }
        BatchReport report = new BatchReport(results, null);
        log.info("Batch finished: {}/{} successful", report.summary().successful(), report.summary().totalProcessed());
        return report;
    }

    private PipelineResult failedRun(String inputRef, String error) {
        return new PipelineResult(inputRef, ResumeProcessingPipeline.PROCESSING_ID_PREFIX + UUID.randomUUID(), Instant.now(),
                Duration.ZERO, Map.of(), null, null, null, null, false, 0.0, 0.0, 0.0, List.of(error), List.of());
    }
}
