package com.example.resumeparser.application.service.pipeline;

import com.example.resumeparser.application.port.JobMatchingService;
import com.example.resumeparser.application.port.ProfileEnhancementService;
import com.example.resumeparser.application.service.extraction.DocumentLoader;
import com.example.resumeparser.application.service.extraction.ExtractionOutcome;
import com.example.resumeparser.application.service.extraction.ExtractionService;
import com.example.resumeparser.application.service.parsing.ResumeParser;
import com.example.resumeparser.domain.model.CandidateProfile;
import com.example.resumeparser.domain.model.Document;
import com.example.resumeparser.domain.model.EnhancementReport;
import com.example.resumeparser.domain.model.ExtractionResult;
import com.example.resumeparser.domain.model.JobMatchReport;
import com.example.resumeparser.domain.model.PipelineConfig;
import com.example.resumeparser.domain.model.PipelineResult;
import com.example.resumeparser.domain.model.PipelineStage;
import com.example.resumeparser.domain.model.StageResult;
import com.example.resumeparser.domain.model.StageStatus;
import com.example.resumeparser.infrastructure.exception.ExtractionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Application service that runs one résumé through extraction, parsing, optional enhancement and
 * matching, and validation.
 * <p>
 * Stages run strictly in order on the calling thread, or on the stage executor when a stage timeout
 * is configured. A failed extraction or parsing stage ends the run; failures of the optional stages
 * become warnings. Nothing a document does makes {@code process} throw.
 */
@Service
public class ResumeProcessingPipeline {

    private static final Logger log = LoggerFactory.getLogger(ResumeProcessingPipeline.class);
    static final String PROCESSING_ID_PREFIX = "resume-";

    private final DocumentLoader documentLoader;
    private final ExtractionService extractionService;
    private final ResumeParser resumeParser;
    private final ObjectProvider<ProfileEnhancementService> enhancementService;
    private final ObjectProvider<JobMatchingService> matchingService;
    private final ResultValidator validator;
    private final PipelineScoring scoring;
    private final List<StageListener> listeners;
    private final AsyncTaskExecutor stageExecutor;

    public ResumeProcessingPipeline(DocumentLoader documentLoader,
                                    ExtractionService extractionService,
                                    ResumeParser resumeParser,
                                    ObjectProvider<ProfileEnhancementService> enhancementService,
                                    ObjectProvider<JobMatchingService> matchingService,
                                    ResultValidator validator,
                                    PipelineScoring scoring,
                                    List<StageListener> listeners,
                                    @Qualifier("pipelineStageExecutor") AsyncTaskExecutor stageExecutor) {
        this.documentLoader = documentLoader;
        this.extractionService = extractionService;
        this.resumeParser = resumeParser;
        this.enhancementService = enhancementService;
        this.matchingService = matchingService;
        this.validator = validator;
        this.scoring = scoring;
        this.listeners = List.copyOf(listeners);
        this.stageExecutor = stageExecutor;
    }

    public PipelineResult process(Path path, PipelineConfig config) {
        return process(path, config, PipelineCancellation.none());
    }

    /**
     * Processes a résumé on disk. A missing or unreadable file fails the extraction stage.
     */
    public PipelineResult process(Path path, PipelineConfig config, PipelineCancellation cancellation) {
        String inputRef = path != null ? path.toString() : "<no path>";
        return run(inputRef, () -> documentLoader.load(path), config, cancellation);
    }

    public PipelineResult process(Document document, PipelineConfig config) {
        return process(document, config, PipelineCancellation.none());
    }

    public PipelineResult process(Document document, PipelineConfig config, PipelineCancellation cancellation) {
        String inputRef = document != null ? document.reference() : "<no document>";
        return run(inputRef, () -> document, config, cancellation);
    }

    private PipelineResult run(String inputRef, Supplier<Document> source, PipelineConfig config,
                               PipelineCancellation cancellation) {
        PipelineConfig effective = config != null ? config : PipelineConfig.defaults();
        PipelineCancellation cancel = cancellation != null ? cancellation : PipelineCancellation.none();
        RunState state = new RunState(PROCESSING_ID_PREFIX + UUID.randomUUID(), inputRef);
        log.info("[{}] processing {}", state.processingId, inputRef);

        for (PipelineStage stage : PipelineStage.values()) {
            notifyListeners(state.processingId, stage, StageStatus.PENDING);
        }

        for (PipelineStage stage : PipelineStage.values()) {
            if (state.aborted) {
                skip(state, stage, "Skipped after a critical stage failed");
                continue;
            }
            if (cancel.isCancelled()) {
                handleCancellation(state, stage);
                break;
            }
            switch (stage) {
                case EXTRACTION -> runExtraction(state, source, effective, cancel);
                case PARSING -> runParsing(state, effective);
                case ENHANCEMENT -> runEnhancement(state, effective);
                case MATCHING -> runMatching(state, effective);
                case VALIDATION -> runValidation(state, effective);
            }
        }

        PipelineResult result = state.toResult(scoring);
        for (StageListener listener : listeners) {
            try {
                listener.onPipelineFinished(result);
            } catch (RuntimeException ex) {
                log.warn("Stage listener {} failed: {}", listener.getClass().getSimpleName(), ex.getMessage());
            }
        }
        return result;
    }

    private void runExtraction(RunState state, Supplier<Document> source, PipelineConfig config,
                               PipelineCancellation cancellation) {
        StageResult result = execute(state, PipelineStage.EXTRACTION, config.stageTimeout(), () -> {
            Document document = source.get();
            ExtractionOutcome outcome = extractionService.extract(document, config.extraction(), cancellation::isCancelled);
            if (outcome instanceof ExtractionOutcome.Extracted extracted) {
                return extracted.result();
            }
            throw new ExtractionException(((ExtractionOutcome.Failed) outcome).describe());
        });
        state.extraction = result.payloadAs(ExtractionResult.class);
        recordCritical(state, result);
    }

    private void runParsing(RunState state, PipelineConfig config) {
        ExtractionResult extraction = state.extraction;
        StageResult result = execute(state, PipelineStage.PARSING, config.stageTimeout(),
                () -> resumeParser.parse(extraction.text(), extraction.confidence()));
        state.profile = result.payloadAs(CandidateProfile.class);
        recordCritical(state, result);
    }

    private void runEnhancement(RunState state, PipelineConfig config) {
        if (!config.enhancementEnabled()) {
            skip(state, PipelineStage.ENHANCEMENT, "Enhancement disabled");
            return;
        }
        ProfileEnhancementService service = enhancementService.getIfAvailable();
        if (service == null) {
            skip(state, PipelineStage.ENHANCEMENT, "No enhancement service configured");
            return;
        }
        CandidateProfile profile = state.profile;
        StageResult result = execute(state, PipelineStage.ENHANCEMENT, config.stageTimeout(),
                () -> service.enhance(profile, config.targetJobDescription()));
        state.enhancement = result.payloadAs(EnhancementReport.class);
        recordOptional(state, result, "Enhancement failed, proceeding without enhancement: ");
    }

    private void runMatching(RunState state, PipelineConfig config) {
        if (!config.matchingEnabled()) {
            skip(state, PipelineStage.MATCHING, "Matching disabled");
            return;
        }
        if (!config.hasTargetJob()) {
            skip(state, PipelineStage.MATCHING, "No target job description");
            return;
        }
        JobMatchingService service = matchingService.getIfAvailable();
        if (service == null) {
            skip(state, PipelineStage.MATCHING, "No job matching service configured");
            return;
        }
        CandidateProfile profile = state.profile;
        StageResult result = execute(state, PipelineStage.MATCHING, config.stageTimeout(),
                () -> service.match(profile, config.targetJobDescription()));
        state.jobMatch = result.payloadAs(JobMatchReport.class);
        recordOptional(state, result, "Job matching failed, proceeding without match: ");
    }

    private void runValidation(RunState state, PipelineConfig config) {
        if (!config.validationEnabled()) {
            skip(state, PipelineStage.VALIDATION, "Validation disabled");
            return;
        }
        PipelineResult interim = state.toResult(scoring);
        StageResult result = execute(state, PipelineStage.VALIDATION, config.stageTimeout(),
                () -> validator.validate(interim, config.minParsingConfidence()));
        if (result.status() == StageStatus.COMPLETED) {
            @SuppressWarnings("unchecked")
            List<String> warnings = (List<String>) result.payload();
            state.warnings.addAll(warnings);
            state.stages.put(PipelineStage.VALIDATION, StageResult.completedWithWarnings(
                    PipelineStage.VALIDATION, result.startTime(), result.endTime(), warnings, warnings));
        } else {
            recordOptional(state, result, "Validation failed: ");
        }
    }

    /**
     * Runs one stage, recording and reporting its transitions. Exceptions and native linkage errors
     * become a failed result.
     */
    private StageResult execute(RunState state, PipelineStage stage, Duration timeout, Callable<?> work) {
        notifyListeners(state.processingId, stage, StageStatus.IN_PROGRESS);
        Instant start = Instant.now();
        StageResult result;
        try {
            Object payload = callWithTimeout(stage, work, timeout);
            result = StageResult.completed(stage, start, Instant.now(), payload);
        } catch (Exception | LinkageError ex) {
            String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            log.warn("[{}] {} stage failed: {}", state.processingId, stage.displayName(), message);
            result = StageResult.failed(stage, start, Instant.now(), message);
        }
        state.stages.put(stage, result);
        notifyListeners(state.processingId, stage, result.status());
        return result;
    }

    private Object callWithTimeout(PipelineStage stage, Callable<?> work, Duration timeout) throws Exception {
        if (timeout == null) {
            return work.call();
        }
        Future<?> future = stageExecutor.submit(work);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw new TimeoutException(stage.displayName() + " stage timed out after " + timeout.toMillis() + " ms");
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw ex;
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof LinkageError linkageError) {
                throw linkageError;
            }
            throw ex;
        }
    }

    private void recordCritical(RunState state, StageResult result) {
        if (result.status() == StageStatus.FAILED) {
            state.errors.add(result.stage().displayName() + " failed: " + result.error());
            state.aborted = true;
        }
    }

    private void recordOptional(RunState state, StageResult result, String warningPrefix) {
        if (result.status() == StageStatus.FAILED) {
            state.warnings.add(warningPrefix + result.error());
        }
    }

    private void skip(RunState state, PipelineStage stage, String reason) {
        state.stages.put(stage, StageResult.skipped(stage, reason));
        notifyListeners(state.processingId, stage, StageStatus.SKIPPED);
    }

    private void handleCancellation(RunState state, PipelineStage firstPending) {
        String message = "Pipeline cancelled before " + firstPending.displayName() + " stage";
        log.info("[{}] {}", state.processingId, message);
        boolean criticalDone = state.isCompleted(PipelineStage.EXTRACTION) && state.isCompleted(PipelineStage.PARSING);
        if (criticalDone) {
            state.warnings.add(message);
        } else {
            state.errors.add(message);
            state.aborted = true;
        }
        for (PipelineStage stage : PipelineStage.values()) {
            if (stage.ordinal() >= firstPending.ordinal()) {
                skip(state, stage, "Cancelled");
            }
        }
    }

    private void notifyListeners(String processingId, PipelineStage stage, StageStatus status) {
        for (StageListener listener : listeners) {
            try {
                listener.onStageStatus(processingId, stage, status);
            } catch (RuntimeException ex) {
                log.warn("Stage listener {} failed: {}", listener.getClass().getSimpleName(), ex.getMessage());
            }
        }
    }

    /**
     * Mutable bookkeeping of one run. Confined to the thread that calls {@code process}.
     */
    private static final class RunState {
        private final String processingId;
        private final String inputRef;
        private final Instant startedAt = Instant.now();
        private final long startedNanos = System.nanoTime();
        private final Map<PipelineStage, StageResult> stages = new EnumMap<>(PipelineStage.class);
        private final List<String> errors = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private ExtractionResult extraction;
        private CandidateProfile profile;
        private EnhancementReport enhancement;
        private JobMatchReport jobMatch;
        private boolean aborted;

        private RunState(String processingId, String inputRef) {
            this.processingId = processingId;
            this.inputRef = inputRef;
        }

        private boolean isCompleted(PipelineStage stage) {
            StageResult result = stages.get(stage);
            return result != null && result.status() == StageStatus.COMPLETED;
        }

        private PipelineResult toResult(PipelineScoring scoring) {
            boolean success = !aborted && isCompleted(PipelineStage.EXTRACTION) && isCompleted(PipelineStage.PARSING);
            return new PipelineResult(
                    inputRef,
                    processingId,
                    startedAt,
                    Duration.ofNanos(System.nanoTime() - startedNanos),
                    stages,
                    extraction,
                    profile,
                    enhancement,
                    jobMatch,
                    success,
                    scoring.confidence(extraction, profile, enhancement),
                    scoring.quality(profile),
                    scoring.completeness(profile),
                    errors,
                    warnings
            );
        }
    }
}
