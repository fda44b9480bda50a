package com.example.resumeparser.application.service.pipeline;

import com.example.resumeparser.application.port.JobMatchingService;
import com.example.resumeparser.application.port.ProfileEnhancementService;
import com.example.resumeparser.application.service.extraction.ConfidenceScorer;
import com.example.resumeparser.application.service.extraction.DocumentLoader;
import com.example.resumeparser.application.service.extraction.EngineCapabilities;
import com.example.resumeparser.application.service.extraction.ExtractionOutcome;
import com.example.resumeparser.application.service.extraction.ExtractionService;
import com.example.resumeparser.application.service.extraction.MethodSelector;
import com.example.resumeparser.application.service.parsing.ResumeFixtures;
import com.example.resumeparser.application.service.parsing.ResumeParser;
import com.example.resumeparser.application.service.parsing.TextNormalizer;
import com.example.resumeparser.config.PipelineConfiguration;
import com.example.resumeparser.config.ResumePipelineProperties;
import com.example.resumeparser.domain.model.CandidateProfile;
import com.example.resumeparser.domain.model.Document;
import com.example.resumeparser.domain.model.EnhancementReport;
import com.example.resumeparser.domain.model.ExtractionConfig;
import com.example.resumeparser.domain.model.ExtractionMethod;
import com.example.resumeparser.domain.model.ExtractionResult;
import com.example.resumeparser.domain.model.JobMatchReport;
import com.example.resumeparser.domain.model.PipelineConfig;
import com.example.resumeparser.domain.model.PipelineResult;
import com.example.resumeparser.domain.model.PipelineStage;
import com.example.resumeparser.domain.model.StageResult;
import com.example.resumeparser.domain.model.StageStatus;
import com.example.resumeparser.infrastructure.exception.EnhancementException;
import com.example.resumeparser.infrastructure.exception.MatchingException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.support.StaticListableBeanFactory;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;

/**
 * Tests for {@link ResumeProcessingPipeline} with a scripted extraction step and real parsing.
 */
class ResumeProcessingPipelineTest {

    private static final Document DOCUMENT = Document.ofBytes("resume.pdf",
            "%PDF-1.4 scripted".getBytes(StandardCharsets.UTF_8));

    private final ResumePipelineProperties properties = new ResumePipelineProperties();
    private final ExtractionService extractionService = mock(ExtractionService.class);
    private final List<String> transitions = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger finishedRuns = new AtomicInteger();
    private ThreadPoolTaskExecutor stageExecutor;

    @BeforeEach
    void setUp() {
        stageExecutor = new ThreadPoolTaskExecutor();
        stageExecutor.setCorePoolSize(2);
        stageExecutor.setThreadNamePrefix("test-stage-");
        stageExecutor.initialize();
    }

    @AfterEach
    void tearDown() {
        stageExecutor.shutdown();
    }

    @Test
    void processProducesProfileAndScores() {
        extractionReturns(ResumeFixtures.SAMPLE_RESUME, 0.9);

        PipelineResult result = pipeline(null, null).process(DOCUMENT, PipelineConfig.defaults());

        assertThat(result.overallSuccess()).isTrue();
        assertThat(result.processingId()).startsWith("resume-");
        assertThat(result.inputRef()).isEqualTo("resume.pdf");
        assertThat(result.errors()).isEmpty();
        assertThat(result.warnings()).isEmpty();
        assertThat(result.profile().workExperience()).hasSize(3);
        assertThat(result.extraction().method()).isEqualTo(ExtractionMethod.PDFBOX_TEXT);
        assertThat(result.confidenceScore()).isBetween(0.5, 1.0);
        assertThat(result.qualityScore()).isCloseTo(1.0, within(1e-9));
        assertThat(result.completenessScore()).isCloseTo(8.0 / 9.0, within(1e-9));
        assertThat(result.stageResult(PipelineStage.EXTRACTION).status()).isEqualTo(StageStatus.COMPLETED);
        assertThat(result.stageResult(PipelineStage.PARSING).status()).isEqualTo(StageStatus.COMPLETED);
        assertThat(result.stageResult(PipelineStage.ENHANCEMENT).warnings()).containsExactly("Enhancement disabled");
        assertThat(result.stageResult(PipelineStage.MATCHING).warnings()).containsExactly("Matching disabled");
        assertThat(result.stageResult(PipelineStage.VALIDATION).success()).isTrue();
    }

    @Test
    void processIsDeterministicForSameDocument() {
        extractionReturns(ResumeFixtures.SAMPLE_RESUME, 0.9);
        ResumeProcessingPipeline pipeline = pipeline(null, null);

        CandidateProfile first = pipeline.process(DOCUMENT, PipelineConfig.defaults()).profile();
        CandidateProfile second = pipeline.process(DOCUMENT, PipelineConfig.defaults()).profile();

        assertThat(first).isEqualTo(second);
    }

    @Test
    void extractionFailureSkipsRemainingStages() {
        given(extractionService.extract(any(Document.class), any(ExtractionConfig.class), any(BooleanSupplier.class)))
                .willReturn(new ExtractionOutcome.Failed("All extraction engines failed", List.of("PDFBOX_TEXT: boom")));

        PipelineResult result = pipeline(null, null).process(DOCUMENT, PipelineConfig.defaults());

        assertThat(result.overallSuccess()).isFalse();
        assertThat(result.errors()).containsExactly("Extraction failed: All extraction engines failed (PDFBOX_TEXT: boom)");
        assertThat(result.profile()).isNull();
        assertThat(result.confidenceScore()).isZero();
        for (PipelineStage stage : List.of(PipelineStage.PARSING, PipelineStage.ENHANCEMENT,
                PipelineStage.MATCHING, PipelineStage.VALIDATION)) {
            StageResult stageResult = result.stageResult(stage);
            assertThat(stageResult.status()).isEqualTo(StageStatus.SKIPPED);
            assertThat(stageResult.warnings()).containsExactly("Skipped after a critical stage failed");
        }
    }

    @Test
    void emptyDocumentFailsWithoutThrowing() {
        ExtractionService realExtraction = new ExtractionService(List.of(),
                EngineCapabilities.of(EnumSet.noneOf(ExtractionMethod.class)), new MethodSelector(properties),
                new ConfidenceScorer(properties), new TextNormalizer());

        PipelineResult result = pipeline(realExtraction, null, null)
                .process(Document.ofBytes("empty.pdf", new byte[0]), PipelineConfig.defaults());

        assertThat(result.overallSuccess()).isFalse();
        assertThat(result.errors()).containsExactly("Extraction failed: Document is empty");
    }

    @Test
    void missingFileFailsExtractionStage() {
        PipelineResult result = pipeline(null, null)
                .process(Path.of("does-not-exist", "resume.pdf"), PipelineConfig.defaults());

        assertThat(result.overallSuccess()).isFalse();
        assertThat(result.stageResult(PipelineStage.EXTRACTION).status()).isEqualTo(StageStatus.FAILED);
        assertThat(result.errors()).singleElement().asString().startsWith("Extraction failed: ");
    }

    @Test
    void parsingFailureIsCritical() {
        extractionReturns("   ", 0.0);

        PipelineResult result = pipeline(null, null).process(DOCUMENT, PipelineConfig.defaults());

        assertThat(result.overallSuccess()).isFalse();
        assertThat(result.extraction()).isNotNull();
        assertThat(result.errors()).singleElement().asString().startsWith("Parsing failed: ");
        assertThat(result.stageResult(PipelineStage.VALIDATION).status()).isEqualTo(StageStatus.SKIPPED);
    }

    @Test
    void optionalStageFailureBecomesWarning() {
        extractionReturns(ResumeFixtures.SAMPLE_RESUME, 0.9);
        ProfileEnhancementService enhancement = mock(ProfileEnhancementService.class);
        given(enhancement.enhance(any(CandidateProfile.class), any())).willThrow(new EnhancementException("model offline"));

        PipelineResult result = pipeline(enhancement, null)
                .process(DOCUMENT, PipelineConfig.defaults().withEnhancement(true));

        assertThat(result.overallSuccess()).isTrue();
        assertThat(result.stageResult(PipelineStage.ENHANCEMENT).status()).isEqualTo(StageStatus.FAILED);
        assertThat(result.warnings()).contains("Enhancement failed, proceeding without enhancement: model offline");
        assertThat(result.enhancement()).isNull();
    }

    @Test
    void matchingFailureBecomesWarning() {
        extractionReturns(ResumeFixtures.SAMPLE_RESUME, 0.9);
        JobMatchingService matching = mock(JobMatchingService.class);
        given(matching.match(any(CandidateProfile.class), anyString())).willThrow(new MatchingException("index unavailable"));

        PipelineResult result = pipeline(null, matching)
                .process(DOCUMENT, PipelineConfig.defaults().withTargetJobDescription("Java engineer"));

        assertThat(result.overallSuccess()).isTrue();
        assertThat(result.stageResult(PipelineStage.MATCHING).status()).isEqualTo(StageStatus.FAILED);
        assertThat(result.warnings()).contains("Job matching failed, proceeding without match: index unavailable");
        assertThat(result.jobMatch()).isNull();
    }

    @Test
    void collaboratorsRunWithTargetJob() {
        extractionReturns(ResumeFixtures.SAMPLE_RESUME, 0.9);
        ProfileEnhancementService enhancement = mock(ProfileEnhancementService.class);
        JobMatchingService matching = mock(JobMatchingService.class);
        EnhancementReport report = new EnhancementReport(0.8, List.of("Java"), List.of(), List.of(), 0.9, "Senior", List.of());
        JobMatchReport match = new JobMatchReport(0.7, 0.6, 0.5, List.of("Java"), List.of("Go"));
        given(enhancement.enhance(any(CandidateProfile.class), anyString())).willReturn(report);
        given(matching.match(any(CandidateProfile.class), anyString())).willReturn(match);

        PipelineResult result = pipeline(enhancement, matching).process(DOCUMENT,
                PipelineConfig.defaults().withEnhancement(true).withTargetJobDescription("Senior Java engineer"));

        assertThat(result.enhancement()).isEqualTo(report);
        assertThat(result.jobMatch()).isEqualTo(match);
        assertThat(result.stageResult(PipelineStage.MATCHING).status()).isEqualTo(StageStatus.COMPLETED);
    }

    @Test
    void matchingWithoutServiceIsSkipped() {
        extractionReturns(ResumeFixtures.SAMPLE_RESUME, 0.9);

        PipelineResult result = pipeline(null, null).process(DOCUMENT,
                PipelineConfig.defaults().withEnhancement(true).withTargetJobDescription("Senior Java engineer"));

        assertThat(result.stageResult(PipelineStage.ENHANCEMENT).warnings()).containsExactly("No enhancement service configured");
        assertThat(result.stageResult(PipelineStage.MATCHING).warnings()).containsExactly("No job matching service configured");
    }

    @Test
    void slowStageTimesOut() {
        extractionReturns(ResumeFixtures.SAMPLE_RESUME, 0.9);
        ProfileEnhancementService slow = (profile, job) -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return new EnhancementReport(1.0, List.of(), List.of(), List.of(), 1.0, "", List.of());
        };

        PipelineResult result = pipeline(slow, null).process(DOCUMENT,
                PipelineConfig.defaults().withEnhancement(true).withStageTimeout(Duration.ofMillis(200)));

        assertThat(result.overallSuccess()).isTrue();
        assertThat(result.stageResult(PipelineStage.ENHANCEMENT).status()).isEqualTo(StageStatus.FAILED);
        assertThat(result.warnings())
                .contains("Enhancement failed, proceeding without enhancement: Enhancement stage timed out after 200 ms");
    }

    @Test
    void matchingEnabledWithoutJobTextIsSkipped() {
        extractionReturns(ResumeFixtures.SAMPLE_RESUME, 0.9);
        PipelineConfig matchingOn = new PipelineConfig(ExtractionConfig.defaults(), false, true, null, true, 0.3, null);

        PipelineResult result = pipeline(null, mock(JobMatchingService.class)).process(DOCUMENT, matchingOn);

        assertThat(result.stageResult(PipelineStage.MATCHING).status()).isEqualTo(StageStatus.SKIPPED);
        assertThat(result.stageResult(PipelineStage.MATCHING).warnings()).containsExactly("No target job description");
    }

    @Test
    void linkageErrorFailsStageInsteadOfEscaping() {
        given(extractionService.extract(any(Document.class), any(ExtractionConfig.class), any(BooleanSupplier.class)))
                .willThrow(new UnsatisfiedLinkError("Unable to load library 'tesseract'"));

        PipelineResult direct = pipeline(null, null).process(DOCUMENT, PipelineConfig.defaults());
        PipelineResult timed = pipeline(null, null).process(DOCUMENT,
                PipelineConfig.defaults().withStageTimeout(Duration.ofSeconds(5)));

        for (PipelineResult result : List.of(direct, timed)) {
            assertThat(result.overallSuccess()).isFalse();
            assertThat(result.stageResult(PipelineStage.EXTRACTION).status()).isEqualTo(StageStatus.FAILED);
            assertThat(result.errors()).containsExactly("Extraction failed: Unable to load library 'tesseract'");
            assertThat(result.stageResult(PipelineStage.PARSING).status()).isEqualTo(StageStatus.SKIPPED);
        }
    }

    @Test
    void fastDocumentSucceedsAfterEarlierRunsTimedOut() {
        Document slowDocument = Document.ofBytes("slow.pdf", "%PDF-1.4 slow".getBytes(StandardCharsets.UTF_8));
        ExtractionResult extraction = new ExtractionResult(ResumeFixtures.SAMPLE_RESUME, ExtractionMethod.PDFBOX_TEXT,
                0.9, 1, 1, List.of(), Duration.ofMillis(5), null);
        given(extractionService.extract(any(Document.class), any(ExtractionConfig.class), any(BooleanSupplier.class)))
                .willAnswer(invocation -> {
                    Document document = invocation.getArgument(0);
                    if (document.fileName().equals("slow.pdf")) {
                        // ignores interruption, like a parser stuck inside one page
                        long end = System.nanoTime() + Duration.ofMillis(2_500).toNanos();
                        while (System.nanoTime() < end) {
                            Thread.onSpinWait();
                        }
                    }
                    return new ExtractionOutcome.Extracted(extraction, List.of());
                });
        properties.getBatch().setConcurrency(1);
        AsyncTaskExecutor configuredExecutor = new PipelineConfiguration().pipelineStageExecutor(properties);
        try {
            ResumeProcessingPipeline pipeline = new ResumeProcessingPipeline(new DocumentLoader(), extractionService,
                    ResumeParser.withDefaults(),
                    new StaticListableBeanFactory().getBeanProvider(ProfileEnhancementService.class),
                    new StaticListableBeanFactory().getBeanProvider(JobMatchingService.class),
                    new ResultValidator(), new PipelineScoring(properties), List.of(), configuredExecutor);
            PipelineConfig timed = PipelineConfig.defaults().withStageTimeout(Duration.ofMillis(500));

            PipelineResult firstSlow = pipeline.process(slowDocument, timed);
            PipelineResult secondSlow = pipeline.process(slowDocument, timed);
            PipelineResult fast = pipeline.process(DOCUMENT, timed);

            assertThat(firstSlow.errors()).containsExactly("Extraction failed: Extraction stage timed out after 500 ms");
            assertThat(secondSlow.overallSuccess()).isFalse();
            assertThat(fast.overallSuccess()).isTrue();
            assertThat(fast.errors()).isEmpty();
        } finally {
            ((ThreadPoolTaskExecutor) configuredExecutor).shutdown();
        }
    }

    @Test
    void cancellationBeforeStartAbortsRun() {
        extractionReturns(ResumeFixtures.SAMPLE_RESUME, 0.9);
        PipelineCancellation cancellation = PipelineCancellation.none();
        cancellation.cancel();

        PipelineResult result = pipeline(null, null).process(DOCUMENT, PipelineConfig.defaults(), cancellation);

        assertThat(result.overallSuccess()).isFalse();
        assertThat(result.errors()).containsExactly("Pipeline cancelled before Extraction stage");
        assertThat(result.stageResults().values()).allSatisfy(stage -> {
            assertThat(stage.status()).isEqualTo(StageStatus.SKIPPED);
            assertThat(stage.warnings()).containsExactly("Cancelled");
        });
    }

    @Test
    void cancellationAfterParsingKeepsProfile() {
        extractionReturns(ResumeFixtures.SAMPLE_RESUME, 0.9);
        PipelineCancellation cancellation = PipelineCancellation.none();
        StageListener cancelAfterParsing = (processingId, stage, status) -> {
            if (stage == PipelineStage.PARSING && status == StageStatus.COMPLETED) {
                cancellation.cancel();
            }
        };

        PipelineResult result = pipeline(extractionService, null, null, cancelAfterParsing)
                .process(DOCUMENT, PipelineConfig.defaults(), cancellation);

        assertThat(result.overallSuccess()).isTrue();
        assertThat(result.profile()).isNotNull();
        assertThat(result.warnings()).containsExactly("Pipeline cancelled before Enhancement stage");
        assertThat(result.stageResult(PipelineStage.VALIDATION).status()).isEqualTo(StageStatus.SKIPPED);
    }

    @Test
    void listenersObserveTransitionsAndFailuresAreIsolated() {
        extractionReturns(ResumeFixtures.SAMPLE_RESUME, 0.9);
        StageListener broken = (processingId, stage, status) -> {
            throw new IllegalStateException("listener bug");
        };

        PipelineResult result = pipeline(extractionService, null, null, broken).process(DOCUMENT, PipelineConfig.defaults());

        assertThat(result.overallSuccess()).isTrue();
        assertThat(transitions).containsSubsequence(
                "EXTRACTION:PENDING", "VALIDATION:PENDING",
                "EXTRACTION:IN_PROGRESS", "EXTRACTION:COMPLETED",
                "PARSING:IN_PROGRESS", "PARSING:COMPLETED",
                "ENHANCEMENT:SKIPPED", "MATCHING:SKIPPED",
                "VALIDATION:IN_PROGRESS", "VALIDATION:COMPLETED");
        assertThat(finishedRuns.get()).isEqualTo(1);
    }

    private void extractionReturns(String text, double confidence) {
        ExtractionResult extraction = new ExtractionResult(text, ExtractionMethod.PDFBOX_TEXT, confidence, 1, 1,
                List.of(), Duration.ofMillis(5), null);
        given(extractionService.extract(any(Document.class), any(ExtractionConfig.class), any(BooleanSupplier.class)))
                .willReturn(new ExtractionOutcome.Extracted(extraction, List.of()));
    }

    private ResumeProcessingPipeline pipeline(ProfileEnhancementService enhancement, JobMatchingService matching) {
        return pipeline(extractionService, enhancement, matching);
    }

    private ResumeProcessingPipeline pipeline(ExtractionService extraction, ProfileEnhancementService enhancement,
                                              JobMatchingService matching, StageListener... extraListeners) {
        StaticListableBeanFactory beans = new StaticListableBeanFactory();
        if (enhancement != null) {
            beans.addBean("profileEnhancementService", enhancement);
        }
        if (matching != null) {
            beans.addBean("jobMatchingService", matching);
        }
        List<StageListener> listeners = new ArrayList<>();
        listeners.add(new StageListener() {
            @Override
            public void onStageStatus(String processingId, PipelineStage stage, StageStatus status) {
                transitions.add(stage + ":" + status);
            }

            @Override
            public void onPipelineFinished(PipelineResult result) {
                finishedRuns.incrementAndGet();
            }
        });
        listeners.addAll(List.of(extraListeners));
        return new ResumeProcessingPipeline(
                new DocumentLoader(),
                extraction,
                ResumeParser.withDefaults(),
                beans.getBeanProvider(ProfileEnhancementService.class),
                beans.getBeanProvider(JobMatchingService.class),
                new ResultValidator(),
                new PipelineScoring(properties),
                listeners,
                stageExecutor);
    }
}
