package com.example.resumeparser.domain.model;

import java.time.Duration;

/**
 * Per-run pipeline options, derived from the bound application properties and optionally
 * overridden per request.
 *
 * @param extraction           options handed to the extraction stage
 * @param enhancementEnabled   whether the enhancement stage runs (when a collaborator exists)
 * @param matchingEnabled      whether the matching stage runs (when a collaborator and job text exist)
 * @param targetJobDescription job text for enhancement and matching, may be {@code null}
 * @param validationEnabled    whether the validation stage runs
 * @param minParsingConfidence parsing confidence below which validation warns
 * @param stageTimeout         per-stage time limit, {@code null} for none
 */
public record PipelineConfig(
        ExtractionConfig extraction,
        boolean enhancementEnabled,
        boolean matchingEnabled,
        String targetJobDescription,
        boolean validationEnabled,
        double minParsingConfidence,
        Duration stageTimeout
) {

    public PipelineConfig {
        extraction = extraction == null ? ExtractionConfig.defaults() : extraction;
        if (stageTimeout != null && (stageTimeout.isZero() || stageTimeout.isNegative())) {
            stageTimeout = null;
        }
    }

    public static PipelineConfig defaults() {
        return new PipelineConfig(ExtractionConfig.defaults(), false, false, null, true, 0.3, null);
    }

    public boolean hasTargetJob() {
        return targetJobDescription != null && !targetJobDescription.isBlank();
    }

    /**
     * Sets the job text and turns matching on when the text is present.
     */
    public PipelineConfig withTargetJobDescription(String jobDescription) {
        boolean matching = matchingEnabled || (jobDescription != null && !jobDescription.isBlank());
        return new PipelineConfig(extraction, enhancementEnabled, matching, jobDescription,
                validationEnabled, minParsingConfidence, stageTimeout);
    }

    public PipelineConfig withEnhancement(boolean enabled) {
        return new PipelineConfig(extraction, enabled, matchingEnabled, targetJobDescription,
                validationEnabled, minParsingConfidence, stageTimeout);
    }

    public PipelineConfig withExtraction(ExtractionConfig extractionConfig) {
        return new PipelineConfig(extractionConfig, enhancementEnabled, matchingEnabled, targetJobDescription,
                validationEnabled, minParsingConfidence, stageTimeout);
    }

    public PipelineConfig withStageTimeout(Duration timeout) {
        return new PipelineConfig(extraction, enhancementEnabled, matchingEnabled, targetJobDescription,
                validationEnabled, minParsingConfidence, timeout);
    }
}
