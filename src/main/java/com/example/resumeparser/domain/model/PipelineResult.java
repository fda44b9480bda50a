package com.example.resumeparser.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Complete, immutable outcome of one pipeline run.
 * {@code overallSuccess} is {@code true} iff both critical stages (extraction and parsing) succeeded.
 */
public record PipelineResult(
        String inputRef,
        String processingId,
        Instant startedAt,
        Duration totalTime,
        Map<PipelineStage, StageResult> stageResults,
        ExtractionResult extraction,
        CandidateProfile profile,
        EnhancementReport enhancement,
        JobMatchReport jobMatch,
        boolean overallSuccess,
        double confidenceScore,
        double qualityScore,
        double completenessScore,
        List<String> errors,
        List<String> warnings
) {

    public PipelineResult {
        stageResults = stageResults == null || stageResults.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(stageResults));
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        totalTime = totalTime == null ? Duration.ZERO : totalTime;
        confidenceScore = clamp(confidenceScore);
        qualityScore = clamp(qualityScore);
        completenessScore = clamp(completenessScore);
    }

    public StageResult stageResult(PipelineStage stage) {
        return stageResults.get(stage);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.min(Math.max(value, 0.0), 1.0);
    }
}
