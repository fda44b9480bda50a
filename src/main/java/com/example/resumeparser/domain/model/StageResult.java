package com.example.resumeparser.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Outcome of one executed (or skipped) pipeline stage.
 * The payload is the stage's typed output and is not serialized; the pipeline result exposes the
 * same data through dedicated fields.
 */
public record StageResult(
        PipelineStage stage,
        StageStatus status,
        Instant startTime,
        Instant endTime,
        Duration processingTime,
        boolean success,
        String error,
        List<String> warnings,
        @JsonIgnore Object payload
) {

    public StageResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        if (processingTime == null) {
            processingTime = startTime != null && endTime != null ? Duration.between(startTime, endTime) : Duration.ZERO;
        }
    }

    public static StageResult completed(PipelineStage stage, Instant start, Instant end, Object payload) {
        return new StageResult(stage, StageStatus.COMPLETED, start, end, null, true, null, List.of(), payload);
    }

    /**
     * A completed stage whose success flag is derived from its warnings, used by validation.
     */
    public static StageResult completedWithWarnings(PipelineStage stage, Instant start, Instant end,
                                                    Object payload, List<String> warnings) {
        boolean clean = warnings == null || warnings.isEmpty();
        return new StageResult(stage, StageStatus.COMPLETED, start, end, null, clean, null, warnings, payload);
    }

    public static StageResult failed(PipelineStage stage, Instant start, Instant end, String error) {
        return new StageResult(stage, StageStatus.FAILED, start, end, null, false, error, List.of(), null);
    }

    public static StageResult skipped(PipelineStage stage, String reason) {
        return new StageResult(stage, StageStatus.SKIPPED, null, null, Duration.ZERO, false, null,
                reason == null ? List.of() : List.of(reason), null);
    }

    /**
     * Returns the payload cast to the expected type, or {@code null} when absent or of another type.
     */
    public <T> T payloadAs(Class<T> type) {
        return type.isInstance(payload) ? type.cast(payload) : null;
    }
}
