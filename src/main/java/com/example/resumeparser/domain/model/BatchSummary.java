package com.example.resumeparser.domain.model;

import java.time.Duration;
import java.util.List;

/**
 * Aggregate metrics over a batch of pipeline runs.
 */
public record BatchSummary(
        int totalProcessed,
        int successful,
        int failed,
        double successRate,
        Duration averageProcessingTime,
        double averageConfidence,
        double averageQuality
) {

    public static BatchSummary of(List<PipelineResult> results) {
        if (results == null || results.isEmpty()) {
            return new BatchSummary(0, 0, 0, 0.0, Duration.ZERO, 0.0, 0.0);
        }
        int total = results.size();
        int successful = (int) results.stream().filter(PipelineResult::overallSuccess).count();
        long totalNanos = results.stream().mapToLong(result -> result.totalTime().toNanos()).sum();
        double confidence = results.stream().mapToDouble(PipelineResult::confidenceScore).average().orElse(0.0);
        double quality = results.stream().mapToDouble(PipelineResult::qualityScore).average().orElse(0.0);
        return new BatchSummary(
                total,
                successful,
                total - successful,
                (double) successful / total,
                Duration.ofNanos(totalNanos / total),
                confidence,
                quality
        );
    }
}
