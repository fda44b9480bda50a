package com.example.resumeparser.domain.model;

import java.util.List;

/**
 * Results of a batch run in input order, with their summary.
 */
public record BatchReport(List<PipelineResult> results, BatchSummary summary) {

    public BatchReport {
        results = results == null ? List.of() : List.copyOf(results);
        summary = summary == null ? BatchSummary.of(results) : summary;
    }
}
