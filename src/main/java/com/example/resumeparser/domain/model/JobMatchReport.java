package com.example.resumeparser.domain.model;

import java.util.List;

/**
 * Fit of a candidate profile against one job description, as reported by a matching collaborator.
 */
public record JobMatchReport(
        double overallMatch,
        double skillMatch,
        double keywordMatch,
        List<String> matchedSkills,
        List<String> missingSkills
) {

    public JobMatchReport {
        overallMatch = Math.min(Math.max(overallMatch, 0.0), 1.0);
        skillMatch = Math.min(Math.max(skillMatch, 0.0), 1.0);
        keywordMatch = Math.min(Math.max(keywordMatch, 0.0), 1.0);
        matchedSkills = matchedSkills == null ? List.of() : List.copyOf(matchedSkills);
        missingSkills = missingSkills == null ? List.of() : List.copyOf(missingSkills);
    }
}
