package com.example.resumeparser.domain.model;

import java.util.List;

/**
 * Analysis returned by a profile enhancement collaborator.
 */
public record EnhancementReport(
        double overallScore,
        List<String> strengths,
        List<String> weaknesses,
        List<String> suggestions,
        double atsCompatibility,
        String estimatedExperienceLevel,
        List<String> suitableRoles
) {

    public EnhancementReport {
        overallScore = Math.min(Math.max(overallScore, 0.0), 1.0);
        atsCompatibility = Math.min(Math.max(atsCompatibility, 0.0), 1.0);
        strengths = strengths == null ? List.of() : List.copyOf(strengths);
        weaknesses = weaknesses == null ? List.of() : List.copyOf(weaknesses);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        suitableRoles = suitableRoles == null ? List.of() : List.copyOf(suitableRoles);
        estimatedExperienceLevel = estimatedExperienceLevel == null ? "" : estimatedExperienceLevel;
    }
}
