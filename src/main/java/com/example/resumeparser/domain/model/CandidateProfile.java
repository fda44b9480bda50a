package com.example.resumeparser.domain.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Structured result of parsing a résumé.
 * Collections are immutable; {@code sectionsFound} preserves document order.
 */
public record CandidateProfile(
        ContactInfo contactInfo,
        String summary,
        List<WorkExperience> workExperience,
        List<Education> education,
        List<String> skills,
        List<Project> projects,
        List<Certification> certifications,
        List<String> languages,
        List<String> achievements,
        Set<SectionType> sectionsFound,
        double parsingConfidence
) {

    public CandidateProfile {
        contactInfo = contactInfo == null ? ContactInfo.empty() : contactInfo;
        summary = summary == null ? "" : summary;
        workExperience = workExperience == null ? List.of() : List.copyOf(workExperience);
        education = education == null ? List.of() : List.copyOf(education);
        skills = skills == null ? List.of() : List.copyOf(skills);
        projects = projects == null ? List.of() : List.copyOf(projects);
        certifications = certifications == null ? List.of() : List.copyOf(certifications);
        languages = languages == null ? List.of() : List.copyOf(languages);
        achievements = achievements == null ? List.of() : List.copyOf(achievements);
        sectionsFound = sectionsFound == null || sectionsFound.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(sectionsFound));
        parsingConfidence = Math.min(Math.max(parsingConfidence, 0.0), 1.0);
    }

    public boolean hasSummary() {
        return !summary.isBlank();
    }
}
