package com.example.resumeparser.domain.model;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Canonical résumé sections and the heading variants that introduce them.
 * Variants are matched case-insensitively against a whole heading line.
 */
public enum SectionType {
    CONTACT(List.of(
            "contact", "contact information", "personal information", "contact details")),
    SUMMARY(List.of(
            "summary", "profile", "objective", "professional summary", "career objective",
            "professional profile", "about me", "career summary")),
    EXPERIENCE(List.of(
            "experience", "work experience", "professional experience", "employment",
            "employment history", "career history", "work history")),
    EDUCATION(List.of(
            "education", "academic background", "educational background", "qualifications",
            "academic qualifications")),
    SKILLS(List.of(
            "skills", "technical skills", "core competencies", "key skills", "competencies",
            "technical skills & tools", "skills & tools", "skills and tools")),
    PROJECTS(List.of(
            "projects", "key projects", "notable projects", "personal projects", "academic projects")),
    CERTIFICATIONS(List.of(
            "certifications", "certificates", "professional certifications", "licenses",
            "licenses & certifications", "credentials")),
    LANGUAGES(List.of(
            "languages", "language skills", "linguistic skills")),
    ACHIEVEMENTS(List.of(
            "achievements", "accomplishments", "awards", "honors", "honors & awards", "recognition"));

    private final List<String> headings;
    private final Pattern headingPattern;

    SectionType(List<String> headings) {
        this.headings = headings;
        String alternatives = headings.stream()
                .map(heading -> Pattern.quote(heading).replace(" ", "\\E\\s+\\Q"))
                .collect(Collectors.joining("|"));
        this.headingPattern = Pattern.compile("(?:" + alternatives + ")", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    public List<String> headings() {
        return headings;
    }

    /**
     * @return pattern matching any heading variant of this section (no anchors)
     */
    public Pattern headingPattern() {
        return headingPattern;
    }

    public static int canonicalCount() {
        return values().length;
    }
}
