package com.example.resumeparser.domain.model;

import java.util.List;

/**
 * One education entry.
 */
public record Education(
        String institution,
        String degree,
        String fieldOfStudy,
        String graduationYear,
        String gpa,
        List<String> details
) {

    public Education {
        institution = institution == null ? "" : institution;
        degree = degree == null ? "" : degree;
        fieldOfStudy = fieldOfStudy == null ? "" : fieldOfStudy;
        graduationYear = graduationYear == null ? "" : graduationYear;
        gpa = gpa == null ? "" : gpa;
        details = details == null ? List.of() : List.copyOf(details);
    }
}
