package com.example.resumeparser.domain.model;

import java.util.List;

/**
 * One position in the candidate's work history. Dates are kept as free text, e.g. {@code "Jan 2020"}
 * or {@code "Present"}.
 */
public record WorkExperience(
        String company,
        String position,
        String location,
        String startDate,
        String endDate,
        List<String> description,
        List<String> technologies
) {

    public WorkExperience {
        company = company == null ? "" : company;
        position = position == null ? "" : position;
        location = location == null ? "" : location;
        startDate = startDate == null ? "" : startDate;
        endDate = endDate == null ? "" : endDate;
        description = description == null ? List.of() : List.copyOf(description);
        technologies = technologies == null ? List.of() : List.copyOf(technologies);
    }
}
