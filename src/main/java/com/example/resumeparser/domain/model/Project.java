package com.example.resumeparser.domain.model;

import java.util.List;

/**
 * A project listed on the résumé.
 */
public record Project(
        String name,
        List<String> description,
        List<String> technologies,
        String url,
        String startDate,
        String endDate
) {

    public Project {
        name = name == null ? "" : name;
        description = description == null ? List.of() : List.copyOf(description);
        technologies = technologies == null ? List.of() : List.copyOf(technologies);
        url = url == null ? "" : url;
        startDate = startDate == null ? "" : startDate;
        endDate = endDate == null ? "" : endDate;
    }
}
