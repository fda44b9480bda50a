package com.example.resumeparser.application.service.parsing;

import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * Joins the prose lines of the summary section into one paragraph. Bullets and short fragments are
 * left out.
 */
@Component
public class SummaryExtractor {

    static final int MIN_LINE_LENGTH = 21;

    public String extract(String section) {
        return ResumeText.lines(section).stream()
                .filter(line -> !ResumeText.isBulleted(line))
                .filter(line -> line.length() >= MIN_LINE_LENGTH)
                .collect(Collectors.joining(" "));
    }
}
