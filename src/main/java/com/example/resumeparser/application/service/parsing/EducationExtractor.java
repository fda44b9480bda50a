package com.example.resumeparser.application.service.parsing;

import com.example.resumeparser.domain.model.Education;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the education section into {@link Education} entries.
 * Headers are read as {@code <degree> in <field> at <institution>},
 * {@code <degree>[ in <field>], <institution>} or a bare institution. A bare degree line followed by
 * another line takes the institution from that line.
 */
@Component
public class EducationExtractor {

    static final int MIN_ENTRY_LENGTH = 20;
    private static final Pattern YEAR = Pattern.compile("\\b(19|20)\\d{2}\\b");
    private static final Pattern HEADER_YEAR = Pattern.compile("\\(?(?<![/\\d])(?:19|20)\\d{2}(?!\\d)\\)?");
    private static final Pattern GPA = Pattern.compile("GPA[:\\s]*([0-9]+(?:\\.[0-9]+)?)", Pattern.CASE_INSENSITIVE);
    private static final Pattern GPA_CLAUSE = Pattern.compile("GPA[:\\s]*[0-9]+(?:\\.[0-9]+)?(?:\\s*/\\s*[0-9.]+)?",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern DEGREE = Pattern.compile(
            "^(?:Bachelor|Master|Doctor|Associate|Diploma|MBA|B\\.?\\s?S\\.?c?|M\\.?\\s?S\\.?c?|B\\.?\\s?A\\.?"
                    + "|M\\.?\\s?A\\.?|Ph\\.?\\s?D\\.?|B\\.?\\s?Eng|M\\.?\\s?Eng|B\\.?\\s?Tech|M\\.?\\s?Tech)(?![A-Za-z])",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern INSTITUTION = Pattern.compile(
            "\\b(?:University|College|Institute|School|Academy|Polytechnic)\\b", Pattern.CASE_INSENSITIVE);

    public List<Education> extract(String section) {
        List<Education> education = new ArrayList<>();
        for (String entry : ResumeText.entries(section, MIN_ENTRY_LENGTH)) {
            Education parsed = parseEntry(entry);
            if (!parsed.institution().isEmpty() || !parsed.degree().isEmpty()) {
                education.add(parsed);
            }
        }
        return List.copyOf(education);
    }

    private Education parseEntry(String entry) {
        List<String> lines = ResumeText.lines(entry);
        String header = cleanHeader(ResumeText.stripBullet(lines.get(0)));
        String institution = "";
        String degreePart = "";
        int consumed = 1;

        int at = header.indexOf(" at ");
        int comma = header.indexOf(',');
        if (at > 0) {
            degreePart = header.substring(0, at);
            institution = header.substring(at + 4);
        } else if (comma > 0) {
            String first = header.substring(0, comma);
            String rest = header.substring(comma + 1);
            if (!looksLikeDegree(first) && INSTITUTION.matcher(first).find()) {
                institution = first;
                degreePart = looksLikeDegree(rest.strip()) ? rest : "";
            } else {
                degreePart = first;
                int nextComma = rest.indexOf(',');
                institution = nextComma >= 0 ? rest.substring(0, nextComma) : rest;
            }
        } else if (looksLikeDegree(header) && lines.size() > 1 && !GPA.matcher(lines.get(1)).find()
                && !ResumeText.isBulleted(lines.get(1))) {
            degreePart = header;
            institution = cleanHeader(lines.get(1));
            consumed = 2;
        } else {
            institution = header;
        }

        String degree = degreePart;
        String field = "";
        int in = degreePart.indexOf(" in ");
        if (in > 0) {
            degree = degreePart.substring(0, in);
            field = degreePart.substring(in + 4);
        }

        Matcher year = YEAR.matcher(entry);
        Matcher gpa = GPA.matcher(entry);
        List<String> details = new ArrayList<>();
        for (int i = consumed; i < lines.size(); i++) {
            String line = ResumeText.stripBullet(lines.get(i));
            if (!line.isEmpty()) {
                details.add(line);
            }
        }
        return new Education(
                DateRange.tidy(institution),
                DateRange.tidy(degree),
                DateRange.tidy(field),
                year.find() ? year.group() : "",
                gpa.find() ? gpa.group(1) : "",
                details
        );
    }

    private static boolean looksLikeDegree(String text) {
        return DEGREE.matcher(text.strip()).find();
    }

    private static String cleanHeader(String header) {
        String cleaned = DateRange.find(header).map(range -> range.removeFrom(header)).orElse(header);
        cleaned = GPA_CLAUSE.matcher(cleaned).replaceAll(" ");
        cleaned = HEADER_YEAR.matcher(cleaned).replaceAll(" ");
        return DateRange.tidy(cleaned);
    }
}
