package com.example.resumeparser.application.service.parsing;

import com.example.resumeparser.domain.model.WorkExperience;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the experience section into {@link WorkExperience} entries, one per blank-line separated
 * block.
 * <p>
 * The first line of a block is the header. Its delimiter decides the reading:
 * {@code Position at Company}, {@code Company - Position}, {@code Position | Company}, otherwise the
 * whole line is the company.
 */
@Component
public class WorkExperienceExtractor {

    static final int MIN_ENTRY_LENGTH = 50;
    private static final Pattern DASH_DELIMITER = Pattern.compile("\\s+[-–—]\\s+");

    public List<WorkExperience> extract(String section) {
        List<WorkExperience> experiences = new ArrayList<>();
        for (String entry : ResumeText.entries(section, MIN_ENTRY_LENGTH)) {
            parseEntry(entry).ifPresent(experiences::add);
        }
        return List.copyOf(experiences);
    }

    private Optional<WorkExperience> parseEntry(String entry) {
        List<String> lines = ResumeText.lines(entry);
        if (lines.isEmpty()) {
            return Optional.empty();
        }
        String header = ResumeText.stripBullet(lines.get(0));
        String startDate = "";
        String endDate = "";
        String location = "";
        int dateLine = -1;

        Optional<DateRange> headerRange = DateRange.find(header);
        if (headerRange.isPresent()) {
            startDate = headerRange.get().start();
            endDate = headerRange.get().end();
            header = headerRange.get().removeFrom(header);
            dateLine = 0;
        } else {
            for (int i = 1; i < lines.size(); i++) {
                if (ResumeText.isBulleted(lines.get(i))) {
                    continue;
                }
                Optional<DateRange> range = DateRange.find(lines.get(i));
                if (range.isPresent()) {
                    startDate = range.get().start();
                    endDate = range.get().end();
                    location = range.get().removeFrom(lines.get(i));
                    dateLine = i;
                    break;
                }
            }
        }

        String[] companyAndPosition = parseHeader(header);
        if (companyAndPosition[0].isEmpty() && companyAndPosition[1].isEmpty()) {
            return Optional.empty();
        }

        List<String> description = new ArrayList<>();
        for (int i = 1; i < lines.size(); i++) {
            if (i == dateLine) {
                continue;
            }
            String line = ResumeText.stripBullet(lines.get(i));
            if (!line.isEmpty()) {
                description.add(line);
            }
        }

        return Optional.of(new WorkExperience(
                companyAndPosition[0],
                companyAndPosition[1],
                location,
                startDate,
                endDate,
                description,
                TechnologyVocabulary.find(entry)
        ));
    }

    /**
     * @return {@code [company, position]}
     */
    static String[] parseHeader(String header) {
        int at = header.indexOf(" at ");
        if (at > 0) {
            return new String[]{tidy(header.substring(at + 4)), tidy(header.substring(0, at))};
        }
        Matcher dash = DASH_DELIMITER.matcher(header);
        if (dash.find()) {
            return new String[]{tidy(header.substring(0, dash.start())), tidy(header.substring(dash.end()))};
        }
        int pipe = header.indexOf('|');
        if (pipe >= 0) {
            String company = header.substring(pipe + 1);
            int nextPipe = company.indexOf('|');
            if (nextPipe >= 0) {
                company = company.substring(0, nextPipe);
            }
            return new String[]{tidy(company), tidy(header.substring(0, pipe))};
        }
        return new String[]{tidy(header), ""};
    }

    private static String tidy(String fragment) {
        return DateRange.tidy(fragment);
    }
}
