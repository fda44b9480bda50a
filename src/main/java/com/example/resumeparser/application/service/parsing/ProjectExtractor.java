package com.example.resumeparser.application.service.parsing;

import com.example.resumeparser.domain.model.Project;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the projects section into {@link Project} entries, one per blank-line separated block.
 * The first line names the project; a {@code Technologies:} line lists its stack.
 */
@Component
public class ProjectExtractor {

    static final int MIN_ENTRY_LENGTH = 30;
    private static final Pattern TECHNOLOGIES_LINE = Pattern.compile("^(?:Technologies|Tech\\s+Stack|Stack)\\s*:\\s*(.*)$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern URL = Pattern.compile("(?:https?://|www\\.)[^\\s,;|)]+", Pattern.CASE_INSENSITIVE);

    public List<Project> extract(String section) {
        List<Project> projects = new ArrayList<>();
        for (String entry : ResumeText.entries(section, MIN_ENTRY_LENGTH)) {
            parseEntry(entry).ifPresent(projects::add);
        }
        return List.copyOf(projects);
    }

    private Optional<Project> parseEntry(String entry) {
        List<String> lines = ResumeText.lines(entry);
        String name = ResumeText.stripBullet(lines.get(0));

        String startDate = "";
        String endDate = "";
        Optional<DateRange> range = DateRange.find(entry);
        if (range.isPresent()) {
            startDate = range.get().start();
            endDate = range.get().end();
            Optional<DateRange> nameRange = DateRange.find(name);
            if (nameRange.isPresent()) {
                name = nameRange.get().removeFrom(name);
            }
        }

        String url = "";
        Matcher urlMatcher = URL.matcher(entry);
        if (urlMatcher.find()) {
            url = urlMatcher.group();
            name = DateRange.tidy(name.replace(url, " "));
        }
        if (name.isEmpty()) {
            return Optional.empty();
        }

        Map<String, String> technologies = ResumeText.distinctIgnoringCase();
        List<String> description = new ArrayList<>();
        for (int i = 1; i < lines.size(); i++) {
            String line = ResumeText.stripBullet(lines.get(i));
            Matcher stack = TECHNOLOGIES_LINE.matcher(line);
            if (stack.matches()) {
                ResumeText.addDistinctIgnoringCase(technologies, ResumeText.tokens(stack.group(1)));
            } else if (!line.isEmpty()) {
                description.add(line);
            }
        }
        ResumeText.addDistinctIgnoringCase(technologies, TechnologyVocabulary.find(entry));

        return Optional.of(new Project(name, description, List.copyOf(technologies.values()), url, startDate, endDate));
    }
}
