package com.example.resumeparser.application.service.parsing;

import com.example.resumeparser.domain.model.SectionSpan;
import com.example.resumeparser.domain.model.SectionType;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Splits normalized résumé text into canonical sections.
 * <p>
 * A heading is a line made only of a heading variant, optionally followed by a colon. Each section
 * runs until the next heading of any type. When a type repeats, the first occurrence is kept;
 * later duplicates still close the preceding section but their content is dropped.
 */
@Component
public class SectionSegmenter {

    /**
     * Locates the retained sections in document order.
     */
    public List<SectionSpan> locate(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<HeadingOccurrence> occurrences = findHeadings(text);
        List<SectionSpan> spans = new ArrayList<>();
        Set<SectionType> seen = EnumSet.noneOf(SectionType.class);
        for (int i = 0; i < occurrences.size(); i++) {
            HeadingOccurrence occurrence = occurrences.get(i);
            if (!seen.add(occurrence.type())) {
                continue;
            }
            int contentEnd = i + 1 < occurrences.size() ? occurrences.get(i + 1).lineStart() : text.length();
            spans.add(new SectionSpan(occurrence.type(), occurrence.lineStart(), occurrence.lineEnd(), contentEnd));
        }
        return List.copyOf(spans);
    }

    /**
     * @return section contents keyed by type, in document order
     */
    public Map<SectionType, String> segment(String text) {
        Map<SectionType, String> sections = new LinkedHashMap<>();
        for (SectionSpan span : locate(text)) {
            sections.put(span.type(), span.content(text));
        }
        return sections;
    }

    /**
     * @return the text before the first heading, or the whole text when there is none
     */
    public String preamble(String text) {
        if (text == null) {
            return "";
        }
        List<HeadingOccurrence> occurrences = findHeadings(text);
        int end = occurrences.isEmpty() ? text.length() : occurrences.get(0).lineStart();
        return text.substring(0, end).strip();
    }

    /**
     * Resolves a single line to the section it introduces.
     */
    public Optional<SectionType> headingOf(String line) {
        if (line == null) {
            return Optional.empty();
        }
        String candidate = line.strip();
        if (candidate.endsWith(":")) {
            candidate = candidate.substring(0, candidate.length() - 1).strip();
        }
        if (candidate.isEmpty()) {
            return Optional.empty();
        }
        for (SectionType type : SectionType.values()) {
            if (type.headingPattern().matcher(candidate).matches()) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    private List<HeadingOccurrence> findHeadings(String text) {
        List<HeadingOccurrence> occurrences = new ArrayList<>();
        int lineStart = 0;
        while (lineStart <= text.length()) {
            int newline = text.indexOf('\n', lineStart);
            int lineEnd = newline < 0 ? text.length() : newline;
            Optional<SectionType> type = headingOf(text.substring(lineStart, lineEnd));
            if (type.isPresent()) {
                occurrences.add(new HeadingOccurrence(type.get(), lineStart, lineEnd));
            }
            if (newline < 0) {
                break;
            }
            lineStart = newline + 1;
        }
        return occurrences;
    }

    private record HeadingOccurrence(SectionType type, int lineStart, int lineEnd) {
    }
}
