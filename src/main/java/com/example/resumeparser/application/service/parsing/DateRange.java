package com.example.resumeparser.application.service.parsing;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An employment or project period such as {@code Jan 2020 - Present} found in a line.
 * Starts are a month and year or a bare year; ends may also be {@code present}, {@code current} or
 * {@code now}. Numeric {@code MM/DD/YYYY} dates are not recognized.
 *
 * @param start      start as written
 * @param end        end as written
 * @param matchStart offset of the range in the searched text
 * @param matchEnd   offset just past the range
 */
public record DateRange(String start, String end, int matchStart, int matchEnd) {

    private static final String MONTH = "(?:Jan(?:uary)?|Feb(?:ruary)?|Mar(?:ch)?|Apr(?:il)?|May|Jun(?:e)?"
            + "|Jul(?:y)?|Aug(?:ust)?|Sep(?:t(?:ember)?)?|Oct(?:ober)?|Nov(?:ember)?|Dec(?:ember)?)\\.?";
    private static final String YEAR = "(?<![/\\d])(?:19|20)\\d{2}\\b(?!/)";
    private static final String MONTH_YEAR = "\\b" + MONTH + "\\s+" + YEAR;
    private static final Pattern RANGE = Pattern.compile(
            "(" + MONTH_YEAR + "|" + YEAR + ")"
                    + "\\s*(?:-|–|—|\\bto\\b)\\s*"
                    + "(" + MONTH_YEAR + "|" + YEAR + "|\\bpresent\\b|\\bcurrent\\b|\\bnow\\b)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern SINGLE_DATE = Pattern.compile(MONTH_YEAR + "|" + YEAR, Pattern.CASE_INSENSITIVE);
    private static final Pattern EMPTY_BRACKETS = Pattern.compile("\\(\\s*\\)|\\[\\s*]");
    private static final Pattern EDGE_SEPARATORS = Pattern.compile("^[\\s,|•–—:-]+|[\\s,|•–—:-]+$");

    /**
     * @return the first date range in {@code text}
     */
    public static Optional<DateRange> find(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        Matcher matcher = RANGE.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(new DateRange(matcher.group(1).strip(), matcher.group(2).strip(),
                matcher.start(), matcher.end()));
    }

    /**
     * @return the first month-year or year in {@code text}
     */
    public static Optional<String> findSingleDate(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        Matcher matcher = SINGLE_DATE.matcher(text);
        return matcher.find() ? Optional.of(matcher.group().strip()) : Optional.empty();
    }

    /**
     * @return {@code text} with this range cut out and dangling separators trimmed
     */
    public String removeFrom(String text) {
        String remaining = text.substring(0, matchStart) + " " + text.substring(matchEnd);
        return tidy(remaining);
    }

    /**
     * Drops empty brackets and separators left at either end of a fragment.
     */
    static String tidy(String fragment) {
        String cleaned = EMPTY_BRACKETS.matcher(fragment).replaceAll(" ");
        cleaned = cleaned.replaceAll("\\s{2,}", " ");
        return EDGE_SEPARATORS.matcher(cleaned).replaceAll("").strip();
    }
}
