package com.example.resumeparser.application.service.parsing;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Line and entry helpers shared by the field extractors.
 */
final class ResumeText {

    private static final Pattern ENTRY_BREAK = Pattern.compile("\\n\\s*\\n");
    private static final Pattern BULLET_PREFIX = Pattern.compile("^[•*-]\\s*");
    static final Pattern LIST_DELIMITERS = Pattern.compile("[•\\n,;|]|\\s+-\\s+|(?m)^-\\s*");

    private ResumeText() {
    }

    /**
     * Splits text into blank-line separated entries of at least {@code minLength} characters.
     */
    static List<String> entries(String text, int minLength) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return Arrays.stream(ENTRY_BREAK.split(text.strip()))
                .map(String::strip)
                .filter(entry -> entry.length() >= minLength)
                .toList();
    }

    /**
     * @return non-empty stripped lines
     */
    static List<String> lines(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return text.lines().map(String::strip).filter(line -> !line.isEmpty()).toList();
    }

    static boolean isBulleted(String line) {
        return BULLET_PREFIX.matcher(line).find();
    }

    static String stripBullet(String line) {
        return BULLET_PREFIX.matcher(line.strip()).replaceFirst("").strip();
    }

    /**
     * Splits a delimited list (bullets, hyphens, newlines, commas, semicolons, pipes) into tokens.
     */
    static List<String> tokens(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return Arrays.stream(LIST_DELIMITERS.split(text))
                .map(String::strip)
                .filter(token -> !token.isEmpty())
                .toList();
    }

    /**
     * Adds {@code values} to {@code target} unless an equal value ignoring case is already there.
     */
    static void addDistinctIgnoringCase(Map<String, String> target, List<String> values) {
        for (String value : values) {
            target.putIfAbsent(value.toLowerCase(Locale.ROOT), value);
        }
    }

    static Map<String, String> distinctIgnoringCase() {
        return new LinkedHashMap<>();
    }
}
