package com.example.resumeparser.application.service.parsing;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Cleans extracted text before it is segmented. Line breaks are kept because sections and entries
 * are delimited by lines and blank lines. Applying {@link #normalize(String)} twice gives the same
 * result as applying it once.
 */
@Component
public class TextNormalizer {

    private static final Pattern LINE_BREAKS = Pattern.compile("\\r\\n?|[\\u0085\\u2028\\u2029]");
    private static final Pattern CONTROL_CHARACTERS = Pattern.compile("[\\p{Cntrl}&&[^\\n\\t]]");
    private static final Pattern BULLETS = Pattern.compile("[•·▪▫◦‣⁃●○■□►▸➢➤✓✔∙]");
    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[\\t\\p{Zs}]+");
    private static final Pattern BLANK_LINE_RUNS = Pattern.compile("\\n{3,}");
    private static final String CANONICAL_BULLET = "•";

    /** Known recognition errors and their canonical spelling. */
    private static final Map<Pattern, String> OCR_CORRECTIONS = new LinkedHashMap<>();

    static {
        OCR_CORRECTIONS.put(Pattern.compile("\\bEducat10n\\b", Pattern.CASE_INSENSITIVE), "Education");
        OCR_CORRECTIONS.put(Pattern.compile("\\bExper1ence\\b", Pattern.CASE_INSENSITIVE), "Experience");
        OCR_CORRECTIONS.put(Pattern.compile("\\bSk111s\\b", Pattern.CASE_INSENSITIVE), "Skills");
        OCR_CORRECTIONS.put(Pattern.compile("\\bSk1lls\\b", Pattern.CASE_INSENSITIVE), "Skills");
        OCR_CORRECTIONS.put(Pattern.compile("\\bPr0jects\\b", Pattern.CASE_INSENSITIVE), "Projects");
        OCR_CORRECTIONS.put(Pattern.compile("\\bCertificat10ns\\b", Pattern.CASE_INSENSITIVE), "Certifications");
        OCR_CORRECTIONS.put(Pattern.compile("\\bSumm4ry\\b", Pattern.CASE_INSENSITIVE), "Summary");
        OCR_CORRECTIONS.put(Pattern.compile("\\b0f\\b"), "of");
    }

    /**
     * Normalizes text.
     *
     * @param text raw extracted text, may be {@code null}
     * @return cleaned text, never {@code null}
     */
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String result = LINE_BREAKS.matcher(text).replaceAll("\n");
        result = CONTROL_CHARACTERS.matcher(result).replaceAll("");
        for (Map.Entry<Pattern, String> correction : OCR_CORRECTIONS.entrySet()) {
            result = correction.getKey().matcher(result).replaceAll(correction.getValue());
        }
        result = BULLETS.matcher(result).replaceAll(CANONICAL_BULLET);

        StringBuilder lines = new StringBuilder(result.length());
        for (String line : result.split("\n", -1)) {
            if (lines.length() > 0) {
                lines.append('\n');
            }
            lines.append(HORIZONTAL_WHITESPACE.matcher(line).replaceAll(" ").strip());
        }
        result = BLANK_LINE_RUNS.matcher(lines).replaceAll("\n\n");
        return result.strip();
    }
}
