package com.example.resumeparser.application.service.extraction;

import com.example.resumeparser.config.ResumePipelineProperties;
import com.example.resumeparser.domain.model.ExtractionMethod;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Heuristic reliability score of extracted text. All weights come from
 * {@link ResumePipelineProperties.Scoring}.
 */
@Component
public class ConfidenceScorer {

    private final ResumePipelineProperties.Scoring scoring;

    public ConfidenceScorer(ResumePipelineProperties properties) {
        this.scoring = properties.getScoring();
    }

    /**
     * Scores text produced by {@code method}.
     *
     * @return a value in [0, 1]; empty text always scores 0
     */
    public double score(String text, ExtractionMethod method) {
        if (text == null || text.isBlank()) {
            return 0.0;
        }
        double confidence = scoring.reliabilityOf(method);

        String stripped = text.strip();
        if (stripped.length() > scoring.getShortTextLength()) {
            confidence += scoring.getLengthBonus();
        }
        if (stripped.length() > scoring.getLongTextLength()) {
            confidence += scoring.getLengthBonus();
        }

        String lower = text.toLowerCase(Locale.ROOT);
        List<String> keywords = scoring.getKeywords() == null ? List.of() : scoring.getKeywords();
        long hits = keywords.stream()
                .filter(keyword -> lower.contains(keyword.toLowerCase(Locale.ROOT)))
                .count();
        confidence += Math.min(hits * scoring.getKeywordIncrement(), scoring.getKeywordBonusCap());

        double ratio = specialCharacterRatio(text);
        if (ratio > scoring.getSpecialCharThreshold()) {
            confidence -= (ratio - scoring.getSpecialCharThreshold()) * scoring.getSpecialCharPenaltyFactor();
        }
        return Math.min(Math.max(confidence, 0.0), 1.0);
    }

    /**
     * Fraction of characters that are neither letters, digits nor whitespace.
     */
    public static double specialCharacterRatio(String text) {
        if (text == null || text.isEmpty()) {
            return 0.0;
        }
        int special = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!Character.isLetterOrDigit(c) && !Character.isWhitespace(c)) {
                special++;
            }
        }
        return (double) special / text.length();
    }
}
