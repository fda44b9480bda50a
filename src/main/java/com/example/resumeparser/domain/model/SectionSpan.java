package com.example.resumeparser.domain.model;

/**
 * Location of one section inside normalized résumé text.
 *
 * @param type         resolved section type
 * @param headingStart offset of the heading occurrence
 * @param contentStart offset right after the heading
 * @param contentEnd   offset of the next heading occurrence, or the text length
 */
public record SectionSpan(SectionType type, int headingStart, int contentStart, int contentEnd) {

    public String content(String text) {
        return text.substring(contentStart, contentEnd).strip();
    }
}
