package com.example.resumeparser.application.service.parsing;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Collects skills from the skills section, united with known technologies. Without a skills
 * section, only technologies found anywhere in the document are reported.
 */
@Component
public class SkillExtractor {

    static final int MIN_LENGTH = 2;
    static final int MAX_LENGTH = 49;
    private static final Pattern LABEL_PREFIX = Pattern.compile("^[^:]{1,30}:\\s*");

    /**
     * @param section  skills section content, may be {@code null} or blank
     * @param fullText whole document, scanned when there is no skills section
     */
    public List<String> extract(String section, String fullText) {
        Map<String, String> skills = ResumeText.distinctIgnoringCase();
        if (section == null || section.isBlank()) {
            ResumeText.addDistinctIgnoringCase(skills, TechnologyVocabulary.find(fullText));
            return List.copyOf(skills.values());
        }
        List<String> candidates = new ArrayList<>();
        for (String token : ResumeText.tokens(section)) {
            String skill = LABEL_PREFIX.matcher(token).replaceFirst("").strip();
            if (skill.length() >= MIN_LENGTH && skill.length() <= MAX_LENGTH && !skill.endsWith(":")) {
                candidates.add(skill);
            }
        }
        ResumeText.addDistinctIgnoringCase(skills, candidates);
        ResumeText.addDistinctIgnoringCase(skills, TechnologyVocabulary.find(section));
        return List.copyOf(skills.values());
    }
}
