package com.example.resumeparser.application.service.parsing;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Lists spoken languages from the languages section.
 */
@Component
public class LanguageExtractor {

    public List<String> extract(String section) {
        Map<String, String> languages = ResumeText.distinctIgnoringCase();
        ResumeText.addDistinctIgnoringCase(languages, ResumeText.tokens(section).stream()
                .filter(token -> token.length() > 1)
                .toList());
        return List.copyOf(languages.values());
    }
}
