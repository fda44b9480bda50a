package com.example.resumeparser.application.service.parsing;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Lists achievements: every bulleted line, plus plain lines long enough to be a statement.
 */
@Component
public class AchievementExtractor {

    static final int MIN_PLAIN_LINE_LENGTH = 11;

    public List<String> extract(String section) {
        List<String> achievements = new ArrayList<>();
        for (String line : ResumeText.lines(section)) {
            if (ResumeText.isBulleted(line)) {
                String stripped = ResumeText.stripBullet(line);
                if (!stripped.isEmpty()) {
                    achievements.add(stripped);
                }
            } else if (line.length() >= MIN_PLAIN_LINE_LENGTH) {
                achievements.add(line);
            }
        }
        return List.copyOf(achievements);
    }
}
