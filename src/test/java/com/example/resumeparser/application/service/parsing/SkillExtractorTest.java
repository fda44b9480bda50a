package com.example.resumeparser.application.service.parsing;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SkillExtractor}.
 */
class SkillExtractorTest {

    private final SkillExtractor extractor = new SkillExtractor();

    @Test
    void extractSplitsLabelledListsAndDropsDuplicates() {
        List<String> skills = extractor.extract("Languages: Java, Python, SQL\nTools: Docker, Kubernetes, Git, java", "");

        assertThat(skills).containsExactly("Java", "Python", "SQL", "Docker", "Kubernetes", "Git");
    }

    @Test
    void extractSupportsBulletsAndSemicolons() {
        List<String> skills = extractor.extract("• Stakeholder management\n• Negotiation; Public speaking", "");

        assertThat(skills).containsExactly("Stakeholder management", "Negotiation", "Public speaking");
    }

    @Test
    void extractFallsBackToVocabularyWithoutSection() {
        List<String> skills = extractor.extract(null, "Built services in Go and Java on AWS with Docker.");

        assertThat(skills).containsExactly("Java", "AWS", "Docker");
    }

    @Test
    void extractDropsOverlongTokens() {
        String sentence = "Designed and operated a globally distributed event pipeline";

        assertThat(extractor.extract("Kafka\n" + sentence, "")).containsExactly("Kafka");
    }
}
