package com.example.resumeparser.application.service.parsing;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the extractors of list-like sections: languages, achievements and summary.
 */
class SectionListExtractorsTest {

    @Test
    void languagesAreSplitAndDeduplicated() {
        assertThat(new LanguageExtractor().extract("English, Spanish\n• German | english"))
                .containsExactly("English", "Spanish", "German");
    }

    @Test
    void achievementsKeepBulletsAndLongPlainLines() {
        assertThat(new AchievementExtractor().extract("- Speaker at JavaOne 2019\nDean's List\nEmployee of the Year 2020"))
                .containsExactly("Speaker at JavaOne 2019", "Dean's List", "Employee of the Year 2020");
        assertThat(new AchievementExtractor().extract("Award\n* Hackathon winner"))
                .containsExactly("Hackathon winner");
    }

    @Test
    void summaryJoinsProseLines() {
        String section = "Backend engineer with eight years of experience.\nFocused on reliable distributed systems.\n"
                + "- bullet lines are skipped\nShort line";

        assertThat(new SummaryExtractor().extract(section)).isEqualTo(
                "Backend engineer with eight years of experience. Focused on reliable distributed systems.");
    }

    @Test
    void extractorsReturnEmptyResultsForMissingSections() {
        assertThat(new LanguageExtractor().extract(null)).isEmpty();
        assertThat(new AchievementExtractor().extract(null)).isEmpty();
        assertThat(new SummaryExtractor().extract(null)).isEmpty();
    }
}
