package com.example.resumeparser.application.service.parsing;

import com.example.resumeparser.domain.model.SectionSpan;
import com.example.resumeparser.domain.model.SectionType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SectionSegmenter}.
 */
class SectionSegmenterTest {

    private final SectionSegmenter segmenter = new SectionSegmenter();

    @Test
    void locateReturnsSectionsInDocumentOrder() {
        List<SectionSpan> spans = segmenter.locate(ResumeFixtures.SAMPLE_RESUME);

        assertThat(spans).extracting(SectionSpan::type).containsExactly(
                SectionType.SUMMARY,
                SectionType.EXPERIENCE,
                SectionType.EDUCATION,
                SectionType.SKILLS,
                SectionType.PROJECTS,
                SectionType.CERTIFICATIONS,
                SectionType.LANGUAGES,
                SectionType.ACHIEVEMENTS);
        for (int i = 1; i < spans.size(); i++) {
            assertThat(spans.get(i).headingStart()).isGreaterThanOrEqualTo(spans.get(i - 1).contentEnd());
        }
    }

    @Test
    void segmentKeepsFirstOccurrenceOfRepeatedHeading() {
        String text = "Skills\nJava, SQL\n\nExperience\nEngineer at Acme\n\nSkills:\nCobol";

        Map<SectionType, String> sections = segmenter.segment(text);

        assertThat(sections.get(SectionType.SKILLS)).isEqualTo("Java, SQL");
        assertThat(sections.get(SectionType.EXPERIENCE)).isEqualTo("Engineer at Acme");
        assertThat(sections.values()).noneMatch(content -> content.contains("Cobol"));
    }

    @Test
    void headingOfMatchesVariantsCaseInsensitively() {
        assertThat(segmenter.headingOf("WORK EXPERIENCE")).contains(SectionType.EXPERIENCE);
        assertThat(segmenter.headingOf("Professional  Summary:")).contains(SectionType.SUMMARY);
        assertThat(segmenter.headingOf("Licenses & Certifications")).contains(SectionType.CERTIFICATIONS);
    }

    @Test
    void headingOfIgnoresLinesWithContent() {
        assertThat(segmenter.headingOf("Technologies: Java, Spring")).isEmpty();
        assertThat(segmenter.headingOf("Experience with distributed systems")).isEmpty();
        assertThat(segmenter.headingOf("")).isEmpty();
    }

    @Test
    void bareTechnologiesLineStaysInsideProjects() {
        String text = "Projects\nResume Parser\nTechnologies:\nJava, PDFBox\n\nSkills\nJava, SQL";

        Map<SectionType, String> sections = segmenter.segment(text);

        assertThat(segmenter.headingOf("Technologies:")).isEmpty();
        assertThat(sections.get(SectionType.PROJECTS)).isEqualTo("Resume Parser\nTechnologies:\nJava, PDFBox");
        assertThat(sections.get(SectionType.SKILLS)).isEqualTo("Java, SQL");
    }

    @Test
    void preambleIsTextBeforeFirstHeading() {
        assertThat(segmenter.preamble(ResumeFixtures.SAMPLE_RESUME))
                .startsWith("John Doe")
                .endsWith("github.com/johndoe");
        assertThat(segmenter.preamble("No headings here")).isEqualTo("No headings here");
    }

    @Test
    void locateReturnsNothingForEmptyText() {
        assertThat(segmenter.locate("")).isEmpty();
        assertThat(segmenter.segment(null)).isEmpty();
    }
}
