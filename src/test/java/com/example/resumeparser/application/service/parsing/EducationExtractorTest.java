package com.example.resumeparser.application.service.parsing;

import com.example.resumeparser.domain.model.Education;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link EducationExtractor}.
 */
class EducationExtractorTest {

    private final EducationExtractor extractor = new EducationExtractor();

    @Test
    void extractReadsDegreeFieldInstitutionYearAndGpa() {
        List<Education> education = extractor.extract(
                "Bachelor of Science in Computer Science, University of California, Berkeley, 2016\nGPA: 3.8");

        assertThat(education).hasSize(1);
        Education entry = education.get(0);
        assertThat(entry.degree()).isEqualTo("Bachelor of Science");
        assertThat(entry.fieldOfStudy()).isEqualTo("Computer Science");
        assertThat(entry.institution()).isEqualTo("University of California");
        assertThat(entry.graduationYear()).isEqualTo("2016");
        assertThat(entry.gpa()).isEqualTo("3.8");
    }

    @Test
    void extractReadsAtForm() {
        Education entry = extractor.extract("Master of Science in Data Science at Stanford University (2019)").get(0);

        assertThat(entry.degree()).isEqualTo("Master of Science");
        assertThat(entry.fieldOfStudy()).isEqualTo("Data Science");
        assertThat(entry.institution()).isEqualTo("Stanford University");
        assertThat(entry.graduationYear()).isEqualTo("2019");
    }

    @Test
    void extractTakesInstitutionFromLineAfterBareDegree() {
        Education entry = extractor.extract("Bachelor of Arts in History\nUniversity of Toronto\n2010 - 2014").get(0);

        assertThat(entry.degree()).isEqualTo("Bachelor of Arts");
        assertThat(entry.fieldOfStudy()).isEqualTo("History");
        assertThat(entry.institution()).isEqualTo("University of Toronto");
        assertThat(entry.details()).containsExactly("2010 - 2014");
    }

    @Test
    void extractSeparatesBlankLineDelimitedEntries() {
        List<Education> education = extractor.extract(
                "Massachusetts Institute of Technology, Master of Engineering, 2012\n\nBachelor of Science, Georgia Institute of Technology, 2010");

        assertThat(education).extracting(Education::institution)
                .containsExactly("Massachusetts Institute of Technology", "Georgia Institute of Technology");
    }

    @Test
    void extractReturnsNothingForEmptySection() {
        assertThat(extractor.extract("")).isEmpty();
    }
}
