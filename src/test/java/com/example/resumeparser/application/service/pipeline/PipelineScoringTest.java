package com.example.resumeparser.application.service.pipeline;

import com.example.resumeparser.config.ResumePipelineProperties;
import com.example.resumeparser.domain.model.CandidateProfile;
import com.example.resumeparser.domain.model.ContactInfo;
import com.example.resumeparser.domain.model.EnhancementReport;
import com.example.resumeparser.domain.model.SectionType;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link PipelineScoring}.
 */
class PipelineScoringTest {

    private final PipelineScoring scoring = new PipelineScoring(new ResumePipelineProperties());

    @Test
    void confidenceUsesBaseWhenEnhancementIsMissing() {
        CandidateProfile profile = profile(0.5, Set.of());

        double confidence = scoring.confidence(PipelineResults.extraction("text", 0.8), profile, null);

        assertThat(confidence).isCloseTo(0.3 * 0.8 + 0.4 * 0.5 + 0.2, within(1e-9));
    }

    @Test
    void confidenceBlendsEnhancementScore() {
        EnhancementReport enhancement = new EnhancementReport(0.6, List.of(), List.of(), List.of(), 0.5, "Mid", List.of());

        double confidence = scoring.confidence(PipelineResults.extraction("text", 1.0), profile(1.0, Set.of()), enhancement);

        assertThat(confidence).isCloseTo(0.3 + 0.4 + 0.3 * 0.6, within(1e-9));
    }

    @Test
    void qualityWeighsContactAndContent() {
        ContactInfo nameAndEmail = new ContactInfo("Jane Roe", "jane@roe.dev", null, null, null, null, null, null, null, null, null);
        CandidateProfile profile = new CandidateProfile(nameAndEmail, "A summary", List.of(), List.of(),
                List.of("Java"), List.of(), List.of(), List.of(), List.of(), Set.of(), 0.5);

        assertThat(scoring.quality(profile)).isCloseTo(0.2 * 2.0 / 3.0 + 0.2 + 0.1, within(1e-9));
    }

    @Test
    void completenessIsShareOfCanonicalSections() {
        CandidateProfile profile = profile(0.5, EnumSet.of(SectionType.EXPERIENCE, SectionType.SKILLS, SectionType.EDUCATION));

        assertThat(scoring.completeness(profile)).isCloseTo(3.0 / 9.0, within(1e-9));
    }

    @Test
    void scoresAreZeroWithoutProfile() {
        assertThat(scoring.confidence(PipelineResults.extraction("text", 1.0), null, null)).isZero();
        assertThat(scoring.quality(null)).isZero();
        assertThat(scoring.completeness(null)).isZero();
    }

    private static CandidateProfile profile(double parsingConfidence, Set<SectionType> sections) {
        return new CandidateProfile(ContactInfo.empty(), "", List.of(), List.of(), List.of(), List.of(), List.of(),
                List.of(), List.of(), sections, parsingConfidence);
    }
}
