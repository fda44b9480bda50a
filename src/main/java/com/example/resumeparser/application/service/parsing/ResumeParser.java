package com.example.resumeparser.application.service.parsing;

import com.example.resumeparser.config.ResumePipelineProperties;
import com.example.resumeparser.domain.exception.ParsingException;
import com.example.resumeparser.domain.model.CandidateProfile;
import com.example.resumeparser.domain.model.ContactInfo;
import com.example.resumeparser.domain.model.SectionSpan;
import com.example.resumeparser.domain.model.SectionType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Application service that turns extracted text into a {@link CandidateProfile}.
 * It normalizes the text, splits it into sections and runs the field extractor of each section.
 */
@Service
public class ResumeParser {

    private static final Logger log = LoggerFactory.getLogger(ResumeParser.class);

    private final TextNormalizer normalizer;
    private final SectionSegmenter segmenter;
    private final ContactExtractor contactExtractor;
    private final SummaryExtractor summaryExtractor;
    private final WorkExperienceExtractor workExperienceExtractor;
    private final EducationExtractor educationExtractor;
    private final SkillExtractor skillExtractor;
    private final ProjectExtractor projectExtractor;
    private final CertificationExtractor certificationExtractor;
    private final LanguageExtractor languageExtractor;
    private final AchievementExtractor achievementExtractor;
    private final ResumePipelineProperties.Parsing weights;

    public ResumeParser(TextNormalizer normalizer,
                        SectionSegmenter segmenter,
                        ContactExtractor contactExtractor,
                        SummaryExtractor summaryExtractor,
                        WorkExperienceExtractor workExperienceExtractor,
                        EducationExtractor educationExtractor,
                        SkillExtractor skillExtractor,
                        ProjectExtractor projectExtractor,
                        CertificationExtractor certificationExtractor,
                        LanguageExtractor languageExtractor,
                        AchievementExtractor achievementExtractor,
                        ResumePipelineProperties properties) {
        this.normalizer = normalizer;
        this.segmenter = segmenter;
        this.contactExtractor = contactExtractor;
        this.summaryExtractor = summaryExtractor;
        this.workExperienceExtractor = workExperienceExtractor;
        this.educationExtractor = educationExtractor;
        this.skillExtractor = skillExtractor;
        this.projectExtractor = projectExtractor;
        this.certificationExtractor = certificationExtractor;
        this.languageExtractor = languageExtractor;
        this.achievementExtractor = achievementExtractor;
        this.weights = properties.getParsing();
    }

    /**
     * Creates a parser wired with default extractors and weights.
     */
    public static ResumeParser withDefaults() {
        SectionSegmenter segmenter = new SectionSegmenter();
        return new ResumeParser(
                new TextNormalizer(),
                segmenter,
                new ContactExtractor(segmenter),
                new SummaryExtractor(),
                new WorkExperienceExtractor(),
                new EducationExtractor(),
                new SkillExtractor(),
                new ProjectExtractor(),
                new CertificationExtractor(),
                new LanguageExtractor(),
                new AchievementExtractor(),
                new ResumePipelineProperties()
        );
    }

    /**
     * Parses résumé text.
     *
     * @param text                 extracted text
     * @param extractionConfidence confidence of the extraction that produced {@code text}
     * @return the structured profile
     * @throws ParsingException when the text is blank
     */
    public CandidateProfile parse(String text, double extractionConfidence) {
        if (text == null || text.isBlank()) {
            throw new ParsingException("Extracted text is empty; nothing to parse.");
        }
        String normalized = normalizer.normalize(text);
        List<SectionSpan> spans = segmenter.locate(normalized);
        Map<SectionType, String> sections = new EnumMap<>(SectionType.class);
        Set<SectionType> sectionsFound = new LinkedHashSet<>();
        for (SectionSpan span : spans) {
            sections.put(span.type(), span.content(normalized));
            sectionsFound.add(span.type());
        }
        log.debug("Located sections {}", sectionsFound);

        ContactInfo contact = contactExtractor.extract(
                sections.getOrDefault(SectionType.CONTACT, ""), segmenter.preamble(normalized), normalized);
        CandidateProfile draft = new CandidateProfile(
                contact,
                summaryExtractor.extract(sections.get(SectionType.SUMMARY)),
                workExperienceExtractor.extract(sections.get(SectionType.EXPERIENCE)),
                educationExtractor.extract(sections.get(SectionType.EDUCATION)),
                skillExtractor.extract(sections.get(SectionType.SKILLS), normalized),
                projectExtractor.extract(sections.get(SectionType.PROJECTS)),
                certificationExtractor.extract(sections.get(SectionType.CERTIFICATIONS)),
                languageExtractor.extract(sections.get(SectionType.LANGUAGES)),
                achievementExtractor.extract(sections.get(SectionType.ACHIEVEMENTS)),
                sectionsFound,
                0.0
        );
        double confidence = parsingConfidence(draft, extractionConfidence);
        return new CandidateProfile(
                draft.contactInfo(),
                draft.summary(),
                draft.workExperience(),
                draft.education(),
                draft.skills(),
                draft.projects(),
                draft.certifications(),
                draft.languages(),
                draft.achievements(),
                draft.sectionsFound(),
                confidence
        );
    }

    /**
     * Blend of extraction confidence, contact completeness, section coverage and content richness,
     * clamped to [0, 1].
     */
    double parsingConfidence(CandidateProfile profile, double extractionConfidence) {
        double richness = 0.0;
        if (!profile.workExperience().isEmpty()) {
            richness += weights.getExperienceRichness();
        }
        if (!profile.education().isEmpty()) {
            richness += weights.getEducationRichness();
        }
        if (!profile.skills().isEmpty()) {
            richness += weights.getSkillsRichness();
        }
        if (profile.hasSummary()) {
            richness += weights.getSummaryRichness();
        }
        double sectionCoverage = (double) profile.sectionsFound().size() / SectionType.canonicalCount();
        double confidence = weights.getExtractionWeight() * extractionConfidence
                + weights.getContactWeight() * profile.contactInfo().coreCompleteness()
                + weights.getSectionWeight() * sectionCoverage
                + weights.getContentWeight() * richness;
        return Math.min(Math.max(confidence, 0.0), 1.0);
    }
}
