package com.example.resumeparser.application.service.pipeline;

import com.example.resumeparser.config.ResumePipelineProperties;
import com.example.resumeparser.domain.model.CandidateProfile;
import com.example.resumeparser.domain.model.ContactInfo;
import com.example.resumeparser.domain.model.EnhancementReport;
import com.example.resumeparser.domain.model.ExtractionResult;
import com.example.resumeparser.domain.model.SectionType;

import org.springframework.stereotype.Component;

/**
 * Folds stage outputs into the run-level confidence, quality and completeness scores.
 * Every score is 0 when no profile was produced.
 */
@Component
public class PipelineScoring {

    private final ResumePipelineProperties.Aggregation weights;

    public PipelineScoring(ResumePipelineProperties properties) {
        this.weights = properties.getAggregation();
    }

    public double confidence(ExtractionResult extraction, CandidateProfile profile, EnhancementReport enhancement) {
        if (profile == null) {
            return 0.0;
        }
        double extractionConfidence = extraction != null ? extraction.confidence() : 0.0;
        double score = weights.getExtractionWeight() * extractionConfidence
                + weights.getParsingWeight() * profile.parsingConfidence();
        score += enhancement != null
                ? weights.getEnhancementWeight() * enhancement.overallScore()
                : weights.getMissingEnhancementBase();
        return clamp(score);
    }

    public double quality(CandidateProfile profile) {
        if (profile == null) {
            return 0.0;
        }
        ContactInfo contact = profile.contactInfo();
        double score = weights.getQualityContactWeight() * contact.coreCompleteness();
        if (!profile.workExperience().isEmpty()) {
            score += weights.getQualityExperienceWeight();
        }
        if (!profile.education().isEmpty()) {
            score += weights.getQualityEducationWeight();
        }
        if (!profile.skills().isEmpty()) {
            score += weights.getQualitySkillsWeight();
        }
        if (profile.hasSummary()) {
            score += weights.getQualitySummaryWeight();
        }
        return clamp(score);
    }

    public double completeness(CandidateProfile profile) {
        if (profile == null) {
            return 0.0;
        }
        return clamp((double) profile.sectionsFound().size() / SectionType.canonicalCount());
    }

    private static double clamp(double value) {
        return Math.min(Math.max(value, 0.0), 1.0);
    }
}
