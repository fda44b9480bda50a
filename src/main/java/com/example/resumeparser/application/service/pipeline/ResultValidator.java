package com.example.resumeparser.application.service.pipeline;

import com.example.resumeparser.domain.model.CandidateProfile;
import com.example.resumeparser.domain.model.ExtractionResult;
import com.example.resumeparser.domain.model.PipelineResult;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Soft checks over a finished run. Produces warnings only and never fails the pipeline.
 */
@Component
public class ResultValidator {

    static final double MIN_EXTRACTION_CONFIDENCE = 0.5;
    static final int MIN_TEXT_LENGTH = 100;

    public List<String> validate(PipelineResult result, double minParsingConfidence) {
        List<String> warnings = new ArrayList<>();
        ExtractionResult extraction = result.extraction();
        if (extraction != null) {
            if (extraction.confidence() < MIN_EXTRACTION_CONFIDENCE) {
                warnings.add(String.format(Locale.ROOT, "Low PDF extraction confidence (%.2f)", extraction.confidence()));
            }
            if (extraction.textLength() < MIN_TEXT_LENGTH) {
                warnings.add("Very little text extracted (" + extraction.textLength() + " characters)");
            }
        }
        CandidateProfile profile = result.profile();
        if (profile != null) {
            if (profile.parsingConfidence() < minParsingConfidence) {
                warnings.add(String.format(Locale.ROOT, "Low parsing confidence (%.2f < %.2f)",
                        profile.parsingConfidence(), minParsingConfidence));
            }
            if (!profile.contactInfo().hasEmail()) {
                warnings.add("No email found in resume");
            }
            if (profile.workExperience().isEmpty()) {
                warnings.add("No work experience found");
            }
        }
        return warnings;
    }
}
