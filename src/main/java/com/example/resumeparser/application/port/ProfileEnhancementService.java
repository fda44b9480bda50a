package com.example.resumeparser.application.port;

import com.example.resumeparser.domain.model.CandidateProfile;
import com.example.resumeparser.domain.model.EnhancementReport;
import com.example.resumeparser.infrastructure.exception.EnhancementException;

/**
 * External collaborator that scores a parsed profile and suggests improvements.
 * No implementation ships with this application; the enhancement stage runs when a bean of this
 * type is present in the context.
 */
public interface ProfileEnhancementService {

    /**
     * @param profile       parsed profile
     * @param targetJobText job description to tailor the analysis to, may be {@code null}
     * @return the analysis
     * @throws EnhancementException when the collaborator fails
     */
    EnhancementReport enhance(CandidateProfile profile, String targetJobText);
}
