package com.example.resumeparser.application.port;

import com.example.resumeparser.domain.model.CandidateProfile;
import com.example.resumeparser.domain.model.JobMatchReport;
import com.example.resumeparser.infrastructure.exception.MatchingException;

/**
 * External collaborator that measures how well a profile fits a job description.
 * The matching stage runs when a bean of this type is present and a job text is given.
 */
public interface JobMatchingService {

    /**
     * @throws MatchingException when the collaborator fails
     */
    JobMatchReport match(CandidateProfile profile, String jobText);
}
