package com.example.resumeparser.application.service.extraction;

import com.example.resumeparser.domain.model.ExtractionResult;

import java.util.List;

/**
 * Outcome of the whole extraction step for one document.
 */
public sealed interface ExtractionOutcome {

    /**
     * @param result   retained (best) result, already cleaned when requested
     * @param attempts every engine run, in the order they were tried
     */
    record Extracted(ExtractionResult result, List<EngineOutcome> attempts) implements ExtractionOutcome {
        public Extracted {
            attempts = List.copyOf(attempts);
        }
    }

    /**
     * @param message       summary of why no text could be produced
     * @param attemptErrors {@code "METHOD: error"} per failed attempt
     */
    record Failed(String message, List<String> attemptErrors) implements ExtractionOutcome {
        public Failed {
            attemptErrors = attemptErrors == null ? List.of() : List.copyOf(attemptErrors);
        }

        /**
         * @return the message followed by the per-attempt errors
         */
        public String describe() {
            return attemptErrors.isEmpty() ? message : message + " (" + String.join("; ", attemptErrors) + ")";
        }
    }
}
