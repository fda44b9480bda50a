package com.example.resumeparser.application.service.extraction;

import com.example.resumeparser.domain.model.ExtractionMethod;
import com.example.resumeparser.domain.model.ExtractionResult;

/**
 * Result of running one engine: either scored text or the failure message.
 */
public sealed interface EngineOutcome {

    ExtractionMethod method();

    record Succeeded(ExtractionResult result) implements EngineOutcome {
        @Override
        public ExtractionMethod method() {
            return result.method();
        }
    }

    record Failed(ExtractionMethod method, String error) implements EngineOutcome {
    }
}
