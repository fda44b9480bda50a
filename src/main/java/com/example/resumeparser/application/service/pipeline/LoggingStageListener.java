package com.example.resumeparser.application.service.pipeline;

import com.example.resumeparser.domain.model.PipelineResult;
import com.example.resumeparser.domain.model.PipelineStage;
import com.example.resumeparser.domain.model.StageStatus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes stage transitions to the application log.
 */
@Component
public class LoggingStageListener implements StageListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingStageListener.class);

    @Override
    public void onStageStatus(String processingId, PipelineStage stage, StageStatus status) {
        if (status == StageStatus.FAILED) {
            log.warn("[{}] {} -> {}", processingId, stage.displayName(), status);
        } else {
            log.debug("[{}] {} -> {}", processingId, stage.displayName(), status);
        }
    }

    @Override
    public void onPipelineFinished(PipelineResult result) {
        log.info("[{}] finished {} in {} ms: success={}, confidence={}, errors={}, warnings={}",
                result.processingId(), result.inputRef(), result.totalTime().toMillis(), result.overallSuccess(),
                String.format("%.2f", result.confidenceScore()), result.errors().size(), result.warnings().size());
    }
}
