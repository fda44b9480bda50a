package com.example.resumeparser.application.service.pipeline;

import com.example.resumeparser.domain.model.PipelineResult;
import com.example.resumeparser.domain.model.PipelineStage;
import com.example.resumeparser.domain.model.StageStatus;

/**
 * Observer of stage transitions. Called on the thread that runs the pipeline; implementations
 * should return quickly. Exceptions thrown here are logged and ignored.
 */
public interface StageListener {

    void onStageStatus(String processingId, PipelineStage stage, StageStatus status);

    default void onPipelineFinished(PipelineResult result) {
    }
}
