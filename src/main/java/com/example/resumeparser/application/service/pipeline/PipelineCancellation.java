package com.example.resumeparser.application.service.pipeline;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for one pipeline run. The pipeline polls it between stages and
 * between extraction fallback attempts.
 */
public final class PipelineCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static PipelineCancellation none() {
        return new PipelineCancellation();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
