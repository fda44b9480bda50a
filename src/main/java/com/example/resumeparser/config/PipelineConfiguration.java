package com.example.resumeparser.config;

import com.example.resumeparser.application.service.extraction.EngineCapabilities;
import com.example.resumeparser.infrastructure.extraction.TextExtractionEngine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;

/**
 * Wires the pipeline: engine capabilities, the per-run configuration template and the two thread
 * pools (stage timeouts and batch processing).
 */
@Configuration
public class PipelineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfiguration.class);

    /**
     * Checks every extraction engine once at startup.
     */
    @Bean
    public EngineCapabilities engineCapabilities(List<TextExtractionEngine> engines, ResumePipelineProperties properties) {
        EngineCapabilities capabilities = EngineCapabilities.detect(engines, properties.getOcr().isEnabled());
        log.info("Available extraction engines: {}", capabilities.available());
        return capabilities;
    }

    /**
     * Runs stages that have a timeout so the caller can stop waiting for them.
     * <p>
     * Tasks are handed off without a queue: a timed-out stage that keeps running only occupies its own
     * thread, and later stages get a fresh one up to {@code stages.max-stage-threads}.
     */
    @Bean("pipelineStageExecutor")
    public AsyncTaskExecutor pipelineStageExecutor(ResumePipelineProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int coreThreads = Math.max(2, properties.getBatch().getConcurrency());
        executor.setCorePoolSize(coreThreads);
        executor.setMaxPoolSize(Math.max(coreThreads, properties.getStages().getMaxStageThreads()));
        executor.setQueueCapacity(0);
        executor.setKeepAliveSeconds(30);
        executor.setThreadNamePrefix("pipeline-stage-");
        executor.initialize();
        return executor;
    }

    /**
     * Bounded pool for batch runs, sized by {@code resume.pipeline.batch.concurrency}.
     */
    @Bean("resumeBatchExecutor")
    public AsyncTaskExecutor resumeBatchExecutor(ResumePipelineProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = Math.max(1, properties.getBatch().getConcurrency());
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("resume-batch-");
        executor.initialize();
        return executor;
    }
}
