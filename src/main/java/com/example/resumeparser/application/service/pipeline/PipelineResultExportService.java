package com.example.resumeparser.application.service.pipeline;

import com.example.resumeparser.application.exception.ResultExportValidationException;
import com.example.resumeparser.domain.model.PipelineResult;
import com.example.resumeparser.infrastructure.exception.ExportException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Application-layer service that turns pipeline results into pretty-printed JSON documents.
 */
@Service
public class PipelineResultExportService {

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public PipelineResultExportService(ObjectMapper objectMapper) {
        this(objectMapper, Clock.systemDefaultZone());
    }

    PipelineResultExportService(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.clock = clock;
    }

	/**
	 * Serializes the result.
	 *
	 * @param result finished pipeline result
	 * @return indented JSON
	 * @throws ResultExportValidationException when there is no result
	 */
    public String toJson(PipelineResult result) {
        if (result == null) {
            throw new ResultExportValidationException("No pipeline result available for export.");
        }
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new ExportException("Unable to serialize pipeline result " + result.processingId(), e);
        }
    }

	/**
	 * Writes the result to {@code target}, or to {@code resume_analysis_<timestamp>.json} in the
	 * working directory when no target is given.
	 *
	 * @return the written file
	 */
    public Path export(PipelineResult result, Path target) {
        String json = toJson(result);
        Path destination = target != null ? target : Path.of(defaultFileName());
        try {
            Path parent = destination.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(destination, json, StandardCharsets.UTF_8);
            return destination;
        } catch (IOException e) {
            throw new ExportException("Unable to write pipeline result to " + destination, e);
        }
    }

    public String defaultFileName() {
        return "resume_analysis_" + LocalDateTime.now(clock).format(FILE_TIMESTAMP) + ".json";
    }
}
