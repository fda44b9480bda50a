package com.example.resumeparser.interfaces.api;

import com.example.resumeparser.application.exception.BatchRequestValidationException;
import com.example.resumeparser.application.service.extraction.DocumentLoader;
import com.example.resumeparser.application.service.pipeline.PipelineResultExportService;
import com.example.resumeparser.application.service.pipeline.ResumeBatchProcessor;
import com.example.resumeparser.application.service.pipeline.ResumeProcessingPipeline;
import com.example.resumeparser.config.ResumePipelineProperties;
import com.example.resumeparser.domain.model.BatchReport;
import com.example.resumeparser.domain.model.Document;
import com.example.resumeparser.domain.model.ExtractionMethod;
import com.example.resumeparser.domain.model.PipelineConfig;
import com.example.resumeparser.domain.model.PipelineResult;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Interfaces-layer REST controller that accepts résumé uploads and returns pipeline results as JSON.
 */
@RestController
@RequestMapping("/api/resumes")
public class ResumeController {

    private final DocumentLoader documentLoader;
    private final ResumeProcessingPipeline pipeline;
    private final ResumeBatchProcessor batchProcessor;
    private final PipelineResultExportService exportService;
    private final ResumePipelineProperties properties;

    /**
     * Creates the controller with the required application services.
     *
     * @param documentLoader validates uploads and turns them into documents
     * @param pipeline       runs one résumé through every stage
     * @param batchProcessor runs many résumés concurrently
     * @param exportService  renders results as downloadable JSON
     * @param properties     bound defaults for every run
     */
    public ResumeController(DocumentLoader documentLoader,
                            ResumeProcessingPipeline pipeline,
                            ResumeBatchProcessor batchProcessor,
                            PipelineResultExportService exportService,
                            ResumePipelineProperties properties) {
        this.documentLoader = documentLoader;
        this.pipeline = pipeline;
        this.batchProcessor = batchProcessor;
        this.exportService = exportService;
        this.properties = properties;
    }

    /**
     * Parses one uploaded résumé.
     *
     * @param file           uploaded PDF
     * @param jobDescription optional job text; turns on job matching when present
     * @param method         optional engine override ({@code auto} or an engine name)
     * @return the pipeline result, also when the document could not be processed
     */
    @PostMapping(value = "/parse", consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PipelineResult> parse(@RequestParam("file") MultipartFile file,
                                                @RequestParam(value = "jobDescription", required = false) String jobDescription,
                                                @RequestParam(value = "method", required = false) String method) {
        Document document = documentLoader.load(file);
        return ResponseEntity.ok(pipeline.process(document, requestConfig(jobDescription, method)));
    }

    /**
     * Parses one uploaded résumé and streams the result as a JSON attachment.
     */
    @PostMapping(value = "/parse/download", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<byte[]> parseAndDownload(@RequestParam("file") MultipartFile file,
                                                   @RequestParam(value = "jobDescription", required = false) String jobDescription) {
        Document document = documentLoader.load(file);
        PipelineResult result = pipeline.process(document, requestConfig(jobDescription, null));
        String json = exportService.toJson(result);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + exportService.defaultFileName() + "\"")
                .contentType(MediaType.APPLICATION_JSON)
                .body(json.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Parses several uploaded résumés concurrently.
     *
     * @param files uploaded PDFs
     * @return per-file results in upload order with a summary
     */
    @PostMapping(value = "/batch", consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<BatchReport> batch(@RequestParam(value = "files", required = false) List<MultipartFile> files,
                                             @RequestParam(value = "jobDescription", required = false) String jobDescription) {
        if (files == null || files.isEmpty()) {
            throw new BatchRequestValidationException("Please choose at least one résumé file.");
        }
        List<Document> documents = files.stream().map(documentLoader::load).toList();
        return ResponseEntity.ok(batchProcessor.processDocuments(documents, requestConfig(jobDescription, null)));
    }

    private PipelineConfig requestConfig(String jobDescription, String method) {
        PipelineConfig config = properties.toPipelineConfig();
        if (method != null && !method.isBlank()) {
            config = config.withExtraction(config.extraction().withPreferredMethod(ExtractionMethod.fromString(method)));
        }
        if (jobDescription != null && !jobDescription.isBlank()) {
            config = config.withTargetJobDescription(jobDescription);
        }
        return config;
    }
}
