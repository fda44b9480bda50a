package com.example.resumeparser.interfaces.api;

import com.example.resumeparser.application.service.extraction.DocumentLoader;
import com.example.resumeparser.application.service.pipeline.PipelineResultExportService;
import com.example.resumeparser.application.service.pipeline.ResumeBatchProcessor;
import com.example.resumeparser.application.service.pipeline.ResumeProcessingPipeline;
import com.example.resumeparser.config.ResumePipelineProperties;
import com.example.resumeparser.domain.exception.DocumentNotFoundException;
import com.example.resumeparser.domain.exception.UnsupportedDocumentFormatException;
import com.example.resumeparser.domain.model.Document;
import com.example.resumeparser.domain.model.ExtractionMethod;
import com.example.resumeparser.domain.model.PipelineConfig;
import com.example.resumeparser.domain.model.PipelineResult;
import com.example.resumeparser.infrastructure.exception.ExtractionException;
import com.example.resumeparser.interfaces.api.error.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.BDDMockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.multipart.MultipartFile;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * WebMvc tests that validate the controller-to-exception-handler integration.
 */
@WebMvcTest(controllers = ResumeController.class)
@Import(GlobalExceptionHandler.class)
class ResumeControllerApiTests {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DocumentLoader documentLoader;

    @MockBean
    private ResumeProcessingPipeline pipeline;

    @MockBean
    private ResumeBatchProcessor batchProcessor;

    @MockBean
    private PipelineResultExportService exportService;

    @MockBean
    private ResumePipelineProperties properties;

    private final MockMultipartFile file =
            new MockMultipartFile("file", "cv.pdf", "application/pdf", "%PDF-1.4 data".getBytes());

    @BeforeEach
    void setUp() {
        BDDMockito.given(properties.toPipelineConfig()).willReturn(PipelineConfig.defaults());
    }

    @Test
    void parseReturnsPipelineResult() throws Exception {
        Document document = Document.ofBytes("cv.pdf", "%PDF-1.4 data".getBytes());
        BDDMockito.given(documentLoader.load(any(MultipartFile.class))).willReturn(document);
        BDDMockito.given(pipeline.process(any(Document.class), any(PipelineConfig.class))).willReturn(result());

        mockMvc.perform(multipart("/api/resumes/parse").file(file)
                        .param("jobDescription", "Senior Java developer")
                        .param("method", "tika"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.processingId").value("resume-cv.pdf"))
                .andExpect(jsonPath("$.overallSuccess").value(true));

        ArgumentCaptor<PipelineConfig> config = ArgumentCaptor.forClass(PipelineConfig.class);
        verify(pipeline).process(any(Document.class), config.capture());
        assertThat(config.getValue().hasTargetJob()).isTrue();
        assertThat(config.getValue().extraction().preferredMethod()).isEqualTo(ExtractionMethod.TIKA);
    }

    @Test
    void downloadReturnsAttachment() throws Exception {
        BDDMockito.given(documentLoader.load(any(MultipartFile.class)))
                .willReturn(Document.ofBytes("cv.pdf", new byte[]{1}));
        BDDMockito.given(pipeline.process(any(Document.class), any(PipelineConfig.class))).willReturn(result());
        BDDMockito.given(exportService.toJson(any(PipelineResult.class))).willReturn("{\"overallSuccess\":true}");
        BDDMockito.given(exportService.defaultFileName()).willReturn("resume_analysis_20240501_101530.json");

        mockMvc.perform(multipart("/api/resumes/parse/download").file(file))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition",
                        "attachment; filename=\"resume_analysis_20240501_101530.json\""))
                .andExpect(jsonPath("$.overallSuccess").value(true));
    }

    /**
     * Verifies that domain errors translate to HTTP 400 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void domainExceptionMappedToBadRequest() throws Exception {
        BDDMockito.given(documentLoader.load(any(MultipartFile.class)))
                .willThrow(new UnsupportedDocumentFormatException("cv.docx"));

        mockMvc.perform(multipart("/api/resumes/parse").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("DOMAIN_ERROR"));
    }

    @Test
    void missingDocumentMappedToNotFound() throws Exception {
        BDDMockito.given(documentLoader.load(any(MultipartFile.class)))
                .willThrow(new DocumentNotFoundException("cv.pdf"));

        mockMvc.perform(multipart("/api/resumes/parse").file(file))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("DOCUMENT_NOT_FOUND"));
    }

    /**
     * Verifies that infrastructure errors translate to HTTP 500 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void infrastructureExceptionMappedToServerError() throws Exception {
        BDDMockito.given(documentLoader.load(any(MultipartFile.class)))
                .willReturn(Document.ofBytes("cv.pdf", new byte[]{1}));
        BDDMockito.given(pipeline.process(any(Document.class), any(PipelineConfig.class)))
                .willThrow(new ExtractionException("Unable to read document"));

        mockMvc.perform(multipart("/api/resumes/parse").file(file))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("INFRASTRUCTURE_ERROR"));
    }

    @Test
    void missingFilePartMappedToBadRequest() throws Exception {
        mockMvc.perform(multipart("/api/resumes/parse"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("MISSING_REQUEST_PART"));
    }

    @Test
    void emptyBatchMappedToValidationError() throws Exception {
        mockMvc.perform(multipart("/api/resumes/batch"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("USE_CASE_VALIDATION_ERROR"));
    }

    private PipelineResult result() {
        return new PipelineResult("cv.pdf", "resume-cv.pdf", Instant.parse("2024-05-01T10:15:30Z"),
                Duration.ofMillis(40), Map.of(), null, null, null, null, true, 0.8, 0.7, 0.6, List.of(), List.of());
    }
}
