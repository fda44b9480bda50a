package com.example.resumeparser.application.service.extraction;

import com.example.resumeparser.domain.exception.DocumentNotFoundException;
import com.example.resumeparser.domain.exception.DocumentPathRequiredException;
import com.example.resumeparser.domain.exception.DocumentRequiredException;
import com.example.resumeparser.domain.exception.UnsupportedDocumentFormatException;
import com.example.resumeparser.domain.model.Document;
import com.example.resumeparser.infrastructure.exception.ExtractionException;

import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Turns files on disk and HTTP uploads into {@link Document}s, validating them on the way.
 */
@Component
public class DocumentLoader {

    /**
     * Reads a résumé from the filesystem.
     *
     * @param path path pointing to a PDF on disk
     * @return loaded document
     * @throws DocumentPathRequiredException when {@code path} is null
     * @throws DocumentNotFoundException     when the path does not exist
     * @throws ExtractionException           when the file cannot be read
     */
    public Document load(Path path) {
        if (path == null) {
            throw new DocumentPathRequiredException();
        }
        if (!Files.exists(path)) {
            throw new DocumentNotFoundException(path.toAbsolutePath().toString());
        }
        try {
            byte[] bytes = Files.readAllBytes(path);
            String fileName = path.getFileName() != null ? path.getFileName().toString() : "resume.pdf";
            return new Document(fileName, path.toString(), bytes);
        } catch (IOException e) {
            throw new ExtractionException("Unable to read the document at " + path, e);
        }
    }

    /**
     * Reads an uploaded résumé.
     *
     * @param file uploaded file
     * @return in-memory document
     * @throws DocumentRequiredException         when the upload is missing or empty
     * @throws UnsupportedDocumentFormatException when the upload does not look like a PDF
     * @throws ExtractionException               when the upload cannot be read
     */
    public Document load(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new DocumentRequiredException();
        }
        if (!looksLikePdf(file)) {
            throw new UnsupportedDocumentFormatException(file.getOriginalFilename());
        }
        try {
            return Document.ofBytes(resolveFileName(file), file.getBytes());
        } catch (IOException e) {
            throw new ExtractionException("Unable to read the uploaded document.", e);
        }
    }

    private boolean looksLikePdf(MultipartFile file) {
        String contentType = file.getContentType();
        if (contentType != null && contentType.equalsIgnoreCase("application/pdf")) {
            return true;
        }
        String fileName = file.getOriginalFilename();
        return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    private String resolveFileName(MultipartFile file) {
        String fileName = file.getOriginalFilename();
        if (fileName == null || fileName.isBlank()) {
            return "uploaded.pdf";
        }
        return fileName;
    }
}
