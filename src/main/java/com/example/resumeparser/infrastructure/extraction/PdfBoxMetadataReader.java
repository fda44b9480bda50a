package com.example.resumeparser.infrastructure.extraction;

import com.example.resumeparser.domain.model.DocumentMetadata;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentCatalog;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.common.PDMetadata;
import org.apache.xmpbox.XMPMetadata;
import org.apache.xmpbox.schema.XMPBasicSchema;
import org.apache.xmpbox.xml.DomXmpParser;
import org.apache.xmpbox.xml.XmpParsingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Calendar;

/**
 * Turns PDFBox document information and XMP packets into {@link DocumentMetadata}.
 */
@Component
public class PdfBoxMetadataReader {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxMetadataReader.class);
    private static final DateTimeFormatter CALENDAR_FORMATTER = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    /**
     * Reads the metadata of an already opened document.
     *
     * @param document       opened PDF document
     * @param extractedPages number of pages the calling engine read
     * @return metadata, or {@code null} when no document is given
     */
    public DocumentMetadata read(PDDocument document, int extractedPages) {
        if (document == null) {
            return null;
        }
        PDDocumentInformation info = document.getDocumentInformation();
        return new DocumentMetadata(
                info != null ? info.getTitle() : null,
                info != null ? info.getAuthor() : null,
                info != null ? info.getCreator() : null,
                info != null ? info.getProducer() : null,
                info != null ? formatCalendar(info.getCreationDate()) : null,
                readCreatorTool(document.getDocumentCatalog()),
                String.valueOf(document.getVersion()),
                document.isEncrypted(),
                document.getNumberOfPages(),
                extractedPages
        );
    }

    /**
     * Pulls {@code xmp:CreatorTool} out of the XMP packet. Malformed packets are logged and ignored.
     */
    private String readCreatorTool(PDDocumentCatalog catalog) {
        if (catalog == null) {
            return null;
        }
        PDMetadata pdMetadata = catalog.getMetadata();
        if (pdMetadata == null) {
            return null;
        }
        try (InputStream metadataStream = pdMetadata.exportXMPMetadata()) {
            if (metadataStream == null) {
                return null;
            }
            DomXmpParser parser = new DomXmpParser();
            parser.setStrictParsing(false);
            XMPMetadata xmp = parser.parse(metadataStream);
            XMPBasicSchema basic = xmp.getXMPBasicSchema();
            return basic != null ? basic.getCreatorTool() : null;
        } catch (IOException | XmpParsingException ex) {
            log.warn("Failed to parse XMP metadata", ex);
            return null;
        }
    }

    private String formatCalendar(Calendar calendar) {
        if (calendar == null) {
            return null;
        }
        return CALENDAR_FORMATTER.format(calendar.toInstant().atOffset(ZoneOffset.UTC));
    }
}
