package com.example.resumeparser.infrastructure.extraction;

import com.example.resumeparser.domain.model.DocumentMetadata;
import com.example.resumeparser.domain.model.ExtractionConfig;
import com.example.resumeparser.domain.model.ExtractionMethod;
import com.example.resumeparser.infrastructure.exception.ExtractionException;

import org.apache.tika.exception.TikaException;
import org.apache.tika.extractor.EmbeddedDocumentExtractor;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.PagedText;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.apache.tika.sax.ContentHandlerDecorator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.xml.sax.Attributes;
import org.xml.sax.ContentHandler;
import org.xml.sax.SAXException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Extracts text through Apache Tika's auto-detecting parser.
 * Tika reads the whole document in one pass, so the page limit only caps the reported page count.
 * The parse stops at the next element when the calling thread is interrupted.
 */
@Component
public class TikaTextEngine implements TextExtractionEngine {

    private static final Logger log = LoggerFactory.getLogger(TikaTextEngine.class);

    private final AutoDetectParser parser = new AutoDetectParser();

    @Override
    public ExtractionMethod method() {
        return ExtractionMethod.TIKA;
    }

    @Override
    public boolean isSupported() {
        return true;
    }

    @Override
    public RawExtraction extract(byte[] content, ExtractionConfig config) throws IOException {
        Metadata metadata = new Metadata();
        BodyContentHandler handler = new BodyContentHandler(-1);
        ParseContext context = new ParseContext();
        // Embedded attachments are not part of the résumé text.
        context.set(EmbeddedDocumentExtractor.class, new EmbeddedDocumentExtractor() {
            @Override
            public boolean shouldParseEmbedded(Metadata embeddedMetadata) {
                return false;
            }

            @Override
            public void parseEmbedded(InputStream stream, ContentHandler embeddedHandler,
                                      Metadata embeddedMetadata, boolean outputHtml) {
                // not parsed
            }
        });

        try (InputStream input = new ByteArrayInputStream(content)) {
            parser.parse(input, new InterruptibleHandler(handler), metadata, context);
        } catch (SAXException | TikaException ex) {
            if (Thread.currentThread().isInterrupted()) {
                throw new ExtractionException(method() + " interrupted", ex);
            }
            throw new ExtractionException("Tika could not parse the document: " + ex.getMessage(), ex);
        }

        int pageCount = readPageCount(metadata);
        int processed = config.pagesToRead(pageCount);
        log.debug("Tika parsed {} pages of type {}", pageCount, metadata.get(Metadata.CONTENT_TYPE));
        DocumentMetadata documentMetadata = new DocumentMetadata(
                metadata.get(TikaCoreProperties.TITLE),
                metadata.get(TikaCoreProperties.CREATOR),
                metadata.get(TikaCoreProperties.CREATOR_TOOL),
                metadata.get("pdf:producer"),
                metadata.get(TikaCoreProperties.CREATED),
                metadata.get(TikaCoreProperties.CREATOR_TOOL),
                metadata.get("pdf:PDFVersion"),
                Boolean.parseBoolean(metadata.get("pdf:encrypted")),
                pageCount,
                processed
        );
        return new RawExtraction(handler.toString().strip(), pageCount, processed, null, documentMetadata);
    }

    private int readPageCount(Metadata metadata) {
        Integer pages = metadata.getInt(PagedText.N_PAGES);
        return pages != null ? pages : 1;
    }

    private static final class InterruptibleHandler extends ContentHandlerDecorator {

        private InterruptibleHandler(ContentHandler delegate) {
            super(delegate);
        }

        @Override
        public void startElement(String uri, String localName, String name, Attributes atts) throws SAXException {
            checkInterrupted();
            super.startElement(uri, localName, name, atts);
        }

        @Override
        public void characters(char[] ch, int start, int length) throws SAXException {
            checkInterrupted();
            super.characters(ch, start, length);
        }

        private void checkInterrupted() throws SAXException {
            if (Thread.currentThread().isInterrupted()) {
                throw new SAXException("Parsing interrupted");
            }
        }
    }
}
