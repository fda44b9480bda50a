package com.example.resumeparser.infrastructure.extraction;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

/**
 * Builds small PDFs in memory for the extraction tests.
 */
public final class PdfFixtures {

    private PdfFixtures() {
    }

    /**
     * Creates a PDF with one page per entry of {@code pages}; each entry holds the lines of that page.
     *
     * @param title document title written to the information dictionary, may be {@code null}
     * @param pages lines per page
     * @return PDF bytes
     * @throws IOException when PDFBox cannot create or save the document
     */
    public static byte[] createPdf(String title, List<List<String>> pages) throws IOException {
        try (PDDocument document = new PDDocument();
             ByteArrayOutputStream outputStream = new ByteArrayOutputStream()) {
            if (title != null) {
                document.getDocumentInformation().setTitle(title);
            }
            PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
            for (List<String> lines : pages) {
                PDPage page = new PDPage(PDRectangle.LETTER);
                document.addPage(page);
                try (PDPageContentStream contentStream = new PDPageContentStream(document, page)) {
                    contentStream.beginText();
                    contentStream.setFont(font, 12);
                    contentStream.setLeading(16);
                    contentStream.newLineAtOffset(72, 700);
                    for (String line : lines) {
                        contentStream.showText(line);
                        contentStream.newLine();
                    }
                    contentStream.endText();
                }
            }
            document.save(outputStream);
            return outputStream.toByteArray();
        }
    }

    /**
     * @return a two-page résumé
     */
    public static byte[] twoPageResume() throws IOException {
        return createPdf("Jane Roe Resume", List.of(
                List.of("Jane Roe", "jane@roe.dev | +1-415-555-0199", "", "Experience",
                        "Staff Engineer at Initrode | Jan 2019 - Present",
                        "- Designed the event platform on Kafka and Kubernetes"),
                List.of("Education", "Master of Science in Computer Science, Stanford University, 2012",
                        "", "Skills", "Java, Kotlin, SQL")));
    }
}
