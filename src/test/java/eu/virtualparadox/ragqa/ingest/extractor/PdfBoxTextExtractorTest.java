package eu.virtualparadox.ragqa.ingest.extractor;

import eu.virtualparadox.ragqa.ingest.model.EFileType;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class PdfBoxTextExtractorTest {

    private final PdfBoxTextExtractor extractor = new PdfBoxTextExtractor();

    // ---------- Helpers ----------

    private static byte[] createPdf(String... pages) throws IOException {
        try (PDDocument doc = new PDDocument()) {
            for (String text : pages) {
                PDPage page = new PDPage();
                doc.addPage(page);
                try (PDPageContentStream cs = new PDPageContentStream(doc, page)) {
                    cs.beginText();
                    cs.setFont(PDType1Font.HELVETICA, 12);
                    cs.newLineAtOffset(72, 700);
                    cs.showText(text);
                    cs.endText();
                }
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            doc.save(out);
            return out.toByteArray();
        }
    }

    // ---------- Tests ----------

    @Test
    @DisplayName("PDF pages are extracted in order with page markers")
    void pdfWithPageMarkers() throws IOException {
        byte[] pdf = createPdf("Paris is the capital of France.", "Berlin is the capital of Germany.");

        String text = extractor.extractText(EFileType.PDF, pdf);

        assertTrue(text.startsWith("[Page 1]"));
        int page1 = text.indexOf("Paris is the capital of France.");
        int marker2 = text.indexOf("[Page 2]");
        int page2 = text.indexOf("Berlin is the capital of Germany.");
        assertTrue(page1 > 0 && marker2 > page1 && page2 > marker2, text);
    }

    @Test
    @DisplayName("Corrupt PDF bytes fail with IllegalStateException")
    void corruptPdf() {
        byte[] garbage = "definitely not a pdf".getBytes(StandardCharsets.US_ASCII);
        assertThrows(IllegalStateException.class, () -> extractor.extractText(EFileType.PDF, garbage));
    }

    @Test
    @DisplayName("Text files are decoded as UTF-8 and stripped")
    void utf8Text() {
        byte[] content = "  Árvíztűrő tükörfúrógép \n".getBytes(StandardCharsets.UTF_8);
        assertEquals("Árvíztűrő tükörfúrógép", extractor.extractText(EFileType.TXT, content));
    }

    @Test
    @DisplayName("Invalid UTF-8 falls back to ISO-8859-1")
    void latin1Fallback() {
        byte[] content = "café crème".getBytes(StandardCharsets.ISO_8859_1);
        assertEquals("café crème", extractor.extractText(EFileType.TXT, content));
    }
}
