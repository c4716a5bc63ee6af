package eu.virtualparadox.ragqa.ingest.extractor;

import eu.virtualparadox.ragqa.ingest.model.EFileType;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.text.Normalizer;

/**
 * Extracts text from PDF (Apache PDFBox) and plain-text uploads.
 * <ul>
 *   <li>PDF pages are concatenated in order, each introduced by a {@code [Page n]} marker line
 *       so page numbers survive chunking and show up in retrieved context.</li>
 *   <li>Text files are decoded as UTF-8, falling back to ISO-8859-1 for invalid input.</li>
 * </ul>
 */
@Service
public final class PdfBoxTextExtractor implements TextExtractor {

    @Override
    public String extractText(final EFileType type, final byte[] content) {
        if (type == EFileType.PDF) {
            return extractPdf(content);
        }
        return decodeText(content);
    }

    private String extractPdf(final byte[] content) {
        try (PDDocument pdf = PDDocument.load(content)) {
            final int pageCount = pdf.getNumberOfPages();
            final PDFTextStripper stripper = new PDFTextStripper();

            final StringBuilder text = new StringBuilder();
            for (int page = 1; page <= pageCount; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);

                final String pageText = Normalizer.normalize(stripper.getText(pdf), Normalizer.Form.NFC);
                text.append("\n[Page ").append(page).append("]\n").append(pageText);
            }
            return text.toString().strip();
        }
        catch (Exception e) {
            throw new IllegalStateException("Failed to extract text from PDF", e);
        }
    }

    private String decodeText(final byte[] content) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString()
                    .strip();
        } catch (CharacterCodingException e) {
            return new String(content, StandardCharsets.ISO_8859_1).strip();
        }
    }
}
