package eu.virtualparadox.ragqa.ingest.extractor;

import eu.virtualparadox.ragqa.ingest.model.EFileType;

/**
 * Turns an uploaded file into the plain text consumed by the chunker.
 */
public interface TextExtractor {

    /**
     * @param type    file type, already validated by the caller
     * @param content raw file bytes
     * @return extracted text with surrounding whitespace removed, possibly empty
     * @throws IllegalStateException if the content cannot be read as {@code type}
     */
    String extractText(final EFileType type, final byte[] content);

}
