package eu.virtualparadox.ragqa.rag.index.model;

/**
 * Document-level view reconstructed from the chunks stored in the index.
 *
 * @param documentId      document identifier
 * @param filename        original file name, {@code "Unknown"} if absent
 * @param fileType        {@code pdf}, {@code txt} or {@code unknown}
 * @param uploadTimestamp ISO-8601 ingestion time, empty if absent
 * @param totalChunks     number of chunks currently indexed for the document
 */
public record IndexedDocument(String documentId,
                              String filename,
                              String fileType,
                              String uploadTimestamp,
                              int totalChunks) {

}
