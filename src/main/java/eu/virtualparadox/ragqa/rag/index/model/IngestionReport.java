package eu.virtualparadox.ragqa.rag.index.model;

/**
 * @param documentId       id the chunks were indexed under
 * @param filename         original file name
 * @param chunksProcessed  number of chunks now indexed for the document
 * @param processingTimeMs wall-clock time of segmenting, embedding and indexing
 */
public record IngestionReport(String documentId, String filename, int chunksProcessed, double processingTimeMs) {

}
